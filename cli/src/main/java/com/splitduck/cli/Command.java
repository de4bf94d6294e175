package com.splitduck.cli;

import com.splitduck.io.FileFormat;
import com.splitduck.logical.LogicalPlan;
import com.splitduck.rowstore.RowStore;
import com.splitduck.runtime.DuckDBRuntime;
import com.splitduck.runtime.RuntimeConfig;
import com.splitduck.sampling.ShuffleConfig;
import com.splitduck.sampling.TieredShuffleStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Base class of the subcommands.
 *
 * <p>Validates the arguments, then opens a DuckDB runtime and a row store
 * scoped to the command, loads the input file and hands over to
 * {@link #execute}. Both are closed before returning, on every path.
 */
abstract class Command {

    private static final Logger logger = LoggerFactory.getLogger(Command.class);

    protected final CommandLineArgs args;
    protected final PrintStream out;
    protected final PrintStream err;

    protected Command(CommandLineArgs args, PrintStream out, PrintStream err) {
        this.args = args;
        this.out = out;
        this.err = err;
    }

    /**
     * Checks every argument that can be checked without reading data.
     * Nothing is written before this returns.
     */
    protected abstract void validate();

    /**
     * Runs the command against the loaded input.
     *
     * @param store the command's row store
     * @param source view over the input file
     * @param shuffler the tiered shuffle bound to the row store
     */
    protected abstract void execute(RowStore store, LogicalPlan source, TieredShuffleStrategy shuffler);

    final void run() {
        validate();

        Path input = Paths.get(args.input);
        FileFormat inputFormat = FileFormat.fromPath(input);

        RuntimeConfig config = RuntimeConfig.defaults();
        if (args.jobs.isPresent()) {
            config = config.withJobs(args.jobs.getAsInt());
        }

        long start = System.currentTimeMillis();
        try (DuckDBRuntime runtime = DuckDBRuntime.create(config);
             RowStore store = new RowStore(runtime)) {
            progress("Reading data from: " + input);
            LogicalPlan source = store.register(input, inputFormat);
            TieredShuffleStrategy shuffler = new TieredShuffleStrategy(store, ShuffleConfig.fromSystemProperties());
            execute(store, source, shuffler);
        }
        logger.info("{} completed in {} ms", args.command, System.currentTimeMillis() - start);
    }

    /**
     * Prints a progress line to stderr when running verbose.
     */
    protected void progress(String message) {
        if (args.verbose) {
            err.println(message);
        }
    }

    /**
     * Resolves the output format: the explicit format option, else the
     * extension of {@code output}, else the input's format, else Parquet.
     */
    protected FileFormat outputFormat(Path output) {
        if (args.format != null) {
            return FileFormat.fromName(args.format);
        }
        if (output != null) {
            Optional<FileFormat> detected = FileFormat.detect(output);
            if (detected.isPresent()) {
                return detected.get();
            }
        }
        return FileFormat.detect(Paths.get(args.input)).orElse(FileFormat.PARQUET);
    }

    /**
     * Writes a view to the output path, or prints it when there is none.
     */
    protected void emit(RowStore store, LogicalPlan view) {
        long rows = store.count(view);
        if (args.output == null) {
            ResultPrinter.print(store.collect(view, ResultPrinter.MAX_ROWS), rows, out);
            return;
        }
        Path output = Paths.get(args.output);
        FileFormat format = outputFormat(output);
        progress("Writing " + rows + " rows to: " + output);
        store.write(view, output, format);
        logger.info("Wrote {} rows to {} ({})", rows, output, format);
    }
}
