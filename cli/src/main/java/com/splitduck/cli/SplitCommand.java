package com.splitduck.cli;

import com.splitduck.exception.InvalidArgumentException;
import com.splitduck.io.FileFormat;
import com.splitduck.logical.LogicalPlan;
import com.splitduck.rowstore.RowStore;
import com.splitduck.sampling.Partitioner;
import com.splitduck.sampling.SplitPart;
import com.splitduck.sampling.SplitSpec;
import com.splitduck.sampling.TieredShuffleStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code split <input> --ratio R1,R2,... [--names N1,...] [--splits-prefix P]
 * [--output-dir DIR] [--stratified-by COL] [-r SEED] [-f FORMAT]}
 *
 * <p>Without {@code --names}, parts are named {@code <prefix>_1.<ext>},
 * {@code <prefix>_2.<ext>} and so on. Names without a known format
 * extension get the output format's extension; each file is written in the
 * format its name ends with.
 */
final class SplitCommand extends Command {

    private static final Logger logger = LoggerFactory.getLogger(SplitCommand.class);

    private SplitSpec spec;
    private FileFormat format;
    private Path outputDir;

    SplitCommand(CommandLineArgs args, PrintStream out, PrintStream err) {
        super(args, out, err);
    }

    @Override
    protected void validate() {
        if (args.ratio == null) {
            throw new InvalidArgumentException("--ratio is required");
        }
        List<Double> ratios = SplitSpec.parseRatios(args.ratio);
        format = outputFormat(null);
        outputDir = Paths.get(args.outputDir);

        List<Path> destinations = new ArrayList<>();
        if (args.names != null) {
            for (String name : args.names.split(",", -1)) {
                String trimmed = name.trim();
                if (trimmed.isEmpty()) {
                    throw new InvalidArgumentException("Empty name in --names: " + args.names);
                }
                destinations.add(outputDir.resolve(destinationName(trimmed)));
            }
        } else {
            for (int i = 0; i < ratios.size(); i++) {
                destinations.add(outputDir.resolve(args.splitsPrefix + "_" + (i + 1) + "." + format.extension()));
            }
        }
        spec = SplitSpec.of(ratios, destinations);
    }

    /**
     * Keeps a name that already ends in a known format extension, otherwise
     * appends the output format's extension.
     */
    private String destinationName(String name) {
        Optional<FileFormat> named = FileFormat.detect(Paths.get(name));
        if (named.isEmpty()) {
            return name + "." + format.extension();
        }
        if (args.format != null && named.get() != format) {
            throw new InvalidArgumentException("Name '" + name + "' does not match output format "
                + format.extension() + "; drop the extension or change --format");
        }
        return name;
    }

    @Override
    protected void execute(RowStore store, LogicalPlan source, TieredShuffleStrategy shuffler) {
        if (!Files.isDirectory(outputDir)) {
            try {
                Files.createDirectories(outputDir);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create output directory " + outputDir, e);
            }
            progress("Created output directory: " + outputDir);
        }

        if (args.stratifyBy != null) {
            progress("Performing stratified split by column '" + args.stratifyBy + "' with " + spec);
        } else {
            progress("Splitting into " + spec.size() + " parts with " + spec);
        }

        List<SplitPart> parts = new Partitioner(store, shuffler).split(source, spec, args.stratifyBy, args.seed);
        for (SplitPart part : parts) {
            progress("Writing split " + (part.index() + 1) + ": " + part.rowCount() + " rows -> " + part.destination());
            store.write(part.view(), part.destination(), FileFormat.fromPath(part.destination()));
        }
        logger.info("Split complete: {} files created in {}", parts.size(), outputDir);
    }
}
