package com.splitduck.cli;

import ch.qos.logback.classic.Level;
import com.splitduck.exception.SplitDuckException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;

/**
 * Command-line interface for sampling, shuffling and splitting datasets.
 *
 * <p>Usage examples:
 * <pre>
 * # 100 random rows, reproducible
 * java -jar splitduck-cli.jar sample data.parquet -n 100 --random 42 -o sample.parquet
 *
 * # Stratified sample printed to the console
 * java -jar splitduck-cli.jar sample data.csv -n 20 --method stratified --stratify-by species
 *
 * # 70/20/10 split into train/validation/test
 * java -jar splitduck-cli.jar split data.parquet --ratio 70,20,10 \
 *   --names train,validation,test --output-dir out --random 7
 * </pre>
 *
 * <p>Exit status: 0 on success, 1 for invalid input (arguments, columns,
 * categories, formats), 2 when the engine fails.
 */
public class SplitDuckCommandLine {

    private static final Logger logger = LoggerFactory.getLogger(SplitDuckCommandLine.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USER_ERROR = 1;
    static final int EXIT_ENGINE_ERROR = 2;

    private static final String USAGE =
        "splitduck - reproducible sampling, shuffling and splitting of tabular files\n\n" +
        "Usage: splitduck <command> <input> [OPTIONS]\n\n" +
        "Commands:\n" +
        "  sample    Draw a sample of rows\n" +
        "  shuffle   Shuffle all rows\n" +
        "  split     Split rows into several files by ratio\n\n" +
        "Common options:\n" +
        "  -r, --random SEED        Seed for reproducible results (0 to 2^64-1)\n" +
        "  -f, --format FORMAT      Output format: parquet, csv, json, xlsx\n" +
        "  -j, --jobs N             Number of engine threads\n" +
        "  -v, --verbose            Print progress to stderr\n" +
        "  -h, --help               Show this help message\n\n" +
        "sample options:\n" +
        "  -n, --number N           Number of rows (default 10)\n" +
        "  --method METHOD          random, stratified, first or last (default random)\n" +
        "  --stratify-by COL        Column for stratified sampling\n" +
        "  -o, --output FILE        Output file (prints a table when omitted)\n\n" +
        "shuffle options:\n" +
        "  -o, --output FILE        Output file (prints a table when omitted)\n\n" +
        "split options:\n" +
        "  --ratio R1,R2,...        Ratios summing to 1.0 or 100 (e.g. 0.7,0.3 or 70,30)\n" +
        "  --names N1,N2,...        Output file names, one per ratio\n" +
        "  --splits-prefix P        Prefix of generated names (default split)\n" +
        "  --output-dir DIR         Output directory (default .)\n" +
        "  --stratified-by COL      Column for stratified splitting\n";

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        System.exit(status);
    }

    /**
     * Runs one command.
     *
     * @param args the command line, starting with the command name
     * @param out destination of results and help
     * @param err destination of errors and progress
     * @return the exit status
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0 || args[0].equals("--help") || args[0].equals("-h")) {
            out.println(USAGE);
            return args.length == 0 ? EXIT_USER_ERROR : EXIT_OK;
        }

        try {
            CommandLineArgs parsed = CommandLineArgs.parse(args[0], Arrays.copyOfRange(args, 1, args.length));
            if (parsed.help) {
                out.println(USAGE);
                return EXIT_OK;
            }
            if (parsed.verbose) {
                enableDebugLogging();
            }

            Command command;
            switch (parsed.command) {
                case CommandLineArgs.SAMPLE:
                    command = new SampleCommand(parsed, out, err);
                    break;
                case CommandLineArgs.SHUFFLE:
                    command = new ShuffleCommand(parsed, out, err);
                    break;
                default:
                    command = new SplitCommand(parsed, out, err);
                    break;
            }
            command.run();
            return EXIT_OK;

        } catch (SplitDuckException e) {
            err.println("Error: " + e.getUserMessage());
            if (logger.isDebugEnabled()) {
                logger.debug(e.getTechnicalMessage(), e);
            }
            return e.isUserError() ? EXIT_USER_ERROR : EXIT_ENGINE_ERROR;
        } catch (RuntimeException e) {
            err.println("Error: " + e.getMessage());
            logger.debug("Command failed", e);
            return EXIT_ENGINE_ERROR;
        }
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger("com.splitduck");
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
