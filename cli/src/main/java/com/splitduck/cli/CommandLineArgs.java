package com.splitduck.cli;

import com.splitduck.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.HashSet;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Container for parsed command-line arguments of one subcommand.
 *
 * <p>Every subcommand shares this holder; options that a subcommand does
 * not accept are rejected while parsing.
 */
final class CommandLineArgs {

    static final String SAMPLE = "sample";
    static final String SHUFFLE = "shuffle";
    static final String SPLIT = "split";

    private static final Set<String> COMMON_OPTIONS = Set.of(
        "-r", "--random", "-f", "--format", "-j", "--jobs", "-v", "--verbose", "-h", "--help");
    private static final Set<String> SAMPLE_OPTIONS = Set.of(
        "-n", "--number", "--method", "--stratify-by", "-o", "--output");
    private static final Set<String> SHUFFLE_OPTIONS = Set.of(
        "-o", "--output");
    private static final Set<String> SPLIT_OPTIONS = Set.of(
        "--ratio", "--names", "--splits-prefix", "--output-dir", "--stratified-by");

    final String command;
    String input = null;
    long number = 10;
    String method = "random";
    String stratifyBy = null;
    String output = null;
    String format = null;
    OptionalLong seed = OptionalLong.empty();
    OptionalInt jobs = OptionalInt.empty();
    boolean verbose = false;
    boolean help = false;
    String ratio = null;
    String names = null;
    String splitsPrefix = "split";
    String outputDir = ".";

    private CommandLineArgs(String command) {
        this.command = command;
    }

    /**
     * Parses the arguments following the subcommand name.
     *
     * @param command the subcommand
     * @param args the remaining arguments
     * @return the parsed arguments
     * @throws InvalidArgumentException on unknown options, missing values or
     *         malformed numbers
     */
    static CommandLineArgs parse(String command, String[] args) {
        CommandLineArgs result = new CommandLineArgs(command);
        Set<String> allowed = allowedOptions(command);

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-") || arg.equals("-")) {
                if (result.input != null) {
                    throw new InvalidArgumentException("Unexpected argument: " + arg);
                }
                result.input = arg;
                continue;
            }
            if (!allowed.contains(arg)) {
                throw new InvalidArgumentException("Unknown option for " + command + ": " + arg);
            }

            switch (arg) {
                case "-n":
                case "--number":
                    result.number = parseCount(arg, value(args, ++i, arg));
                    break;
                case "--method":
                    result.method = value(args, ++i, arg);
                    break;
                case "--stratify-by":
                case "--stratified-by":
                    result.stratifyBy = value(args, ++i, arg);
                    break;
                case "-o":
                case "--output":
                    result.output = value(args, ++i, arg);
                    break;
                case "-f":
                case "--format":
                    result.format = value(args, ++i, arg);
                    break;
                case "-r":
                case "--random":
                    result.seed = OptionalLong.of(parseSeed(value(args, ++i, arg)));
                    break;
                case "-j":
                case "--jobs":
                    result.jobs = OptionalInt.of(parseJobs(value(args, ++i, arg)));
                    break;
                case "--ratio":
                    result.ratio = value(args, ++i, arg);
                    break;
                case "--names":
                    result.names = value(args, ++i, arg);
                    break;
                case "--splits-prefix":
                    result.splitsPrefix = value(args, ++i, arg);
                    break;
                case "--output-dir":
                    result.outputDir = value(args, ++i, arg);
                    break;
                case "-v":
                case "--verbose":
                    result.verbose = true;
                    break;
                case "-h":
                case "--help":
                    result.help = true;
                    break;
                default:
                    throw new InvalidArgumentException("Unknown option: " + arg);
            }
        }

        if (!result.help && result.input == null) {
            throw new InvalidArgumentException("Missing input file");
        }
        return result;
    }

    private static Set<String> allowedOptions(String command) {
        Set<String> allowed = new HashSet<>(COMMON_OPTIONS);
        switch (command) {
            case SAMPLE:
                allowed.addAll(SAMPLE_OPTIONS);
                break;
            case SHUFFLE:
                allowed.addAll(SHUFFLE_OPTIONS);
                break;
            case SPLIT:
                allowed.addAll(SPLIT_OPTIONS);
                break;
            default:
                throw new InvalidArgumentException("Unknown command: " + command
                    + ". Expected one of " + Arrays.asList(SAMPLE, SHUFFLE, SPLIT));
        }
        return allowed;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new InvalidArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static long parseCount(String option, String value) {
        try {
            long count = Long.parseLong(value.trim());
            if (count < 0) {
                throw new InvalidArgumentException(option + " must not be negative: " + value);
            }
            return count;
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Invalid number for " + option + ": " + value, e);
        }
    }

    private static long parseSeed(String value) {
        try {
            return Long.parseUnsignedLong(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Invalid seed: " + value + " (expected 0 to 18446744073709551615)", e);
        }
    }

    private static int parseJobs(String value) {
        try {
            int jobs = Integer.parseInt(value.trim());
            if (jobs <= 0) {
                throw new InvalidArgumentException("--jobs must be positive: " + value);
            }
            return jobs;
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Invalid number of jobs: " + value, e);
        }
    }
}
