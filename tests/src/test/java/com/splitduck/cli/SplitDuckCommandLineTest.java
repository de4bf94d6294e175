package com.splitduck.cli;

import com.splitduck.test.TestBase;
import com.splitduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("Command line")
public class SplitDuckCommandLineTest extends TestBase {

    @TempDir
    Path tempDir;

    private Path input;
    private String stdout;
    private String stderr;

    @Override
    protected void doSetUp() throws Exception {
        StringBuilder csv = new StringBuilder("id,species\n");
        for (int i = 0; i < 20; i++) {
            csv.append(i).append(',').append(i % 2 == 0 ? "setosa" : "virginica").append('\n');
        }
        input = tempDir.resolve("iris.csv");
        Files.writeString(input, csv.toString());
    }

    private int run(String... args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int status;
        try (PrintStream outStream = new PrintStream(out, true, StandardCharsets.UTF_8);
             PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8)) {
            status = SplitDuckCommandLine.run(args, outStream, errStream);
        }
        stdout = out.toString(StandardCharsets.UTF_8);
        stderr = err.toString(StandardCharsets.UTF_8);
        logData("stderr", stderr);
        return status;
    }

    private static List<String> dataLines(Path csv) throws Exception {
        List<String> lines = new ArrayList<>(Files.readAllLines(csv));
        lines.remove(0);
        return lines;
    }

    @Nested
    @DisplayName("sample")
    class Sample {

        @Test
        @DisplayName("Without output, prints the sample as a table")
        void testPrintFirstRows() {
            int status = run("sample", input.toString(), "-n", "3", "--method", "first");

            assertThat(status).isZero();
            assertThat(stdout).contains("id\t| species");
            assertThat(stdout).contains("0\t| setosa").contains("2\t| setosa");
            assertThat(stdout).contains("Total rows: 3");
        }

        @Test
        @DisplayName("Same seed writes byte-identical files")
        void testReproducibleOutput() throws Exception {
            Path first = tempDir.resolve("a.csv");
            Path second = tempDir.resolve("b.csv");

            assertThat(run("sample", input.toString(), "-n", "5", "--random", "42", "-o", first.toString())).isZero();
            assertThat(run("sample", input.toString(), "-n", "5", "-r", "42", "-j", "1", "-o", second.toString())).isZero();

            assertThat(dataLines(first)).hasSize(5);
            assertThat(Files.readAllBytes(first)).isEqualTo(Files.readAllBytes(second));
        }

        @Test
        @DisplayName("Stratified sample balances categories")
        void testStratified() throws Exception {
            Path out = tempDir.resolve("strat.csv");
            int status = run("sample", input.toString(), "-n", "8", "--method", "stratified",
                "--stratify-by", "SPECIES", "-o", out.toString());

            assertThat(status).isZero();
            assertThat(dataLines(out)).filteredOn(line -> line.endsWith("setosa")).hasSize(4);
            assertThat(dataLines(out)).filteredOn(line -> line.endsWith("virginica")).hasSize(4);
        }

        @Test
        @DisplayName("Stratified without a column is an invalid argument")
        void testStratifiedWithoutColumn() {
            assertThat(run("sample", input.toString(), "--method", "stratified")).isEqualTo(1);
            assertThat(stderr).contains("Error: Invalid argument: --stratify-by is required");
        }

        @Test
        @DisplayName("Unknown column lists available columns")
        void testUnknownColumn() {
            assertThat(run("sample", input.toString(), "--method", "stratified", "--stratify-by", "genus")).isEqualTo(1);
            assertThat(stderr).contains("Column 'genus' not found. Available columns: [id, species]");
        }

        @Test
        @DisplayName("Output format option overrides the extension")
        void testFormatOption() throws Exception {
            Path out = tempDir.resolve("sample.out");
            assertThat(run("sample", input.toString(), "-n", "2", "--method", "last", "-f", "json", "-o", out.toString()))
                .isZero();
            assertThat(Files.readAllLines(out)).containsExactly(
                "{\"id\":18,\"species\":\"setosa\"}", "{\"id\":19,\"species\":\"virginica\"}");
        }
    }

    @Nested
    @DisplayName("shuffle")
    class Shuffle {

        @Test
        @DisplayName("Writes every row once")
        void testShuffle() throws Exception {
            Path out = tempDir.resolve("shuffled.csv");
            assertThat(run("shuffle", input.toString(), "--random", "7", "-o", out.toString())).isZero();

            assertThat(dataLines(out)).containsExactlyInAnyOrderElementsOf(dataLines(input));
            assertThat(dataLines(out)).isNotEqualTo(dataLines(input));
        }
    }

    @Nested
    @DisplayName("split")
    class Split {

        @Test
        @DisplayName("Named parts are written into the output directory")
        void testNamedSplit() throws Exception {
            Path dir = tempDir.resolve("out");
            int status = run("split", input.toString(), "--ratio", "70,30", "--names", "train,test.csv",
                "--output-dir", dir.toString(), "--random", "123");

            assertThat(status).isZero();
            List<String> train = dataLines(dir.resolve("train.csv"));
            List<String> test = dataLines(dir.resolve("test.csv"));
            assertThat(train).hasSize(14);
            assertThat(test).hasSize(6);

            List<String> all = new ArrayList<>(train);
            all.addAll(test);
            assertThat(all).containsExactlyInAnyOrderElementsOf(dataLines(input));
        }

        @Test
        @DisplayName("A dot that is not a format extension still gets one")
        void testDottedName() throws Exception {
            Path dir = tempDir.resolve("dotted");
            int status = run("split", input.toString(), "--ratio", "0.5,0.5", "--names", "train.v2,test",
                "--output-dir", dir.toString(), "-r", "3", "-f", "csv");

            assertThat(status).isZero();
            assertThat(dataLines(dir.resolve("train.v2.csv"))).hasSize(10);
            assertThat(dataLines(dir.resolve("test.csv"))).hasSize(10);
            assertThat(dir.resolve("train.v2")).doesNotExist();
        }

        @Test
        @DisplayName("Each named file is written in the format of its extension")
        void testFormatFollowsName() throws Exception {
            Path dir = tempDir.resolve("mixed");
            int status = run("split", input.toString(), "--ratio", "0.5,0.5", "--names", "a.json,b",
                "--output-dir", dir.toString(), "-r", "3");

            assertThat(status).isZero();
            assertThat(Files.readAllLines(dir.resolve("a.json"))).hasSize(10).allMatch(line -> line.startsWith("{"));
            assertThat(dataLines(dir.resolve("b.csv"))).hasSize(10);
        }

        @Test
        @DisplayName("A name extension that contradicts --format is rejected")
        void testConflictingExtension() {
            Path dir = tempDir.resolve("conflict");
            int status = run("split", input.toString(), "--ratio", "0.5,0.5", "--names", "a.csv,b",
                "--output-dir", dir.toString(), "-f", "parquet");

            assertThat(status).isEqualTo(1);
            assertThat(stderr).contains("Name 'a.csv' does not match output format parquet");
            assertThat(dir).doesNotExist();
        }

        @Test
        @DisplayName("Default names use the prefix and a 1-based index")
        void testGeneratedNames() {
            Path dir = tempDir.resolve("parts");
            int status = run("split", input.toString(), "--ratio", "0.5,0.25,0.25", "--splits-prefix", "fold",
                "--output-dir", dir.toString(), "-r", "1", "-f", "parquet");

            assertThat(status).isZero();
            assertThat(dir.resolve("fold_1.parquet")).exists();
            assertThat(dir.resolve("fold_2.parquet")).exists();
            assertThat(dir.resolve("fold_3.parquet")).exists();
        }

        @Test
        @DisplayName("Stratified split keeps category shares in every part")
        void testStratifiedSplit() throws Exception {
            Path dir = tempDir.resolve("strat");
            int status = run("split", input.toString(), "--ratio", "0.8,0.2", "--stratified-by", "species",
                "--output-dir", dir.toString(), "--random", "5");

            assertThat(status).isZero();
            List<String> second = dataLines(dir.resolve("split_2.csv"));
            assertThat(second).filteredOn(line -> line.endsWith("setosa")).hasSize(2);
            assertThat(second).filteredOn(line -> line.endsWith("virginica")).hasSize(2);
        }

        @Test
        @DisplayName("Ratios that do not sum to 1 or 100 fail before anything is written")
        void testBadRatios() {
            Path dir = tempDir.resolve("never");
            int status = run("split", input.toString(), "--ratio", "0.5,0.6", "--output-dir", dir.toString());

            assertThat(status).isEqualTo(1);
            assertThat(stderr).contains("must sum to 1.0 or 100.0");
            assertThat(dir).doesNotExist();
        }

        @Test
        @DisplayName("Name and ratio counts must match")
        void testNameCountMismatch() {
            int status = run("split", input.toString(), "--ratio", "0.5,0.5", "--names", "a,b,c",
                "--output-dir", tempDir.resolve("x").toString());

            assertThat(status).isEqualTo(1);
            assertThat(stderr).contains("Number of ratios (2) must match number of names (3)");
        }

        @Test
        @DisplayName("Missing --ratio is an invalid argument")
        void testMissingRatio() {
            assertThat(run("split", input.toString())).isEqualTo(1);
            assertThat(stderr).contains("--ratio is required");
        }
    }

    @Nested
    @DisplayName("General")
    class General {

        @Test
        @DisplayName("Help exits successfully, no arguments do not")
        void testUsage() {
            assertThat(run("--help")).isZero();
            assertThat(stdout).contains("Usage: splitduck");
            assertThat(run()).isEqualTo(1);
        }

        @Test
        @DisplayName("Unknown commands and options are rejected")
        void testUnknownArguments() {
            assertThat(run("dedup", input.toString())).isEqualTo(1);
            assertThat(stderr).contains("Unknown command: dedup");

            assertThat(run("shuffle", input.toString(), "--ratio", "1")).isEqualTo(1);
            assertThat(stderr).contains("Unknown option for shuffle: --ratio");
        }

        @Test
        @DisplayName("Malformed seed is rejected")
        void testBadSeed() {
            assertThat(run("shuffle", input.toString(), "--random", "-3")).isEqualTo(1);
            assertThat(stderr).contains("Invalid seed");
        }

        @Test
        @DisplayName("Unsupported input extension is a user error")
        void testUnsupportedInput() throws Exception {
            Path text = tempDir.resolve("notes.txt");
            Files.writeString(text, "hello");
            assertThat(run("shuffle", text.toString())).isEqualTo(1);
            assertThat(stderr).contains("Unsupported format");
        }

        @Test
        @DisplayName("Missing input file is an engine error")
        void testMissingInput() {
            assertThat(run("shuffle", tempDir.resolve("missing.csv").toString())).isEqualTo(2);
            assertThat(stderr).startsWith("Error: ");
        }
    }
}
