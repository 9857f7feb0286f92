package de.synchrolib.app;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class SynchroRunnerTest {

    private Path directory;
    private ByteArrayOutputStream bytes;
    private SynchroRunner runner;

    @BeforeMethod
    public void setUp() throws IOException {
        directory = Files.createTempDirectory("synchro-runner");
        bytes = new ByteArrayOutputStream();
        runner = new SynchroRunner(new PrintStream(bytes, true, StandardCharsets.UTF_8));
    }

    @AfterMethod
    public void tearDown() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Files.delete(file);
            }
        }
        Files.delete(directory);
    }

    @Test
    public void enumeratesAndReportsMaxima() {
        Assert.assertEquals(runner.run(new String[] {"-n", "3", "-k", "2", "-o", detail()}), SynchroRunner.EXIT_OK);
        Assert.assertEquals(lastLine(), "[2, 2]");
    }

    @Test
    public void summaryOnlyRunReportsZeroMaxima() {
        Assert.assertEquals(runner.run(new String[] {"-n", "3", "-k", "2"}), SynchroRunner.EXIT_OK);
        Assert.assertEquals(lastLine(), "[0, 0]");
    }

    @Test
    public void fourStates() {
        Assert.assertEquals(runner.run(new String[] {"--states", "4", "--alphabet", "2", "--output", detail()}),
                            SynchroRunner.EXIT_OK);
        Assert.assertEquals(lastLine(), "[3, 3]");
    }

    @Test
    public void writesDetailedOutput() throws IOException {
        Path output = directory.resolve("out.txt");

        int status = runner.run(new String[] {"-n", "2", "-k", "2", "-w", "-o", output.toString()});

        Assert.assertEquals(status, SynchroRunner.EXIT_OK);
        Assert.assertEquals(lastLine(), "[1, 1]");

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        Assert.assertEquals(lines.size(), 2);
        Assert.assertTrue(lines.get(0).startsWith("0: [1, 1] ((PairGraph, "), lines.get(0));
        Assert.assertTrue(lines.get(0).endsWith(" {0}"), lines.get(0));
        Assert.assertTrue(lines.get(1).startsWith("1: [1, 1] ((PairGraph, "), lines.get(1));
        Assert.assertTrue(lines.get(1).endsWith(" {1}"), lines.get(1));
    }

    @Test
    public void wordsAreDroppedUnlessRequested() throws IOException {
        Path output = directory.resolve("out.txt");

        Assert.assertEquals(runner.run(new String[] {"-n", "2", "-k", "2", "-o", output.toString()}),
                            SynchroRunner.EXIT_OK);

        for (String line : Files.readAllLines(output, StandardCharsets.UTF_8)) {
            Assert.assertFalse(line.contains("{"), line);
        }
    }

    @Test
    public void readsAutomataFromFile() throws IOException {
        Path input = write("automata.txt", "0 0 0 1 2 0\n\n0 0 1 0 0 2\n");

        Assert.assertEquals(runner.run(new String[] {"-n", "3", "-k", "2", "-i", input.toString(), "-o", detail()}),
                            SynchroRunner.EXIT_OK);
        Assert.assertEquals(lastLine(), "[2, 2]");
    }

    @Test
    public void configurationFile() throws IOException {
        Path config = write("config.json",
                            "{\"states\": 2, \"alphabetSize\": 2, \"convention\": \"LEGACY\", " +
                            "\"algorithms\": [\"Greedy\"]}");

        Assert.assertEquals(runner.run(new String[] {"-c", config.toString(), "-o", detail()}), SynchroRunner.EXIT_OK);
        Assert.assertEquals(lastLine(), "[1, 1]");
    }

    @Test
    public void optionsOverrideConfiguration() throws IOException {
        Path config = write("config.json", "{\"states\": 7, \"alphabetSize\": 2}");

        Assert.assertEquals(runner.run(new String[] {"-c", config.toString(), "-n", "3", "-o", detail()}),
                            SynchroRunner.EXIT_OK);
        Assert.assertEquals(lastLine(), "[2, 2]");
    }

    @Test
    public void help() {
        Assert.assertEquals(runner.run(new String[] {"-h"}), SynchroRunner.EXIT_OK);
        Assert.assertTrue(output().contains("usage: synchrolib"), output());
    }

    @Test
    public void unknownOption() {
        Assert.assertEquals(runner.run(new String[] {"--frobnicate"}), SynchroRunner.EXIT_USAGE);
    }

    @Test
    public void nonNumericStates() {
        Assert.assertEquals(runner.run(new String[] {"-n", "three", "-k", "2"}), SynchroRunner.EXIT_USAGE);
    }

    @Test
    public void missingDimensions() {
        Assert.assertEquals(runner.run(new String[] {"-n", "3"}), SynchroRunner.EXIT_USAGE);
        Assert.assertTrue(output().contains("Both the number of states and the alphabet size are required"),
                          output());
        for (String line : output().split("\\R")) {
            Assert.assertFalse(line.matches("\\[\\d+, \\d+\\]"), line);
        }
    }

    @Test
    public void malformedConfiguration() throws IOException {
        Path config = write("config.json", "{\"states\": 3, \"alphabet\": 2}");
        Assert.assertEquals(runner.run(new String[] {"-c", config.toString()}), SynchroRunner.EXIT_CONFIG);
    }

    @Test
    public void unknownAlgorithm() throws IOException {
        Path config = write("config.json", "{\"states\": 3, \"alphabetSize\": 2, \"algorithms\": [\"Magic\"]}");
        Assert.assertEquals(runner.run(new String[] {"-c", config.toString()}), SynchroRunner.EXIT_CONFIG);
    }

    @Test
    public void invalidArity() {
        Assert.assertEquals(runner.run(new String[] {"-n", "0", "-k", "2"}), SynchroRunner.EXIT_INVALID);
        Assert.assertTrue(output().isEmpty(), output());
    }

    @Test
    public void invalidInputLine() throws IOException {
        Path input = write("automata.txt", "0 0 0 1 2 0\n0 0 3 0 0 2\n");

        Assert.assertEquals(runner.run(new String[] {"-n", "3", "-k", "2", "-i", input.toString()}),
                            SynchroRunner.EXIT_INVALID);
        Assert.assertTrue(output().isEmpty(), output());
    }

    @Test
    public void missingInputFile() {
        String input = directory.resolve("missing.txt").toString();
        Assert.assertEquals(runner.run(new String[] {"-n", "3", "-k", "2", "-i", input}), SynchroRunner.EXIT_IO);
    }

    private String detail() {
        return directory.resolve("detail.txt").toString();
    }

    private Path write(String name, String content) throws IOException {
        return Files.write(directory.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }

    private String output() {
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private String lastLine() {
        String[] lines = output().trim().split("\\R");
        return lines[lines.length - 1];
    }
}
