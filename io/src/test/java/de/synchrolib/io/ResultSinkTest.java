package de.synchrolib.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import de.synchrolib.api.AlgoResult;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ResultSinkTest {

    @Test
    public void detailedSinkAggregatesMaxima() {
        ResultSink sink = new ResultSink(OutputDestination.of(new StringWriter()));

        sink.pushResult(AlgoResult.bounded(3, 5), 0);
        sink.pushResult(AlgoResult.bounded(2, 7), 1);
        sink.pushResult(AlgoResult.bounded(4, 6), 2);

        Assert.assertEquals(sink.getMinMax(), 4);
        Assert.assertEquals(sink.getMaxMax(), 7);
        Assert.assertEquals(sink.getSummary(), "[4, 7]");
    }

    @Test
    public void nonSynchronizingResultsDoNotCount() {
        ResultSink sink = new ResultSink(OutputDestination.of(new StringWriter()));

        sink.pushResult(AlgoResult.bounded(1, 2), 0);
        sink.pushResult(AlgoResult.nonSynchronizing(), 1);

        Assert.assertEquals(sink.getSummary(), "[1, 2]");
    }

    @Test
    public void summaryOnlySinkKeepsZeroMaxima() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ResultSink sink = new ResultSink(OutputDestination.summaryOnly(),
                                         new PrintStream(bytes, true, StandardCharsets.UTF_8));

        sink.pushResult(AlgoResult.bounded(3, 5), 0);
        sink.pushResult(AlgoResult.bounded(2, 7), 1);
        sink.printResult();

        Assert.assertEquals(sink.getMinMax(), 0);
        Assert.assertEquals(sink.getMaxMax(), 0);
        Assert.assertEquals(bytes.toString(StandardCharsets.UTF_8).trim(), "[0, 0]");
    }

    @Test
    public void emptyRunReportsZeros() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ResultSink sink = new ResultSink(OutputDestination.summaryOnly(),
                                         new PrintStream(bytes, true, StandardCharsets.UTF_8));

        sink.printResult();

        Assert.assertEquals(bytes.toString(StandardCharsets.UTF_8).trim(), "[0, 0]");
    }

    @Test
    public void summaryOnlyWritesNothing() {
        ResultSink sink = new ResultSink();
        AlgoResult result = AlgoResult.bounded(2, 2);
        result.setWord(Word.fromSymbols(1, 0));

        sink.pushResult(result, 0);

        Assert.assertFalse(sink.getOutput().isDetailed());
        Assert.assertEquals(sink.getSummary(), "[0, 0]");
    }

    @Test
    public void detailedLines() {
        StringWriter writer = new StringWriter();
        ResultSink sink = new ResultSink(OutputDestination.of(writer));

        AlgoResult bounded = AlgoResult.bounded(1, 4);
        bounded.addAlgorithmRun("PairGraph", 0.25);
        bounded.addAlgorithmRun("Greedy", 0.5);

        AlgoResult exact = AlgoResult.bounded(2, 2);
        exact.addAlgorithmRun("PairGraph", 0.000001);
        exact.setWord(Word.fromSymbols(1, 0));

        sink.pushResult(bounded, 0);
        sink.pushResult(AlgoResult.nonSynchronizing(), 1);
        sink.pushResult(exact, 2);

        Assert.assertEquals(writer.toString(),
                            "0: [1, 4] ((PairGraph, 0.250000), (Greedy, 0.500000))\n" + "1: NON SYNCHRO\n" +
                            "2: [2, 2] ((PairGraph, 0.000001)) {1 0}\n");
        Assert.assertEquals(sink.getSummary(), "[2, 4]");
    }

    @Test
    public void emptyWordHasEmptyBraces() {
        AlgoResult result = AlgoResult.bounded(0, 0);
        result.setWord(Word.epsilon());

        Assert.assertEquals(ResultSink.formatLine(result, 7), "7: [0, 0] () {}");
    }

    @Test
    public void linesAreFlushedImmediately() {
        CountingWriter writer = new CountingWriter();
        ResultSink sink = new ResultSink(OutputDestination.of(writer));

        sink.pushResult(AlgoResult.bounded(1, 1), 0);
        Assert.assertEquals(writer.flushes, 1);
        Assert.assertEquals(writer.buffer.toString(), "0: [1, 1] ()\n");

        sink.pushResult(AlgoResult.nonSynchronizing(), 1);
        Assert.assertEquals(writer.flushes, 2);
    }

    @Test
    public void destinationCanBeReplaced() {
        StringWriter first = new StringWriter();
        StringWriter second = new StringWriter();
        ResultSink sink = new ResultSink(OutputDestination.of(first));

        sink.pushResult(AlgoResult.bounded(1, 1), 0);
        sink.setOutput(OutputDestination.of(second));
        sink.pushResult(AlgoResult.bounded(1, 3), 1);

        Assert.assertEquals(first.toString(), "0: [1, 1] ()\n");
        Assert.assertEquals(second.toString(), "1: [1, 3] ()\n");
    }

    @Test
    public void writeFailuresArePropagated() {
        ResultSink sink = new ResultSink(OutputDestination.of(new FailingWriter()));
        Assert.assertThrows(UncheckedIOException.class, () -> sink.pushResult(AlgoResult.bounded(1, 1), 0));
    }

    private static final class CountingWriter extends Writer {

        private final StringBuilder buffer = new StringBuilder();
        private int flushes;

        @Override
        public void write(char[] cbuf, int off, int len) {
            buffer.append(cbuf, off, len);
        }

        @Override
        public void flush() {
            flushes++;
        }

        @Override
        public void close() {}
    }

    private static final class FailingWriter extends Writer {

        @Override
        public void write(char[] cbuf, int off, int len) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public void flush() throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public void close() {}
    }
}
