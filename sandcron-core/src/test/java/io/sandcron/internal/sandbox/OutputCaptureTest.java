package io.sandcron.internal.sandbox;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputCaptureTest {

    @Test
    void linesUpToTheCeilingShouldBeKept() {
        OutputCapture capture = new OutputCapture(10);

        assertTrue(capture.append("abcd"));
        assertTrue(capture.append("efgh"));

        assertEquals("abcd\nefgh\n", capture.snapshot());
        assertFalse(capture.isTruncated());
    }

    @Test
    void overflowShouldAppendMarkerOnceAndStopCapturing() {
        OutputCapture capture = new OutputCapture(10);
        capture.append("abcd");
        capture.append("efgh");

        assertFalse(capture.append("i"));
        assertFalse(capture.append("j"));

        assertEquals("abcd\nefgh\n" + OutputCapture.TRUNCATION_MARKER, capture.snapshot());
        assertTrue(capture.isTruncated());
    }

    @Test
    void ceilingShouldCountUtf8Bytes() {
        OutputCapture capture = new OutputCapture(4);

        // two bytes each, plus the newline
        assertFalse(capture.append("éé"));
        assertTrue(capture.isTruncated());
    }

    @Test
    void readFromShouldDrainTheWholeStreamAfterTruncation() throws Exception {
        StringBuilder big = new StringBuilder();
        for (int i = 0; i < 1000; i++) {
            big.append("line-").append(i).append('\n');
        }
        OutputCapture capture = new OutputCapture(20);
        ByteArrayInputStream in = new ByteArrayInputStream(big.toString().getBytes(StandardCharsets.UTF_8));

        capture.readFrom(in);

        assertEquals(0, in.available());
        assertTrue(capture.isTruncated());
        assertTrue(capture.snapshot().startsWith("line-0\nline-1\n"));
        assertTrue(capture.snapshot().endsWith(OutputCapture.TRUNCATION_MARKER));
    }

    @Test
    void lineWithoutTerminatorShouldStopCapturingAtTheCeiling() throws Exception {
        UnterminatedOutput in = new UnterminatedOutput(64L * 1024 * 1024);
        OutputCapture capture = new OutputCapture(1024);

        capture.readFrom(in);

        assertEquals(0, in.remaining);
        assertTrue(capture.isTruncated());
        assertEquals(OutputCapture.TRUNCATION_MARKER, capture.snapshot());
    }

    @Test
    void completeLinesBeforeAnOversizedLineShouldBeKept() throws Exception {
        String text = "ok\n" + "y".repeat(100);
        OutputCapture capture = new OutputCapture(10);

        capture.readFrom(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));

        assertEquals("ok\n" + OutputCapture.TRUNCATION_MARKER, capture.snapshot());
    }

    @Test
    void finalLineWithoutTerminatorAndCrlfShouldBeNormalized() throws Exception {
        OutputCapture capture = new OutputCapture(100);

        capture.readFrom(new ByteArrayInputStream("a\r\nb".getBytes(StandardCharsets.UTF_8)));

        assertEquals("a\nb\n", capture.snapshot());
        assertFalse(capture.isTruncated());
    }

    @Test
    void nonPositiveCeilingShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new OutputCapture(0));
    }

    /**
     * Endless 'x' with no newline, generated on demand.
     */
    private static final class UnterminatedOutput extends InputStream {
        long remaining;

        UnterminatedOutput(long size) {
            this.remaining = size;
        }

        @Override
        public int read() {
            if (remaining == 0) {
                return -1;
            }
            remaining--;
            return 'x';
        }

        @Override
        public int read(byte[] b, int off, int len) {
            if (remaining == 0) {
                return -1;
            }
            int n = (int) Math.min(len, remaining);
            Arrays.fill(b, off, off + n, (byte) 'x');
            remaining -= n;
            return n;
        }
    }
}
