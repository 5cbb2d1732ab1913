package io.sandcron.internal.sandbox;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Accumulates subprocess stdout up to a byte ceiling.
 *
 * <p>Once the ceiling would be exceeded, a truncation marker is appended and further output is read
 * and discarded, so the subprocess never blocks on a full pipe. Safe to snapshot from another thread
 * while reading is in progress.
 */
final class OutputCapture {

    static final String TRUNCATION_MARKER = "\n[OUTPUT TRUNCATED - exceeded max size]";

    private static final int CHUNK_SIZE = 8192;

    private final long maxBytes;
    private final StringBuilder buffer = new StringBuilder();
    private long capturedBytes;
    private boolean truncated;

    OutputCapture(long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.maxBytes = maxBytes;
    }

    /**
     * Read {@code stream} until end of stream, splitting it into lines.
     *
     * <p>Bytes are counted as they arrive, so a line without a terminator never grows past the ceiling.
     */
    void readFrom(InputStream stream) throws IOException {
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            char[] chunk = new char[CHUNK_SIZE];
            StringBuilder line = new StringBuilder();
            long lineBytes = 0;
            int n;
            while ((n = reader.read(chunk)) != -1) {
                if (isTruncated()) {
                    continue;
                }
                for (int i = 0; i < n; i++) {
                    char c = chunk[i];
                    if (c == '\n') {
                        append(stripCarriageReturn(line));
                        line.setLength(0);
                        lineBytes = 0;
                        continue;
                    }
                    line.append(c);
                    lineBytes += utf8Length(c);
                    if (!fits(lineBytes)) {
                        markTruncated();
                        line.setLength(0);
                        break;
                    }
                }
            }
            if (line.length() > 0) {
                append(stripCarriageReturn(line));
            }
        }
    }

    /**
     * @return false once capture has stopped
     */
    synchronized boolean append(String line) {
        if (truncated) {
            return false;
        }
        long lineBytes = line.getBytes(StandardCharsets.UTF_8).length + 1L;
        if (capturedBytes + lineBytes > maxBytes) {
            markTruncated();
            return false;
        }
        buffer.append(line).append('\n');
        capturedBytes += lineBytes;
        return true;
    }

    private synchronized boolean fits(long pendingLineBytes) {
        // the pending line still needs its newline
        return capturedBytes + pendingLineBytes + 1 <= maxBytes;
    }

    private synchronized void markTruncated() {
        if (!truncated) {
            buffer.append(TRUNCATION_MARKER);
            truncated = true;
        }
    }

    private static String stripCarriageReturn(StringBuilder line) {
        int len = line.length();
        return len > 0 && line.charAt(len - 1) == '\r' ? line.substring(0, len - 1) : line.toString();
    }

    // surrogates count two each, four bytes per pair
    private static int utf8Length(char c) {
        if (c < 0x80) {
            return 1;
        }
        if (c < 0x800 || Character.isSurrogate(c)) {
            return 2;
        }
        return 3;
    }

    synchronized String snapshot() {
        return buffer.toString();
    }

    synchronized boolean isTruncated() {
        return truncated;
    }
}
