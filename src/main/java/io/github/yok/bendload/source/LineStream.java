package io.github.yok.bendload.source;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

/**
 * Lazy, single-pass sequence of text lines produced by {@link SourceReader}.
 *
 * <p>
 * Lines are returned without their terminator. The stream is forward-only: once a line has been
 * returned it cannot be read again.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class LineStream implements Closeable {

    private final BufferedReader reader;

    private final String description;

    private long linesRead;

    private boolean exhausted;

    /**
     * Creates a stream over the given reader.
     *
     * @param reader character source; wrapped in a {@link BufferedReader} if needed
     * @param description human readable origin, used in log messages
     */
    public LineStream(Reader reader, String description) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader
                : new BufferedReader(reader);
        this.description = description;
    }

    /**
     * Reads the next line.
     *
     * @return the next line, or {@code null} when the end of input has been reached
     * @throws IOException if reading fails
     */
    public String nextLine() throws IOException {
        if (exhausted) {
            return null;
        }
        String line = reader.readLine();
        if (line == null) {
            exhausted = true;
            return null;
        }
        linesRead++;
        return line;
    }

    /**
     * Returns the number of lines handed out so far.
     *
     * @return line count
     */
    public long getLinesRead() {
        return linesRead;
    }

    /**
     * Returns whether the end of input has been observed.
     *
     * @return {@code true} once {@link #nextLine()} returned {@code null}
     */
    public boolean isExhausted() {
        return exhausted;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    @Override
    public String toString() {
        return description;
    }
}
