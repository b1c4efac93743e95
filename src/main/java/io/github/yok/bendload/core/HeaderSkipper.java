package io.github.yok.bendload.core;

import io.github.yok.bendload.source.LineStream;
import java.io.IOException;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Discards the leading header lines of a source.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class HeaderSkipper {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private HeaderSkipper() {
        throw new AssertionError("No io.github.yok.bendload.core.HeaderSkipper instances for you!");
    }

    /**
     * Consumes exactly {@code count} lines from the stream.
     *
     * <p>
     * Running out of input before {@code count} lines is not an error; the caller treats the load
     * as having no data.
     * </p>
     *
     * @param stream stream positioned at its first line
     * @param count number of lines to discard
     * @return {@code true} if all lines were skipped, {@code false} if the stream ended first
     * @throws IOException if reading fails
     */
    public static boolean skip(LineStream stream, int count) throws IOException {
        for (int i = 0; i < count; i++) {
            if (stream.nextLine() == null) {
                log.info("Source {} ended after {} of {} header line(s)", stream, i, count);
                return false;
            }
        }
        if (count > 0) {
            log.debug("Skipped {} header line(s) of {}", count, stream);
        }
        return true;
    }
}
