package io.github.yok.bendload.core;

import com.google.common.base.Preconditions;
import io.github.yok.bendload.source.LineStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Groups a line stream into bounded batches.
 *
 * <p>
 * Each call to {@link #next()} pulls up to {@code batchSize} lines. A chunk in which every line is
 * blank is dropped without being returned, and pulling continues with the next chunk. Batches are
 * returned in source order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class Batcher {

    private final LineStream stream;

    private final int batchSize;

    private int batchCount;

    private int droppedCount;

    /**
     * Creates a batcher.
     *
     * @param stream stream to consume; header lines must already be skipped
     * @param batchSize maximum lines per batch (1 or more)
     */
    public Batcher(LineStream stream, int batchSize) {
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive: %s", batchSize);
        this.stream = stream;
        this.batchSize = batchSize;
    }

    /**
     * Returns the next batch that holds at least one non-blank line.
     *
     * @return next batch, or {@code null} when the stream is exhausted
     * @throws IOException if reading the stream fails
     */
    public Batch next() throws IOException {
        while (true) {
            List<String> lines = new ArrayList<>(Math.min(batchSize, 1024));
            boolean anyData = false;
            String line;
            while (lines.size() < batchSize && (line = stream.nextLine()) != null) {
                lines.add(line);
                anyData |= StringUtils.isNotBlank(line);
            }
            if (lines.isEmpty()) {
                return null;
            }
            if (!anyData) {
                droppedCount++;
                log.debug("Dropped a chunk of {} blank line(s)", lines.size());
                continue;
            }
            batchCount++;
            return new Batch(batchCount, lines);
        }
    }

    /**
     * Returns the number of batches returned so far.
     *
     * @return batch count
     */
    public int getBatchCount() {
        return batchCount;
    }

    /**
     * Returns the number of all-blank chunks dropped so far.
     *
     * @return dropped chunk count
     */
    public int getDroppedCount() {
        return droppedCount;
    }
}
