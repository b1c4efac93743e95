package io.github.yok.bendload.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Summary of a load that ran to the end of its source.
 *
 * <p>
 * A load that stops on a {@link LoadException} has no result. Failed batches do not stop a load;
 * they are listed in {@link #getFailedBatches()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public class LoadResult {

    /**
     * Overall status of a completed load.
     */
    public enum Status {
        // Every dispatched batch was acknowledged
        COMPLETED,
        // At least one batch failed
        COMPLETED_WITH_ERRORS,
        // No line followed the header lines
        NO_DATA
    }

    private final String table;

    private final String tableReference;

    private long headerLinesSkipped;

    private long linesRead;

    private int batchesDispatched;

    private int batchesAcknowledged;

    // All-blank chunks and batches that rendered to no fragments
    private int batchesDropped;

    private boolean noData;

    private final List<BatchOutcome> failedBatches = new ArrayList<>();

    LoadResult(String table, String tableReference) {
        this.table = table;
        this.tableReference = tableReference;
    }

    void record(BatchOutcome outcome) {
        batchesDispatched++;
        if (outcome.isAcknowledged()) {
            batchesAcknowledged++;
        } else {
            failedBatches.add(outcome);
        }
    }

    void addDropped(int count) {
        batchesDropped += count;
    }

    void setHeaderLinesSkipped(long headerLinesSkipped) {
        this.headerLinesSkipped = headerLinesSkipped;
    }

    void setLinesRead(long linesRead) {
        this.linesRead = linesRead;
    }

    void markNoData() {
        this.noData = true;
    }

    /**
     * Returns the outcomes of the batches that failed, in dispatch order.
     *
     * @return unmodifiable list of failed outcomes
     */
    public List<BatchOutcome> getFailedBatches() {
        return Collections.unmodifiableList(failedBatches);
    }

    /**
     * Returns the overall status.
     *
     * @return {@link Status#NO_DATA} if no line followed the header lines,
     *         {@link Status#COMPLETED_WITH_ERRORS} if any batch failed, otherwise
     *         {@link Status#COMPLETED}
     */
    public Status getStatus() {
        if (noData) {
            return Status.NO_DATA;
        }
        return failedBatches.isEmpty() ? Status.COMPLETED : Status.COMPLETED_WITH_ERRORS;
    }
}
