package io.github.yok.bendload.core;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Result of dispatching one batch.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class BatchOutcome {

    /**
     * Dispatch status.
     */
    public enum Status {
        // The service accepted the statement
        ACKNOWLEDGED,
        // The statement failed; see message
        FAILED
    }

    private final int batchIndex;

    // Number of raw lines the batch held
    private final int lineCount;

    private final Status status;

    // Error description for FAILED, null otherwise
    private final String message;

    public static BatchOutcome acknowledged(int batchIndex, int lineCount) {
        return new BatchOutcome(batchIndex, lineCount, Status.ACKNOWLEDGED, null);
    }

    public static BatchOutcome failed(int batchIndex, int lineCount, String message) {
        return new BatchOutcome(batchIndex, lineCount, Status.FAILED, message);
    }

    public boolean isAcknowledged() {
        return status == Status.ACKNOWLEDGED;
    }
}
