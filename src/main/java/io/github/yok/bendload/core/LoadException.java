package io.github.yok.bendload.core;

import lombok.Getter;

/**
 * Fatal error of a load.
 *
 * <p>
 * Thrown before the first batch for setup failures (source, schema, table) and at the point of
 * failure for {@link LoadErrorKind#STREAM_ERROR}. Batches already dispatched are not rolled back.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class LoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final LoadErrorKind kind;

    public LoadException(LoadErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LoadException(LoadErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
