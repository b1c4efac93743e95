package io.github.yok.bendload.core;

/**
 * Kinds of errors that stop a load.
 *
 * <p>
 * A failed batch is not listed here: it is reported as a failed {@link BatchOutcome} and the load
 * goes on.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum LoadErrorKind {

    // Source path missing or unreadable, or the URL fetch failed
    SOURCE_ERROR,

    // Schema string is malformed
    INVALID_SCHEMA,

    // No schema given and the target table does not exist
    TABLE_NOT_FOUND,

    // The query service failed while the target table was being checked or created
    ENDPOINT_ERROR,

    // Reading the next line failed mid-load
    STREAM_ERROR
}
