package io.github.yok.bendload.client;

import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Result of one statement executed by a {@link QueryEndpointClient}.
 *
 * <p>
 * Both lists are {@code null} when the service did not return them (typical for DDL and DML).
 * Cell values are rendered as strings.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@RequiredArgsConstructor
public class QueryResult {

    // Query ID assigned by the service (may be null)
    private final String queryId;

    // Column names, or null if absent
    private final List<String> columns;

    // Rows, or null if absent
    private final List<List<String>> rows;

    /**
     * Returns whether the result carries columns and at least one row.
     *
     * @return {@code true} if both lists are present and the row list is not empty
     */
    public boolean hasRows() {
        return columns != null && rows != null && !rows.isEmpty();
    }
}
