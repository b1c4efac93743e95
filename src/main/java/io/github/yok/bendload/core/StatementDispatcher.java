package io.github.yok.bendload.core;

import io.github.yok.bendload.client.QueryEndpointClient;
import io.github.yok.bendload.client.QueryExecutionException;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the {@code INSERT} statement of a batch and sends it to the query service.
 *
 * <p>
 * A failure affects only the batch being dispatched: it is logged, returned as a failed
 * {@link BatchOutcome}, and not retried.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class StatementDispatcher {

    private final QueryEndpointClient client;

    public StatementDispatcher(QueryEndpointClient client) {
        this.client = client;
    }

    /**
     * Dispatches one batch.
     *
     * @param table target table name, used in diagnostics
     * @param tableRef table reference resolved by {@link SchemaResolver}
     * @param batch batch being dispatched
     * @param valueList rendered value list of the batch
     * @return outcome of the call
     */
    public BatchOutcome dispatch(String table, String tableRef, Batch batch, String valueList) {
        String statement = insertStatement(tableRef, valueList);
        try {
            client.execute(statement);
            log.debug("Batch {} inserted into {} (lines={})", batch.getIndex(), table,
                    batch.size());
            return BatchOutcome.acknowledged(batch.getIndex(), batch.size());
        } catch (QueryExecutionException e) {
            log.warn("cannot insert data into {} (batch {}), error: {}", table, batch.getIndex(),
                    e.getMessage(), e);
            return BatchOutcome.failed(batch.getIndex(), batch.size(), e.getMessage());
        }
    }

    static String insertStatement(String tableRef, String valueList) {
        return "INSERT INTO " + tableRef + " VALUES " + valueList + ";";
    }
}
