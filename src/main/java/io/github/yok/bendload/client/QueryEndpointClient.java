package io.github.yok.bendload.client;

/**
 * Executes statements against the remote query service.
 *
 * <p>
 * One instance is shared by every stage of a load and is used from a single thread at a time; it
 * holds no per-statement state.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface QueryEndpointClient {

    /**
     * Executes one statement and waits for its result.
     *
     * @param statement statement text
     * @return columns and rows returned by the service
     * @throws QueryExecutionException if the call fails or the service reports an error
     */
    QueryResult execute(String statement) throws QueryExecutionException;
}
