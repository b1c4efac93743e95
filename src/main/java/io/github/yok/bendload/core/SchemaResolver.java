package io.github.yok.bendload.core;

import io.github.yok.bendload.client.QueryEndpointClient;
import io.github.yok.bendload.client.QueryExecutionException;
import io.github.yok.bendload.client.QueryResult;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides, once per load, whether the target table is verified or created, and returns the table
 * reference used by every {@code INSERT}.
 *
 * <p>
 * <strong>Paths:</strong>
 * </p>
 * <ul>
 * <li><strong>No schema</strong>: {@code SHOW TABLES LIKE '<table>';} must return a row, otherwise
 * the load fails with {@link LoadErrorKind#TABLE_NOT_FOUND}. The reference is the bare table
 * name.</li>
 * <li><strong>Schema given, table exists</strong>: the schema is ignored and the reference is the
 * bare table name.</li>
 * <li><strong>Schema given, table missing</strong>:
 * {@code CREATE TABLE <table>(<col> <type>, ...) Engine = <engine>;} is issued and the reference
 * is {@code <table> (<col>, ...)} in declaration order.</li>
 * </ul>
 *
 * <p>
 * A failure of the query service on any of these calls ends the load with
 * {@link LoadErrorKind#ENDPOINT_ERROR}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaResolver {

    private final QueryEndpointClient client;

    private final String tableEngine;

    /**
     * Creates a resolver.
     *
     * @param client query service client
     * @param tableEngine engine clause for created tables (e.g., {@code Fuse})
     */
    public SchemaResolver(QueryEndpointClient client, String tableEngine) {
        this.client = client;
        this.tableEngine = tableEngine;
    }

    /**
     * Resolves the table reference for the given table.
     *
     * @param table target table name
     * @param schema parsed schema, or {@code null} if the table must already exist
     * @return table reference for {@code INSERT INTO <ref> VALUES ...}
     * @throws LoadException if the table is missing without a schema, or the service fails
     */
    public String resolve(String table, TableSchema schema) {
        if (tableExists(table)) {
            if (schema != null) {
                log.info("Table {} already exists; supplied schema is ignored", table);
            } else {
                log.info("Table {} exists", table);
            }
            return table;
        }
        if (schema == null) {
            throw new LoadException(LoadErrorKind.TABLE_NOT_FOUND, "table " + table + " not found");
        }

        String create = createTableStatement(table, schema, tableEngine);
        log.info("Table {} not found; creating it: {}", table, create);
        try {
            client.execute(create);
        } catch (QueryExecutionException e) {
            throw new LoadException(LoadErrorKind.ENDPOINT_ERROR,
                    "cannot create table " + table + ": " + e.getMessage(), e);
        }
        return table + " (" + schema.toColumnList() + ")";
    }

    /**
     * Checks whether the table exists on the query service.
     *
     * @param table table name
     * @return {@code true} if the check returned columns and at least one row
     * @throws LoadException with {@link LoadErrorKind#ENDPOINT_ERROR} if the check fails
     */
    public boolean tableExists(String table) {
        try {
            QueryResult result = client.execute(showTablesStatement(table));
            return result != null && result.hasRows();
        } catch (QueryExecutionException e) {
            throw new LoadException(LoadErrorKind.ENDPOINT_ERROR,
                    "cannot check table " + table + ": " + e.getMessage(), e);
        }
    }

    static String showTablesStatement(String table) {
        return "SHOW TABLES LIKE '" + table + "';";
    }

    static String createTableStatement(String table, TableSchema schema, String engine) {
        return "CREATE TABLE " + table + "(" + schema.toColumnDefinitions() + ") Engine = " + engine
                + ";";
    }
}
