package io.github.yok.bendload.core;

import io.github.yok.bendload.client.QueryEndpointClient;
import io.github.yok.bendload.config.LoadConfig;
import io.github.yok.bendload.source.LineStream;
import io.github.yok.bendload.source.SourceReader;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;

/**
 * Runs one load: source, header skip, batching, rendering and dispatch.
 *
 * <p>
 * <strong>Sequence:</strong>
 * </p>
 * <ol>
 * <li>Parse the schema string, if any (no network call is made before this succeeds).</li>
 * <li>Open the source.</li>
 * <li>Resolve the table reference with {@link SchemaResolver}; this happens once per load.</li>
 * <li>Skip the header lines. If no line follows them, the load completes with no data.</li>
 * <li>For each batch: render it with {@link RecordTransformer} and send it with
 * {@link StatementDispatcher}. Batches are dispatched one at a time, in source order.</li>
 * </ol>
 *
 * <p>
 * Failures in steps 1-4 and read errors in step 5 end the load with a {@link LoadException}. A
 * failed dispatch is recorded in the {@link LoadResult} and the next batch is processed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BulkLoader {

    private final SourceReader sourceReader;

    private final SchemaResolver schemaResolver;

    private final StatementDispatcher dispatcher;

    // Worker count for RecordTransformer
    private final int parallelism;

    /**
     * Creates a loader.
     *
     * @param sourceReader opens the source of each load
     * @param client query service client shared by the schema check and all batches
     * @param loadConfig load defaults (parallelism, table engine)
     */
    public BulkLoader(SourceReader sourceReader, QueryEndpointClient client,
            LoadConfig loadConfig) {
        this(sourceReader, new SchemaResolver(client, loadConfig.getTableEngine()),
                new StatementDispatcher(client), Math.max(1, loadConfig.getParallelism()));
    }

    BulkLoader(SourceReader sourceReader, SchemaResolver schemaResolver,
            StatementDispatcher dispatcher, int parallelism) {
        this.sourceReader = sourceReader;
        this.schemaResolver = schemaResolver;
        this.dispatcher = dispatcher;
        this.parallelism = parallelism;
    }

    /**
     * Executes a load.
     *
     * @param request load description
     * @return summary of the load
     * @throws LoadException if the load cannot be set up or the source cannot be read
     */
    public LoadResult execute(LoadRequest request) {
        String table = request.getTargetTable();
        log.info("=== Load started (source={}, table={}, batchSize={}, skipHeadLines={}) ===",
                request.getSource(), table, request.getBatchSize(), request.getHeaderSkipCount());

        TableSchema schema = request.hasSchema() ? TableSchema.parse(request.getSchema()) : null;

        LineStream stream = sourceReader.open(request.getSource());
        try {
            String tableRef = schemaResolver.resolve(table, schema);
            LoadResult result = new LoadResult(table, tableRef);

            if (!HeaderSkipper.skip(stream, request.getHeaderSkipCount())) {
                result.setHeaderLinesSkipped(stream.getLinesRead());
                result.markNoData();
                log.info("=== Load finished: no data after {} header line(s) ===",
                        request.getHeaderSkipCount());
                return result;
            }
            result.setHeaderLinesSkipped(request.getHeaderSkipCount());

            Batcher batcher = new Batcher(stream, request.getBatchSize());
            try (RecordTransformer transformer = new RecordTransformer(parallelism)) {
                Batch batch;
                while ((batch = batcher.next()) != null) {
                    Optional<String> values = transformer.transform(batch);
                    if (values.isEmpty()) {
                        result.addDropped(1);
                        continue;
                    }
                    result.record(dispatcher.dispatch(table, tableRef, batch, values.get()));
                }
            }
            result.addDropped(batcher.getDroppedCount());
            result.setLinesRead(stream.getLinesRead() - request.getHeaderSkipCount());
            if (result.getLinesRead() == 0) {
                // Header skip consumed the whole source
                result.markNoData();
            }

            log.info("=== Load finished ===");
            logSummary(result);
            return result;
        } catch (IOException e) {
            throw new LoadException(LoadErrorKind.STREAM_ERROR,
                    "cannot read " + request.getSource() + " after line " + stream.getLinesRead()
                            + ": " + e.getMessage(),
                    e);
        } finally {
            IOUtils.closeQuietly(stream,
                    e -> log.warn("Failed to close source {}: {}", stream, e.getMessage()));
        }
    }

    /**
     * Outputs a consolidated log of the load.
     *
     * @param result result to print
     */
    private void logSummary(LoadResult result) {
        log.info("===== Summary =====");
        log.info("  Table[{}] Reference[{}]", result.getTable(), result.getTableReference());
        log.info("  Lines: read={}, header skipped={}", result.getLinesRead(),
                result.getHeaderLinesSkipped());
        log.info("  Batches: dispatched={}, acknowledged={}, failed={}, dropped={}",
                result.getBatchesDispatched(), result.getBatchesAcknowledged(),
                result.getFailedBatches().size(), result.getBatchesDropped());
        for (BatchOutcome failed : result.getFailedBatches()) {
            log.info("  Failed batch {} (lines={}): {}", failed.getBatchIndex(),
                    failed.getLineCount(), failed.getMessage());
        }
        log.info("  Status: {}", result.getStatus());
    }
}
