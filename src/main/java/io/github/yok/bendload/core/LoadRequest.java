package io.github.yok.bendload.core;

import com.google.common.base.Preconditions;
import io.github.yok.bendload.source.SourceFormat;
import io.github.yok.bendload.source.SourceSpec;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable description of one load.
 *
 * <p>
 * Built once from the command line and configuration defaults, then only read by the stages of
 * {@link BulkLoader}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class LoadRequest {

    private final SourceSpec source;

    private final String targetTable;

    // Raw schema string (name:type,...), or null when the table must already exist
    private final String schema;

    private final int headerSkipCount;

    private final int batchSize;

    private final SourceFormat format;

    /**
     * Creates a request.
     *
     * @param source where records are read from
     * @param targetTable table the records are inserted into
     * @param schema raw schema string, or {@code null}
     * @param headerSkipCount leading lines to discard (0 or more)
     * @param batchSize maximum lines per INSERT statement (1 or more)
     * @param format input format
     * @throws IllegalArgumentException if a value is out of range
     * @throws NullPointerException if {@code source} or {@code format} is {@code null}
     */
    public LoadRequest(SourceSpec source, String targetTable, String schema, int headerSkipCount,
            int batchSize, SourceFormat format) {
        this.source = Preconditions.checkNotNull(source, "source must not be null");
        Preconditions.checkArgument(StringUtils.isNotBlank(targetTable),
                "target table must not be blank");
        Preconditions.checkArgument(headerSkipCount >= 0,
                "skip-head-lines must not be negative: %s", headerSkipCount);
        Preconditions.checkArgument(batchSize > 0, "batch-size must be positive: %s", batchSize);
        this.targetTable = targetTable.trim();
        this.schema = StringUtils.isBlank(schema) ? null : schema;
        this.headerSkipCount = headerSkipCount;
        this.batchSize = batchSize;
        this.format = Preconditions.checkNotNull(format, "format must not be null");
    }

    /**
     * Returns whether a schema string was supplied.
     *
     * @return {@code true} if the table may be created from {@link #getSchema()}
     */
    public boolean hasSchema() {
        return schema != null;
    }
}
