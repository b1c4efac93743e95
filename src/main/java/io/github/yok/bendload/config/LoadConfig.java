package io.github.yok.bendload.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds the defaults of a load.
 *
 * <p>
 * You can specify the following properties in {@code application.yml} or
 * {@code application.properties}.
 * </p>
 * <ul>
 * <li>{@code load.batch-size}: maximum number of lines per INSERT statement</li>
 * <li>{@code load.skip-head-lines}: number of leading lines discarded before data</li>
 * <li>{@code load.parallelism}: worker count used to render one batch</li>
 * <li>{@code load.table-engine}: engine clause of generated {@code CREATE TABLE} statements</li>
 * </ul>
 *
 * <p>
 * Values given on the command line override these defaults for a single run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "load")
@Getter
@Setter
@NoArgsConstructor
public class LoadConfig {

    /**
     * Default number of lines per batch.
     */
    public static final int DEFAULT_BATCH_SIZE = 100_000;

    /**
     * Maximum number of lines grouped into one INSERT statement.
     */
    private int batchSize = DEFAULT_BATCH_SIZE;

    /**
     * Number of leading lines skipped before any line is treated as data.
     */
    private int skipHeadLines = 0;

    /**
     * Worker count for rendering a batch into value fragments.
     */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    /**
     * Engine used in {@code CREATE TABLE ... Engine = <engine>;}.
     */
    private String tableEngine = "Fuse";
}
