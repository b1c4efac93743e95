package io.github.yok.bendload;

import io.github.yok.bendload.client.QueryEndpointClient;
import io.github.yok.bendload.client.QueryEndpointClientFactory;
import io.github.yok.bendload.config.EndpointConfig;
import io.github.yok.bendload.config.LoadConfig;
import io.github.yok.bendload.core.BatchOutcome;
import io.github.yok.bendload.core.BulkLoader;
import io.github.yok.bendload.core.LoadException;
import io.github.yok.bendload.core.LoadRequest;
import io.github.yok.bendload.core.LoadResult;
import io.github.yok.bendload.source.SourceFormat;
import io.github.yok.bendload.source.SourceReader;
import io.github.yok.bendload.source.SourceSpec;
import io.github.yok.bendload.util.ErrorHandler;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options, resolves them into a {@link LoadRequest} and runs it with
 * {@link BulkLoader}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code [source]}, {@code --load [source]} or {@code -l [source]}: file path or
 * {@code http(s)} URL to load. When omitted (or {@code -}), records are read from standard
 * input.</li>
 * <li>{@code --table [name]} or {@code -t [name]}: target table (required).</li>
 * <li>{@code --schema [a:uint8, b:uint64]} or {@code -s [...]}: column declarations used to create
 * the table when it does not exist. While the value ends with a comma the next argument is
 * appended, so an unquoted schema may contain spaces after its commas.</li>
 * <li>{@code --skip-head-lines [n]}: number of leading lines to ignore.</li>
 * <li>{@code --batch-size [n]}: maximum number of lines per INSERT statement.</li>
 * <li>{@code --format [csv]}: input format; only {@code csv} is supported.</li>
 * </ul>
 *
 * <p>
 * Defaults for the numeric options come from {@link LoadConfig}; the query service is taken from
 * {@link EndpointConfig}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see LoadConfig
 * @see EndpointConfig
 * @see BulkLoader
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final LoadConfig loadConfig;
    private final QueryEndpointClientFactory clientFactory;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        LoadRequest request;
        try {
            request = parseArguments(loadConfig, args);
        } catch (IllegalArgumentException e) {
            ErrorHandler.errorAndExit("Invalid arguments: " + e.getMessage());
            return;
        }
        log.info("Load request: {}", request);

        QueryEndpointClient client;
        try {
            client = clientFactory.create();
        } catch (IllegalStateException e) {
            ErrorHandler.errorAndExit("Query endpoint is not available", e);
            return;
        }

        try {
            LoadResult result =
                    new BulkLoader(new SourceReader(), client, loadConfig).execute(request);
            for (BatchOutcome failed : result.getFailedBatches()) {
                System.err.println("cannot insert data into " + request.getTargetTable()
                        + " (batch " + failed.getBatchIndex() + "), error: " + failed.getMessage());
            }
            log.info("Load into {} finished with status {}", request.getTargetTable(),
                    result.getStatus());
        } catch (LoadException e) {
            ErrorHandler.loadFailed(request.getTargetTable(), e);
        } catch (Exception e) {
            log.error("Fatal error occurred (table={}): {}", request.getTargetTable(),
                    e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    /**
     * Resolves command-line arguments into a load request.
     *
     * @param defaults defaults for options that are not given
     * @param args command-line arguments
     * @return load request
     * @throws IllegalArgumentException if an option is missing, malformed or out of range
     */
    static LoadRequest parseArguments(LoadConfig defaults, String... args) {
        String source = null;
        String table = null;
        String schema = null;
        int skipHeadLines = defaults.getSkipHeadLines();
        int batchSize = defaults.getBatchSize();
        SourceFormat format = SourceFormat.CSV;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--load":
                case "-l":
                    source = requireValue(args, ++i, "--load");
                    break;
                case "--table":
                case "-t":
                    table = requireValue(args, ++i, "--table");
                    break;
                case "--schema":
                case "-s":
                    if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
                        throw new IllegalArgumentException("--schema requires a value");
                    }
                    StringBuilder declared = new StringBuilder(args[++i]);
                    // "a:uint8, b:uint64" arrives split after the comma
                    while (StringUtils.stripEnd(declared.toString(), null).endsWith(",")
                            && i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        declared.append(' ').append(args[++i]);
                    }
                    schema = declared.toString();
                    break;
                case "--skip-head-lines":
                    skipHeadLines = parseInt(requireValue(args, ++i, "--skip-head-lines"),
                            "--skip-head-lines");
                    break;
                case "--batch-size":
                    batchSize = parseInt(requireValue(args, ++i, "--batch-size"), "--batch-size");
                    break;
                case "--format":
                    format = SourceFormat.fromName(requireValue(args, ++i, "--format"));
                    break;
                default:
                    if (!args[i].startsWith("-") && source == null) {
                        source = args[i];
                    } else if ("-".equals(args[i]) && source == null) {
                        source = "-";
                    } else {
                        log.warn("Unknown argument: {}", args[i]);
                    }
            }
        }

        if (StringUtils.isBlank(table)) {
            throw new IllegalArgumentException("--table is required");
        }
        return new LoadRequest(SourceSpec.of(source), table, schema, skipHeadLines, batchSize,
                format);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static int parseInt(String value, String option) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " must be an integer: " + value, e);
        }
    }
}
