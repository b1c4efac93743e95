package io.github.yok.bendload.source;

import io.github.yok.bendload.core.LoadErrorKind;
import io.github.yok.bendload.core.LoadException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.input.CloseShieldInputStream;

/**
 * Opens a {@link SourceSpec} as a {@link LineStream}.
 *
 * <p>
 * <strong>Behavior per origin:</strong>
 * </p>
 * <ul>
 * <li>{@link SourceSpec.Kind#LOCAL_PATH}: the file must exist and be readable; it is streamed, not
 * read into memory.</li>
 * <li>{@link SourceSpec.Kind#REMOTE_URL}: one blocking GET; the whole body is held in memory and
 * exposed line by line. Any status other than 2xx is a failure.</li>
 * <li>{@link SourceSpec.Kind#STDIN}: standard input, read until end of stream. Closing the
 * returned stream leaves the process's standard input open.</li>
 * </ul>
 *
 * <p>
 * All text is decoded as UTF-8; malformed bytes are replaced rather than rejected.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SourceReader {

    private final HttpClient httpClient;

    private final Supplier<InputStream> stdin;

    /**
     * Creates a reader that fetches URLs with a default HTTP client and reads {@link System#in}.
     */
    public SourceReader() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL).build(), () -> System.in);
    }

    /**
     * Creates a reader with explicit collaborators.
     *
     * @param httpClient client used for {@link SourceSpec.Kind#REMOTE_URL}
     * @param stdin supplier of the standard input stream
     */
    public SourceReader(HttpClient httpClient, Supplier<InputStream> stdin) {
        this.httpClient = httpClient;
        this.stdin = stdin;
    }

    /**
     * Opens the given source.
     *
     * @param spec source to open
     * @return line stream positioned at the first line
     * @throws LoadException with {@link LoadErrorKind#SOURCE_ERROR} if the path is missing or
     *         unreadable, or if the fetch fails
     */
    public LineStream open(SourceSpec spec) {
        switch (spec.getKind()) {
            case LOCAL_PATH:
                return openFile(spec.getLocation());
            case REMOTE_URL:
                return openUrl(spec.getLocation());
            case STDIN:
                log.info("Reading records from standard input (end with EOF)");
                return new LineStream(new InputStreamReader(
                        CloseShieldInputStream.wrap(stdin.get()), StandardCharsets.UTF_8),
                        spec.toString());
            default:
                throw new IllegalArgumentException("Unsupported source kind: " + spec.getKind());
        }
    }

    private LineStream openFile(String location) {
        Path path = Paths.get(location);
        if (!Files.exists(path)) {
            throw new LoadException(LoadErrorKind.SOURCE_ERROR,
                    "Source file does not exist: " + path.toAbsolutePath());
        }
        if (Files.isDirectory(path)) {
            throw new LoadException(LoadErrorKind.SOURCE_ERROR,
                    "Source is a directory, not a file: " + path.toAbsolutePath());
        }
        if (!Files.isReadable(path)) {
            throw new LoadException(LoadErrorKind.SOURCE_ERROR,
                    "Cannot open source file: permission denied: " + path.toAbsolutePath());
        }
        try {
            log.info("Reading records from file {}", path.toAbsolutePath());
            return new LineStream(
                    new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8),
                    location);
        } catch (IOException e) {
            throw new LoadException(LoadErrorKind.SOURCE_ERROR,
                    "Cannot open source file: " + path.toAbsolutePath(), e);
        }
    }

    private LineStream openUrl(String location) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder().uri(URI.create(location)).GET().build();
        } catch (IllegalArgumentException e) {
            throw new LoadException(LoadErrorKind.SOURCE_ERROR, "Invalid source URL: " + location,
                    e);
        }
        try {
            log.info("Fetching records from {}", location);
            HttpResponse<byte[]> response =
                    httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() / 100 != 2) {
                throw new LoadException(LoadErrorKind.SOURCE_ERROR,
                        "Cannot fetch source: HTTP " + response.statusCode() + " " + location);
            }
            byte[] body = response.body();
            log.debug("Fetched {} bytes from {}", body.length, location);
            return new LineStream(
                    new InputStreamReader(new ByteArrayInputStream(body), StandardCharsets.UTF_8),
                    location);
        } catch (IOException e) {
            throw new LoadException(LoadErrorKind.SOURCE_ERROR, "Cannot fetch source: " + location,
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoadException(LoadErrorKind.SOURCE_ERROR,
                    "Interrupted while fetching source: " + location, e);
        }
    }
}
