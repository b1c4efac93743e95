package io.github.yok.bendload.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.bendload.config.EndpointConfig;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link QueryEndpointClient} that talks to the query service's HTTP handler.
 *
 * <p>
 * A statement is submitted as {@code POST <url>/v1/query/} with the body
 * {@code {"sql": "<statement>"}}. The response is a JSON page:
 * </p>
 *
 * <pre>
 * {
 *   "id": "...",
 *   "columns": {"fields": [{"name": "name", ...}]},
 *   "data": [["t1"], ["t2"]],
 *   "next_uri": "/v1/query/.../page/1",
 *   "error": null
 * }
 * </pre>
 *
 * <p>
 * While {@code next_uri} is present the following pages are fetched with {@code GET} and their
 * rows appended. A non-2xx status or a non-null {@code error} on any page fails the call.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class HttpQueryEndpointClient implements QueryEndpointClient {

    static final String QUERY_PATH = "/v1/query/";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client;

    private final String baseUrl;

    private final Duration readTimeout;

    // Value of the Authorization header, or null when no credentials are configured
    private final String authorization;

    /**
     * Creates a client from the endpoint settings.
     *
     * @param config endpoint settings
     * @throws IllegalStateException if {@code endpoint.url} is not configured
     */
    public HttpQueryEndpointClient(EndpointConfig config) {
        this.baseUrl = config.getUrl();
        this.readTimeout = Duration.ofMillis(config.getReadTimeoutMs());
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs())).build();
        this.authorization = config.hasCredentials()
                ? "Basic " + Base64.getEncoder()
                        .encodeToString((config.getUser() + ":"
                                + StringUtils.defaultString(config.getPassword()))
                                        .getBytes(StandardCharsets.UTF_8))
                : null;
    }

    /**
     * Returns the base URL statements are sent to.
     *
     * @return base URL without trailing slash
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public QueryResult execute(String statement) throws QueryExecutionException {
        String submitJson;
        try {
            submitJson = MAPPER.writeValueAsString(MAPPER.createObjectNode().put("sql", statement));
        } catch (JsonProcessingException e) {
            throw new QueryExecutionException("Cannot encode statement", e);
        }

        HttpRequest submit = newRequest(URI.create(baseUrl + QUERY_PATH))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(submitJson, StandardCharsets.UTF_8))
                .build();

        JsonNode page = send(submit);
        String queryId = page.path("id").asText(null);
        List<String> columns = readColumns(page);
        List<List<String>> rows = appendRows(null, page);

        String next = nextUri(page);
        while (next != null) {
            log.debug("Fetching next page of query {}: {}", queryId, next);
            JsonNode nextPage = send(newRequest(URI.create(baseUrl).resolve(next)).GET().build());
            if (columns == null) {
                columns = readColumns(nextPage);
            }
            rows = appendRows(rows, nextPage);
            next = nextUri(nextPage);
        }
        return new QueryResult(queryId, columns, rows);
    }

    private HttpRequest.Builder newRequest(URI uri) {
        HttpRequest.Builder builder =
                HttpRequest.newBuilder().uri(uri).timeout(readTimeout).header("Accept",
                        "application/json");
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return builder;
    }

    private JsonNode send(HttpRequest request) throws QueryExecutionException {
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new QueryExecutionException(
                    "Query request failed: " + request.method() + " " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted while waiting for " + request.uri(),
                    e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new QueryExecutionException(
                    "Query failed: HTTP " + response.statusCode() + " " + response.body());
        }

        JsonNode node;
        try {
            node = MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new QueryExecutionException("Malformed query response: " + response.body(), e);
        }
        JsonNode error = node.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String message = error.isTextual() ? error.asText()
                    : error.path("message").asText(error.toString());
            throw new QueryExecutionException("Query failed: " + message);
        }
        return node;
    }

    private static List<String> readColumns(JsonNode page) {
        JsonNode fields = page.path("columns").path("fields");
        if (!fields.isArray()) {
            return null;
        }
        List<String> names = new ArrayList<>(fields.size());
        fields.forEach(f -> names.add(f.path("name").asText()));
        return names;
    }

    private static List<List<String>> appendRows(List<List<String>> rows, JsonNode page) {
        JsonNode data = page.path("data");
        if (!data.isArray()) {
            return rows;
        }
        List<List<String>> acc = rows != null ? rows : new ArrayList<>();
        for (JsonNode row : data) {
            List<String> cells = new ArrayList<>(row.size());
            row.forEach(cell -> cells.add(cell.isValueNode() ? cell.asText() : cell.toString()));
            acc.add(cells);
        }
        return acc;
    }

    private static String nextUri(JsonNode page) {
        String next = page.path("next_uri").asText(null);
        return StringUtils.isBlank(next) ? null : next;
    }
}
