package io.github.yok.bendload.client;

import io.github.yok.bendload.config.EndpointConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates the {@link QueryEndpointClient} for a load.
 *
 * <p>
 * The client is created once per load from {@link EndpointConfig} and shared read-only by the
 * schema check and every batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryEndpointClientFactory {

    // Endpoint settings (url, credentials, timeouts)
    private final EndpointConfig endpointConfig;

    /**
     * Creates a client for the configured endpoint.
     *
     * @return client bound to {@code endpoint.url}
     * @throws IllegalStateException if the endpoint is not configured
     */
    public QueryEndpointClient create() {
        HttpQueryEndpointClient client = new HttpQueryEndpointClient(endpointConfig);
        log.info("Query endpoint: {}{}", client.getBaseUrl(), HttpQueryEndpointClient.QUERY_PATH);
        return client;
    }
}
