package io.github.yok.bendload.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code endpoint} section in {@code application.yml}.
 *
 * <pre>
 * endpoint:
 *   url: http://127.0.0.1:8000
 *   user: root
 *   password: ""
 *   connect-timeout-ms: 10000
 *   read-timeout-ms: 60000
 * </pre>
 *
 * <p>
 * The URL is the base address of the query service; statements are posted to
 * {@code <url>/v1/query/}. When {@code user} is blank no {@code Authorization} header is sent.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "endpoint")
@Data
public class EndpointConfig {

    // Base URL of the query service (e.g., http://127.0.0.1:8000)
    private String url;

    // User for basic authentication (optional)
    private String user;

    // Password for basic authentication (optional)
    private String password;

    // Connect timeout for the HTTP client, in milliseconds
    private int connectTimeoutMs = 10_000;

    // Per-request timeout, in milliseconds
    private int readTimeoutMs = 60_000;

    /**
     * Returns the base URL without a trailing slash.
     *
     * @return normalized base URL
     * @throws IllegalStateException if {@code url} has not been set
     */
    public String getUrl() {
        if (StringUtils.isBlank(url)) {
            throw new IllegalStateException("endpoint.url is not configured. "
                    + "Please set 'endpoint.url' in application.yml.");
        }
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    /**
     * Returns whether basic authentication credentials are configured.
     *
     * @return {@code true} if {@code user} is not blank
     */
    public boolean hasCredentials() {
        return StringUtils.isNotBlank(user);
    }
}
