package de.bsommerfeld.selfupdate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * HTTP timeouts shared by manifest checks and artifact downloads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NetworkConfig {

    @JsonProperty("connect-timeout-seconds")
    private int connectTimeoutSeconds = 15;

    /**
     * Upper bound until response headers arrive, and for any silent gap while
     * the body streams. The total body duration is not capped.
     */
    @JsonProperty("request-timeout-seconds")
    private int requestTimeoutSeconds = 60;

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public Duration connectTimeout() {
        return Duration.ofSeconds(connectTimeoutSeconds);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }
}
