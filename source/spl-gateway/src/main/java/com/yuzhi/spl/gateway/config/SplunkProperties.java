package com.yuzhi.spl.gateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "spl.splunk")
public class SplunkProperties {

    /** Base URL of the Splunk management port, e.g. https://splunk:8089. */
    private String baseUrl = "https://localhost:8089";

    /** Name of the header carrying credentials on every call. */
    private String headerName = "Authorization";

    /** Header value, e.g. "Bearer <token>". No header is sent when empty. */
    private String headerValue;

    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Read timeout of a single REST call, in milliseconds. */
    private long requestTimeoutMs = 30_000;

    /** Upper bound for one batch query pass; remaining targets are cancelled once it passes. */
    private Duration batchTimeout = Duration.ofMinutes(5);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getHeaderName() {
        return headerName;
    }

    public void setHeaderName(String headerName) {
        this.headerName = headerName;
    }

    public String getHeaderValue() {
        return headerValue;
    }

    public void setHeaderValue(String headerValue) {
        this.headerValue = headerValue;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public Duration getBatchTimeout() {
        return batchTimeout;
    }

    public void setBatchTimeout(Duration batchTimeout) {
        this.batchTimeout = batchTimeout;
    }
}
