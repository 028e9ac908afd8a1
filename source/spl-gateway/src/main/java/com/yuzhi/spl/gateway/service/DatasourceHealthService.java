package com.yuzhi.spl.gateway.service;

import com.yuzhi.spl.common.transport.SearchTransport;
import com.yuzhi.spl.common.transport.SearchTransportException;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DatasourceHealthService {

    private static final Logger log = LoggerFactory.getLogger(DatasourceHealthService.class);

    static final String SUCCESS_MESSAGE = "Splunk datasource is reachable";
    static final String FAILURE_PREFIX = "Splunk health check failed: ";

    private final SearchTransport transport;

    public DatasourceHealthService(SearchTransport transport) {
        this.transport = transport;
    }

    /**
     * Probes the server info endpoint. Never throws; failures are reported in the result.
     */
    public HealthCheckResult check() {
        long start = System.nanoTime();
        try {
            transport.ping();
            return HealthCheckResult.success(elapsedSince(start));
        } catch (SearchTransportException ex) {
            long elapsed = elapsedSince(start);
            log.warn("Splunk health check failed after {}ms: {}", elapsed, ex.getMessage());
            return HealthCheckResult.failure(FAILURE_PREFIX + StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName()), elapsed);
        }
    }

    private static long elapsedSince(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
}
