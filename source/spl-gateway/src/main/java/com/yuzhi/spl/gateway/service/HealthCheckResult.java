package com.yuzhi.spl.gateway.service;

/**
 * Outcome of a datasource connectivity probe.
 */
public record HealthCheckResult(boolean success, String message, long elapsedMillis) {
    public static HealthCheckResult success(long elapsedMillis) {
        return new HealthCheckResult(true, DatasourceHealthService.SUCCESS_MESSAGE, elapsedMillis);
    }

    public static HealthCheckResult failure(String message, long elapsedMillis) {
        return new HealthCheckResult(false, message, elapsedMillis);
    }
}
