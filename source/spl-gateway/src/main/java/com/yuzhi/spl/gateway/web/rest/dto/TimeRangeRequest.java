package com.yuzhi.spl.gateway.web.rest.dto;

/**
 * Dashboard time range. Each bound is epoch milliseconds, an ISO-8601 instant or a Splunk
 * relative token such as {@code -1h@h} or {@code now}.
 */
public record TimeRangeRequest(String from, String to) {}
