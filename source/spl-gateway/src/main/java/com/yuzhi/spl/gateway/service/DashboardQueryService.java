package com.yuzhi.spl.gateway.service;

import com.yuzhi.spl.common.domain.BatchResult;
import com.yuzhi.spl.common.domain.OutputTable;
import com.yuzhi.spl.common.domain.QueryTarget;
import com.yuzhi.spl.common.domain.TimeWindow;
import com.yuzhi.spl.common.domain.VariableBindings;
import com.yuzhi.spl.common.domain.VariableOption;
import com.yuzhi.spl.common.service.QueryCancellation;
import com.yuzhi.spl.common.service.QueryOrchestrator;
import com.yuzhi.spl.common.service.util.SplunkTimes;
import com.yuzhi.spl.gateway.config.SplunkProperties;
import com.yuzhi.spl.gateway.web.rest.dto.BatchQueryRequest;
import com.yuzhi.spl.gateway.web.rest.dto.TargetRequest;
import com.yuzhi.spl.gateway.web.rest.dto.TimeRangeRequest;
import com.yuzhi.spl.gateway.web.rest.dto.VariableQueryRequest;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Translates dashboard requests into {@link QueryOrchestrator} calls.
 */
@Service
public class DashboardQueryService {

    private static final Logger log = LoggerFactory.getLogger(DashboardQueryService.class);

    static final String DEFAULT_EARLIEST = "-15m";
    static final String DEFAULT_LATEST = "now";

    private final QueryOrchestrator orchestrator;
    private final SplunkProperties properties;

    public DashboardQueryService(QueryOrchestrator orchestrator, SplunkProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    public List<OutputTable> runBatch(BatchQueryRequest request) {
        List<QueryTarget> targets = new ArrayList<>();
        if (request.targets() != null) {
            for (TargetRequest target : request.targets()) {
                if (target != null) {
                    targets.add(new QueryTarget(target.refId(), target.queryText(), target.hide()));
                }
            }
        }
        TimeWindow window = toWindow(request.range());
        BatchResult result = orchestrator.query(targets, window, VariableBindings.of(request.scopedVars()), newCancellation());
        log.debug("Batch of {} targets produced {} tables", targets.size(), result.tables().size());
        return result.tables();
    }

    public List<VariableOption> variableValues(VariableQueryRequest request) {
        return orchestrator.findVariableValues(request.queryText(), VariableBindings.of(request.scopedVars()));
    }

    /**
     * Each bound is kept as an instant when it parses as one and as a relative token otherwise.
     */
    static TimeWindow toWindow(TimeRangeRequest range) {
        if (range == null || (StringUtils.isBlank(range.from()) && StringUtils.isBlank(range.to()))) {
            return TimeWindow.relative(DEFAULT_EARLIEST, DEFAULT_LATEST);
        }
        String from = StringUtils.defaultIfBlank(StringUtils.trim(range.from()), DEFAULT_EARLIEST);
        String to = StringUtils.defaultIfBlank(StringUtils.trim(range.to()), DEFAULT_LATEST);
        Optional<Instant> start = parseInstant(from);
        Optional<Instant> end = parseInstant(to);
        return TimeWindow.of(start.orElse(null), start.isPresent() ? null : from, end.orElse(null), end.isPresent() ? null : to);
    }

    static Optional<Instant> parseInstant(String value) {
        if (StringUtils.isNumeric(value)) {
            try {
                return Optional.of(Instant.ofEpochMilli(Long.parseLong(value)));
            } catch (NumberFormatException ex) {
                log.debug("Epoch millis out of range: {}", value);
                return Optional.empty();
            }
        }
        if (value.startsWith("-") || value.startsWith("+") || value.startsWith("now") || value.startsWith("@")) {
            return Optional.empty();
        }
        return SplunkTimes.parse(value);
    }

    private QueryCancellation newCancellation() {
        Duration timeout = properties.getBatchTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return QueryCancellation.create();
        }
        return QueryCancellation.withTimeout(timeout);
    }
}
