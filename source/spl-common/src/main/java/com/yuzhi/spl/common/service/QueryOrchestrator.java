package com.yuzhi.spl.common.service;

import com.yuzhi.spl.common.config.GuardrailConfig;
import com.yuzhi.spl.common.domain.BatchResult;
import com.yuzhi.spl.common.domain.OutputTable;
import com.yuzhi.spl.common.domain.QueryTarget;
import com.yuzhi.spl.common.domain.ResultPage;
import com.yuzhi.spl.common.domain.SearchRecord;
import com.yuzhi.spl.common.domain.TargetResult;
import com.yuzhi.spl.common.domain.TimeWindow;
import com.yuzhi.spl.common.domain.VariableBindings;
import com.yuzhi.spl.common.domain.VariableOption;
import com.yuzhi.spl.common.service.exception.QueryCancelledException;
import com.yuzhi.spl.common.service.guard.GuardrailEvaluator;
import com.yuzhi.spl.common.service.guard.GuardrailVerdict;
import com.yuzhi.spl.common.service.util.RowMapper;
import com.yuzhi.spl.common.service.util.VariableInterpolator;
import com.yuzhi.spl.common.transport.SearchTransport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.Sleeper;

/**
 * Runs dashboard query batches against the search engine: interpolate, gate, create and await
 * the job, page the results and map them into tables. Every visible target yields exactly one
 * table; failures become diagnostic rows instead of exceptions.
 */
public class QueryOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(QueryOrchestrator.class);

    static final String VARIABLE_EARLIEST = "-15m";
    static final String VARIABLE_LATEST = "now";
    static final int VARIABLE_PAGE_SIZE = 500;
    private static final int LOG_QUERY_MAX = 256;

    private final GuardrailConfig config;
    private final GuardrailEvaluator guardrails;
    private final SearchTransport transport;
    private final RowMapper rowMapper;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Counter succeeded;
    private final Counter blocked;
    private final Counter failed;
    private final Timer jobLatency;

    public QueryOrchestrator(GuardrailConfig config, SearchTransport transport, MeterRegistry registry) {
        this(config, transport, registry, Clock.systemUTC(), null);
    }

    /**
     * @param sleeper waits between status polls; null waits on the batch's cancellation signal
     */
    public QueryOrchestrator(GuardrailConfig config, SearchTransport transport, MeterRegistry registry, Clock clock, Sleeper sleeper) {
        this.config = config;
        this.guardrails = new GuardrailEvaluator(config, clock);
        this.transport = transport;
        this.clock = clock;
        this.rowMapper = new RowMapper(clock);
        this.sleeper = sleeper;
        this.succeeded = Counter.builder("spl_targets_total").tag("outcome", "success").register(registry);
        this.blocked = Counter.builder("spl_targets_total").tag("outcome", "blocked").register(registry);
        this.failed = Counter.builder("spl_targets_total").tag("outcome", "error").register(registry);
        this.jobLatency = Timer.builder("spl_job_latency_ms").publishPercentiles(0.5, 0.95, 0.99).register(registry);
    }

    public BatchResult query(List<QueryTarget> targets, TimeWindow window, VariableBindings variables) {
        return query(targets, window, variables, QueryCancellation.create());
    }

    /**
     * Runs the visible targets in order. A time window larger than the safe-mode cap rejects the
     * whole batch with a single diagnostic table and no remote calls.
     */
    public BatchResult query(List<QueryTarget> targets, TimeWindow window, VariableBindings variables, QueryCancellation cancellation) {
        Optional<String> violation = guardrails.checkTimeRange(window);
        if (violation.isPresent()) {
            LOG.info("Batch rejected by time range guardrail: {}", violation.get());
            return BatchResult.rejected(OutputTable.rangeViolation(violation.get(), clock.instant()));
        }
        List<TargetResult> results = new ArrayList<>();
        if (targets == null) {
            return BatchResult.of(results);
        }
        QueryCancellation signal = cancellation != null ? cancellation : QueryCancellation.create();
        for (QueryTarget target : targets) {
            if (target == null || target.hide()) {
                continue;
            }
            results.add(runTarget(target, window, variables, signal));
        }
        return BatchResult.of(results);
    }

    /**
     * Resolves the values of a dashboard variable. Never throws: a blocked query or any failure
     * yields an empty list.
     */
    public List<VariableOption> findVariableValues(String template, VariableBindings variables) {
        String query = VariableInterpolator.interpolate(template, variables);
        GuardrailVerdict verdict = guardrails.evaluate(query);
        if (!verdict.isAllowed()) {
            LOG.debug("Variable query blocked: {}", verdict.reason());
            return List.of();
        }
        QueryCancellation cancellation = QueryCancellation.create();
        try {
            SearchJobController job = newJob(cancellation);
            String sid = job.run(query, TimeWindow.relative(VARIABLE_EARLIEST, VARIABLE_LATEST));
            ResultPage page = newPaginator(cancellation).firstPage(sid, VARIABLE_PAGE_SIZE);
            return toOptions(page);
        } catch (RuntimeException e) {
            LOG.warn("Variable query failed, returning no values. query='{}', reason={}", abbreviate(query), describe(e));
            return List.of();
        }
    }

    private TargetResult runTarget(QueryTarget target, TimeWindow window, VariableBindings variables, QueryCancellation cancellation) {
        String refId = target.refId();
        if (cancellation.isCancelled()) {
            failed.increment();
            LOG.debug("Target {} skipped, batch cancelled", refId);
            String reason = QueryCancelledException.DEFAULT_MESSAGE;
            return TargetResult.failed(refId, OutputTable.error(refId, reason, clock.instant()), reason);
        }
        String query = VariableInterpolator.interpolate(target.queryText(), variables);
        GuardrailVerdict verdict = guardrails.evaluate(query);
        if (!verdict.isAllowed()) {
            blocked.increment();
            LOG.info("Target {} blocked by guardrails: {}", refId, verdict.reason());
            return TargetResult.blocked(refId, OutputTable.warning(refId, verdict.reason(), clock.instant()), verdict.reason());
        }

        OutputTable table = OutputTable.data(refId);
        Timer.Sample sample = Timer.start();
        try {
            SearchJobController job = newJob(cancellation);
            String sid = job.run(query, window);
            ResultPaginator.PageCursor cursor = newPaginator(cancellation).open(sid);
            while (cursor.hasNext()) {
                for (SearchRecord record : cursor.next().records()) {
                    table.add(rowMapper.map(record));
                }
            }
            succeeded.increment();
            LOG.debug("Target {} finished. sid={}, polls={}, rows={}", refId, sid, job.getPolls(), table.size());
            return TargetResult.success(refId, table);
        } catch (RuntimeException e) {
            failed.increment();
            String reason = describe(e);
            LOG.warn("Target {} failed. query='{}', reason={}", refId, abbreviate(query), reason);
            return TargetResult.failed(refId, OutputTable.error(refId, reason, clock.instant()), reason);
        } finally {
            sample.stop(jobLatency);
        }
    }

    private SearchJobController newJob(QueryCancellation cancellation) {
        return new SearchJobController(transport, PollPolicy.from(config, sleeper), cancellation);
    }

    private ResultPaginator newPaginator(QueryCancellation cancellation) {
        return ResultPaginator.from(transport, config, cancellation);
    }

    private static List<VariableOption> toOptions(ResultPage page) {
        List<SearchRecord> records = page.records();
        if (records.isEmpty()) {
            return List.of();
        }
        Optional<String> field = page.firstFieldName().or(() -> records.get(0).firstFieldName());
        if (field.isEmpty()) {
            return List.of();
        }
        Set<String> values = new LinkedHashSet<>();
        for (SearchRecord record : records) {
            record.text(field.get()).filter(StringUtils::isNotEmpty).ifPresent(values::add);
        }
        return values.stream().map(VariableOption::of).toList();
    }

    /**
     * First non-blank message in the cause chain.
     */
    static String describe(Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth < 10) {
            if (StringUtils.isNotBlank(current.getMessage())) {
                return current.getMessage().trim();
            }
            current = current.getCause();
            depth++;
        }
        return "Query failed";
    }

    private static String abbreviate(String query) {
        return StringUtils.abbreviate(query, LOG_QUERY_MAX);
    }
}
