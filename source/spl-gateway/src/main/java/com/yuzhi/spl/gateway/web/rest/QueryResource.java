package com.yuzhi.spl.gateway.web.rest;

import com.yuzhi.spl.common.domain.OutputTable;
import com.yuzhi.spl.common.domain.VariableOption;
import com.yuzhi.spl.gateway.service.DashboardQueryService;
import com.yuzhi.spl.gateway.service.DatasourceHealthService;
import com.yuzhi.spl.gateway.service.HealthCheckResult;
import com.yuzhi.spl.gateway.web.rest.dto.BatchQueryRequest;
import com.yuzhi.spl.gateway.web.rest.dto.VariableQueryRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class QueryResource {

    private final DashboardQueryService queryService;
    private final DatasourceHealthService healthService;

    public QueryResource(DashboardQueryService queryService, DatasourceHealthService healthService) {
        this.queryService = queryService;
        this.healthService = healthService;
    }

    /**
     * Runs a dashboard batch. Guardrail blocks and per-target failures come back as diagnostic
     * tables inside a successful envelope.
     */
    @PostMapping("/query")
    public ApiResponse<List<OutputTable>> query(@Valid @RequestBody BatchQueryRequest request) {
        return ApiResponses.ok(queryService.runBatch(request));
    }

    @PostMapping("/query/variable")
    public ApiResponse<List<VariableOption>> variableValues(@Valid @RequestBody VariableQueryRequest request) {
        return ApiResponses.ok(queryService.variableValues(request));
    }

    @GetMapping("/health")
    public ApiResponse<HealthCheckResult> health() {
        HealthCheckResult result = healthService.check();
        if (!result.success()) {
            return ApiResponses.error(ApiResponses.DATASOURCE_DOWN_CODE, result.message(), result);
        }
        return ApiResponses.ok(result);
    }
}
