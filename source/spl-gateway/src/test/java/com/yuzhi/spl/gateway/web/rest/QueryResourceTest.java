package com.yuzhi.spl.gateway.web.rest;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.yuzhi.spl.common.domain.LogRow;
import com.yuzhi.spl.common.domain.OutputTable;
import com.yuzhi.spl.common.domain.VariableOption;
import com.yuzhi.spl.gateway.service.DashboardQueryService;
import com.yuzhi.spl.gateway.service.DatasourceHealthService;
import com.yuzhi.spl.gateway.service.HealthCheckResult;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class QueryResourceTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private DashboardQueryService queryService;

    @Mock
    private DatasourceHealthService healthService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new QueryResource(queryService, healthService)).setControllerAdvice(new ApiErrorHandler()).build();
    }

    @Test
    void queryReturnsTablesInEnvelope() throws Exception {
        OutputTable data = OutputTable.data("A");
        data.add(new LogRow(AT, "web-1", "GET /index 200"));
        OutputTable blocked = OutputTable.warning("B", "Query includes a risky Splunk command (delete) and is blocked by guardrails.", AT);
        when(queryService.runBatch(any())).thenReturn(List.of(data, blocked));

        mockMvc
            .perform(
                post("/api/query")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        "{\"targets\":[{\"refId\":\"A\",\"queryText\":\"search index=web\"},{\"refId\":\"B\",\"queryText\":\"search * | delete\"}]," +
                        "\"range\":{\"from\":\"1714557600000\",\"to\":\"1714561200000\"}}"
                    )
            )
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value(200))
            .andExpect(jsonPath("$.data", hasSize(2)))
            .andExpect(jsonPath("$.data[0].refId").value("A"))
            .andExpect(jsonPath("$.data[0].fields[2]").value("message"))
            .andExpect(jsonPath("$.data[0].rows[0].host").value("web-1"))
            .andExpect(jsonPath("$.data[1].fields[1]").value("warning"))
            .andExpect(jsonPath("$.data[1].rows[0].warning").value("Query includes a risky Splunk command (delete) and is blocked by guardrails."));
    }

    @Test
    void missingTargetsIsBadRequest() throws Exception {
        mockMvc
            .perform(post("/api/query").contentType(MediaType.APPLICATION_JSON).content("{\"range\":{\"from\":\"-1h\",\"to\":\"now\"}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400))
            .andExpect(jsonPath("$.code").value("spl-req-0001"));

        verifyNoInteractions(queryService);
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc
            .perform(post("/api/query").contentType(MediaType.APPLICATION_JSON).content("{\"targets\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void variableValuesAreTextValuePairs() throws Exception {
        when(queryService.variableValues(any())).thenReturn(List.of(VariableOption.of("web-1"), VariableOption.of("web-2")));

        mockMvc
            .perform(
                post("/api/query/variable").contentType(MediaType.APPLICATION_JSON).content("{\"queryText\":\"search index=web | stats count by host\"}")
            )
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data", hasSize(2)))
            .andExpect(jsonPath("$.data[1].text").value("web-2"))
            .andExpect(jsonPath("$.data[1].value").value("web-2"));
    }

    @Test
    void healthFailureUsesErrorEnvelope() throws Exception {
        when(healthService.check()).thenReturn(HealthCheckResult.failure("Splunk health check failed: Splunk request failed: 401 Unauthorized", 12));

        mockMvc
            .perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value(-1))
            .andExpect(jsonPath("$.code").value("spl-ds-0001"))
            .andExpect(jsonPath("$.data.success").value(false));
    }

    @Test
    void healthSuccess() throws Exception {
        when(healthService.check()).thenReturn(HealthCheckResult.success(7));

        mockMvc.perform(get("/api/health")).andExpect(jsonPath("$.status").value(200)).andExpect(jsonPath("$.data.elapsedMillis").value(7));
    }
}
