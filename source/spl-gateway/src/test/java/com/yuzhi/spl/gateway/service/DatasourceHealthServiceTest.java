package com.yuzhi.spl.gateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;

import com.yuzhi.spl.common.transport.SearchTransport;
import com.yuzhi.spl.common.transport.SearchTransportException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DatasourceHealthServiceTest {

    @Mock
    private SearchTransport transport;

    @InjectMocks
    private DatasourceHealthService service;

    @Test
    void reachableDatasource() {
        HealthCheckResult result = service.check();

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("Splunk datasource is reachable");
        assertThat(result.elapsedMillis()).isNotNegative();
    }

    @Test
    void failureIsReportedNotThrown() {
        doThrow(new SearchTransportException("Splunk request failed: 401 Unauthorized", 401, null)).when(transport).ping();

        HealthCheckResult result = service.check();

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("Splunk health check failed: Splunk request failed: 401 Unauthorized");
    }
}
