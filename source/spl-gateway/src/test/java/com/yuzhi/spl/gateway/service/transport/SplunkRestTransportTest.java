package com.yuzhi.spl.gateway.service.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.yuzhi.spl.common.domain.JobStatus;
import com.yuzhi.spl.common.domain.ResultPage;
import com.yuzhi.spl.common.transport.SearchTransportException;
import com.yuzhi.spl.gateway.config.SplunkProperties;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class SplunkRestTransportTest {

    private static final String BASE = "https://splunk.example:8089";

    private MockRestServiceServer server;
    private SplunkRestTransport transport;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        SplunkProperties properties = new SplunkProperties();
        properties.setBaseUrl(BASE + "/");
        properties.setHeaderValue("Bearer test-token");
        transport = new SplunkRestTransport(restTemplate, properties);
    }

    @Test
    void createJobPostsFormAndReturnsSid() {
        server
            .expect(requestTo(BASE + "/services/search/jobs"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer test-token"))
            .andExpect(
                content()
                    .formDataContains(
                        Map.of(
                            "search",
                            "search index=main error",
                            "earliest_time",
                            "2024-05-01T10:00:00Z",
                            "latest_time",
                            "now",
                            "output_mode",
                            "json"
                        )
                    )
            )
            .andRespond(withSuccess("{\"sid\":\"1714557600.42\"}", MediaType.APPLICATION_JSON));

        assertThat(transport.createJob("search index=main error", "2024-05-01T10:00:00Z", "now")).contains("1714557600.42");
        server.verify();
    }

    @Test
    void createJobWithoutSidIsEmpty() {
        server
            .expect(requestTo(BASE + "/services/search/jobs"))
            .andRespond(withSuccess("{\"messages\":[{\"type\":\"WARN\",\"text\":\"quota\"}]}", MediaType.APPLICATION_JSON));

        assertThat(transport.createJob("search *", "-15m", "now")).isEmpty();
    }

    @Test
    void jobStatusReadsFirstEntry() {
        server
            .expect(requestTo(BASE + "/services/search/jobs/1714557600.42?output_mode=json"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(
                withSuccess(
                    "{\"entry\":[{\"name\":\"search *\",\"content\":{\"isDone\":false,\"dispatchState\":\"FINALIZING\",\"doneProgress\":0.9}}]}",
                    MediaType.APPLICATION_JSON
                )
            );

        JobStatus status = transport.jobStatus("1714557600.42");

        assertThat(status.done()).isFalse();
        assertThat(status.dispatchState()).isEqualTo("FINALIZING");
        assertThat(status.isReadable()).isTrue();
    }

    @Test
    void jobStatusWithoutEntryFails() {
        server.expect(requestTo(BASE + "/services/search/jobs/sid-1?output_mode=json")).andRespond(withSuccess("{\"entry\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> transport.jobStatus("sid-1")).isInstanceOf(SearchTransportException.class).hasMessageContaining("sid-1");
    }

    @Test
    void fetchResultsPassesCountAndOffset() {
        server
            .expect(requestTo(BASE + "/services/search/jobs/sid-7/results?output_mode=json&count=200&offset=400"))
            .andRespond(
                withSuccess(
                    "{\"fields\":[{\"name\":\"_time\"},{\"name\":\"host\"},{\"name\":\"_raw\"}]," +
                    "\"results\":[{\"_time\":\"2024-05-01T10:00:00.000+00:00\",\"host\":\"web-1\",\"_raw\":\"GET /index 200\"}," +
                    "{\"_time\":\"2024-05-01T10:00:01.000+00:00\",\"host\":\"web-2\",\"_raw\":\"GET /login 500\"}]}",
                    MediaType.APPLICATION_JSON
                )
            );

        ResultPage page = transport.fetchResults("sid-7", 200, 400);

        assertThat(page.size()).isEqualTo(2);
        assertThat(page.fieldNames()).containsExactly("_time", "host", "_raw");
        assertThat(page.records().get(1).host()).contains("web-2");
        assertThat(page.records().get(0).raw()).contains("GET /index 200");
    }

    @Test
    void nonSuccessStatusCarriesStatusCode() {
        server.expect(requestTo(BASE + "/services/search/jobs")).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> transport.createJob("search *", "-15m", "now"))
            .isInstanceOfSatisfying(SearchTransportException.class, ex -> assertThat(ex.getStatusCode()).isEqualTo(503))
            .hasMessageStartingWith("Splunk request failed: 503");
    }

    @Test
    void unreadablePayloadIsTransportFailure() {
        server
            .expect(requestTo(BASE + "/services/search/jobs/sid-7/results?output_mode=json&count=10&offset=0"))
            .andRespond(withSuccess("<html>login</html>", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> transport.fetchResults("sid-7", 10, 0)).isInstanceOf(SearchTransportException.class);
    }

    @Test
    void pingHitsServerInfo() {
        server
            .expect(requestTo(BASE + "/services/server/info?output_mode=json"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("{\"entry\":[{\"content\":{\"version\":\"9.2.1\"}}]}", MediaType.APPLICATION_JSON));

        transport.ping();

        server.verify();
    }

    @Test
    void pingFailurePropagates() {
        server.expect(requestTo(BASE + "/services/server/info?output_mode=json")).andRespond(withServerError());

        assertThatThrownBy(() -> transport.ping()).isInstanceOf(SearchTransportException.class);
    }
}
