package com.yuzhi.spl.gateway.service.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.yuzhi.spl.common.domain.JobStatus;
import com.yuzhi.spl.common.domain.ResultPage;
import com.yuzhi.spl.common.domain.SearchRecord;
import com.yuzhi.spl.common.transport.SearchTransport;
import com.yuzhi.spl.common.transport.SearchTransportException;
import com.yuzhi.spl.gateway.config.SplunkProperties;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * {@link SearchTransport} backed by the Splunk management REST API. Every call asks for
 * {@code output_mode=json}.
 */
public class SplunkRestTransport implements SearchTransport {

    private static final Logger log = LoggerFactory.getLogger(SplunkRestTransport.class);

    static final String JOBS_PATH = "/services/search/jobs";
    static final String SERVER_INFO_PATH = "/services/server/info";
    static final String OUTPUT_MODE = "output_mode";
    static final String JSON = "json";

    private final RestTemplate restTemplate;
    private final SplunkProperties properties;

    public SplunkRestTransport(RestTemplate restTemplate, SplunkProperties properties) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public Optional<String> createJob(String search, String earliest, String latest) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("search", search);
        form.add("earliest_time", earliest);
        form.add("latest_time", latest);
        form.add(OUTPUT_MODE, JSON);
        HttpHeaders headers = buildHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        JobCreated created = exchange(
            uri(JOBS_PATH).build().toUri(),
            HttpMethod.POST,
            new HttpEntity<>(form, headers),
            JobCreated.class,
            "create search job"
        );
        if (created == null || StringUtils.isBlank(created.sid())) {
            return Optional.empty();
        }
        log.debug("Splunk job {} created", created.sid());
        return Optional.of(created.sid());
    }

    @Override
    public JobStatus jobStatus(String sid) {
        URI target = uri(JOBS_PATH + "/{sid}").queryParam(OUTPUT_MODE, JSON).encode().buildAndExpand(sid).toUri();
        JobStatusPayload payload = exchange(target, HttpMethod.GET, new HttpEntity<>(buildHeaders()), JobStatusPayload.class, "read job status");
        if (payload == null || payload.entry() == null || payload.entry().isEmpty() || payload.entry().get(0) == null) {
            throw new SearchTransportException("Splunk job status payload has no entry for " + sid);
        }
        StatusContent content = payload.entry().get(0).content();
        if (content == null) {
            return JobStatus.pending(null);
        }
        return new JobStatus(content.isDone(), content.dispatchState());
    }

    @Override
    public ResultPage fetchResults(String sid, int count, int offset) {
        URI target = uri(JOBS_PATH + "/{sid}/results")
            .queryParam(OUTPUT_MODE, JSON)
            .queryParam("count", count)
            .queryParam("offset", offset)
            .encode()
            .buildAndExpand(sid)
            .toUri();
        ResultsPayload payload = exchange(target, HttpMethod.GET, new HttpEntity<>(buildHeaders()), ResultsPayload.class, "fetch results");
        if (payload == null) {
            throw new SearchTransportException("Splunk returned an empty results payload for " + sid);
        }
        List<SearchRecord> records = new ArrayList<>();
        if (payload.results() != null) {
            for (Map<String, Object> row : payload.results()) {
                if (row != null) {
                    records.add(new SearchRecord(row));
                }
            }
        }
        List<String> fieldNames = new ArrayList<>();
        if (payload.fields() != null) {
            for (FieldPayload field : payload.fields()) {
                if (field != null && StringUtils.isNotBlank(field.name())) {
                    fieldNames.add(field.name());
                }
            }
        }
        return new ResultPage(records, fieldNames);
    }

    @Override
    public void ping() {
        URI target = uri(SERVER_INFO_PATH).queryParam(OUTPUT_MODE, JSON).build().toUri();
        exchange(target, HttpMethod.GET, new HttpEntity<>(buildHeaders()), String.class, "read server info");
    }

    private <T> T exchange(URI target, HttpMethod method, HttpEntity<?> entity, Class<T> type, String action) {
        try {
            ResponseEntity<T> response = restTemplate.exchange(target, method, entity, type);
            return response.getBody();
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            log.warn("Splunk call to {} failed with HTTP {}", action, status);
            throw new SearchTransportException(
                "Splunk request failed: " + status + " " + StringUtils.defaultString(ex.getStatusText()).trim(),
                status,
                ex
            );
        } catch (RestClientException ex) {
            log.warn("Splunk call to {} failed: {}", action, ex.getMessage());
            throw new SearchTransportException("Splunk request failed: " + ex.getMessage(), ex);
        }
    }

    private UriComponentsBuilder uri(String path) {
        String base = StringUtils.defaultIfBlank(properties.getBaseUrl(), "https://localhost:8089");
        return UriComponentsBuilder.fromHttpUrl(StringUtils.stripEnd(base, "/")).path(path);
    }

    private HttpHeaders buildHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (StringUtils.isNotBlank(properties.getHeaderName()) && StringUtils.isNotBlank(properties.getHeaderValue())) {
            headers.set(properties.getHeaderName(), properties.getHeaderValue());
        }
        return headers;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobCreated(String sid) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobStatusPayload(List<StatusEntry> entry) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StatusEntry(StatusContent content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StatusContent(@JsonProperty("isDone") Boolean isDone, @JsonProperty("dispatchState") String dispatchState) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResultsPayload(List<Map<String, Object>> results, List<FieldPayload> fields) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FieldPayload(String name) {}
}
