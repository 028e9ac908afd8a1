package com.yuzhi.spl.common.transport;

import com.yuzhi.spl.common.domain.JobStatus;
import com.yuzhi.spl.common.domain.ResultPage;
import java.util.Optional;

/**
 * Calls to the remote search engine's job API. Implementations own authentication, TLS and
 * retries; every method either returns the decoded payload or throws
 * {@link SearchTransportException}.
 */
public interface SearchTransport {

    /**
     * Submits a search job.
     *
     * @param search final query text
     * @param earliest window start, an ISO-8601 instant or an engine-relative token
     * @param latest window end, an ISO-8601 instant or an engine-relative token
     * @return the job handle, empty when the engine returned none
     */
    Optional<String> createJob(String search, String earliest, String latest);

    JobStatus jobStatus(String sid);

    ResultPage fetchResults(String sid, int count, int offset);

    /**
     * Lightweight reachability check against the engine's server info endpoint.
     */
    void ping();
}
