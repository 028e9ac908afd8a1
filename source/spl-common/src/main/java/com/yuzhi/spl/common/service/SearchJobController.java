package com.yuzhi.spl.common.service;

import com.yuzhi.spl.common.domain.JobStatus;
import com.yuzhi.spl.common.domain.TimeWindow;
import com.yuzhi.spl.common.service.PollPolicy.JobPendingException;
import com.yuzhi.spl.common.service.exception.JobCreationException;
import com.yuzhi.spl.common.service.exception.PollTimeoutException;
import com.yuzhi.spl.common.service.util.SplunkTimes;
import com.yuzhi.spl.common.transport.SearchTransport;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one search job from creation to a readable state. An instance tracks a single job and
 * must not be shared between targets.
 */
public class SearchJobController {

    private static final Logger LOG = LoggerFactory.getLogger(SearchJobController.class);

    private final SearchTransport transport;
    private final PollPolicy pollPolicy;
    private final QueryCancellation cancellation;

    private JobState state = JobState.NEW;
    private String sid;
    private int polls;

    public SearchJobController(SearchTransport transport, PollPolicy pollPolicy, QueryCancellation cancellation) {
        this.transport = transport;
        this.pollPolicy = pollPolicy;
        this.cancellation = cancellation != null ? cancellation : QueryCancellation.create();
    }

    /**
     * Creates the job and waits until it is readable.
     *
     * @return the job handle
     * @throws JobCreationException when the engine returns no handle
     * @throws PollTimeoutException when the poll budget runs out
     */
    public String run(String search, TimeWindow window) {
        create(search, window);
        awaitReadable();
        return sid;
    }

    public String create(String search, TimeWindow window) {
        if (state != JobState.NEW) {
            throw new IllegalStateException("job already started: " + sid);
        }
        cancellation.throwIfCancelled();
        String earliest = window.from() != null ? SplunkTimes.format(window.from()) : window.earliestToken();
        String latest = window.to() != null ? SplunkTimes.format(window.to()) : window.latestToken();
        try {
            String handle = transport.createJob(search, earliest, latest).filter(StringUtils::isNotBlank).orElse(null);
            if (handle == null) {
                state = JobState.CREATION_FAILED;
                throw new JobCreationException();
            }
            sid = handle;
        } catch (RuntimeException e) {
            if (state != JobState.CREATION_FAILED) {
                state = JobState.FAILED;
            }
            throw e;
        }
        state = JobState.CREATED;
        LOG.debug("Search job created. sid={}, earliest={}, latest={}", sid, earliest, latest);
        return sid;
    }

    public void awaitReadable() {
        if (state != JobState.CREATED) {
            throw new IllegalStateException("job not created, state=" + state);
        }
        cancellation.throwIfCancelled();
        state = JobState.POLLING;
        try {
            pollPolicy.execute(
                context -> {
                    cancellation.throwIfCancelled();
                    polls++;
                    JobStatus status = transport.jobStatus(sid);
                    if (!status.isReadable()) {
                        throw new JobPendingException(sid, status.dispatchState());
                    }
                    return status;
                },
                cancellation
            );
        } catch (JobPendingException e) {
            state = JobState.TIMED_OUT;
            LOG.warn("Search job did not complete. sid={}, polls={}", sid, polls);
            throw new PollTimeoutException(sid, polls);
        } catch (RuntimeException e) {
            state = JobState.FAILED;
            throw e;
        }
        state = JobState.DONE;
        LOG.debug("Search job readable. sid={}, polls={}", sid, polls);
    }

    public JobState getState() {
        return state;
    }

    public String getSid() {
        return sid;
    }

    public int getPolls() {
        return polls;
    }
}
