package com.yuzhi.spl.common.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.yuzhi.spl.common.domain.TimeWindow;
import com.yuzhi.spl.common.service.exception.JobCreationException;
import com.yuzhi.spl.common.service.exception.PollTimeoutException;
import com.yuzhi.spl.common.service.exception.QueryCancelledException;
import com.yuzhi.spl.common.transport.SearchTransportException;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SearchJobControllerTest {

    private static final TimeWindow WINDOW = TimeWindow.between(
        Instant.parse("2024-05-01T08:00:00.250Z"),
        Instant.parse("2024-05-01T09:00:00Z")
    );

    private FakeSearchTransport transport;
    private RecordingSleeper sleeper;

    @BeforeEach
    void setUp() {
        transport = new FakeSearchTransport();
        sleeper = new RecordingSleeper();
    }

    private SearchJobController controller(int maxPolls, QueryCancellation cancellation) {
        return new SearchJobController(transport, new PollPolicy(maxPolls, 1000, sleeper), cancellation);
    }

    @Test
    void runCreatesJobWithWholeSecondWindowAndWaitsUntilDone() {
        transport.pendingPolls = 2;
        SearchJobController job = controller(30, null);

        String sid = job.run("search index=main", WINDOW);

        assertThat(sid).isEqualTo("sid-1");
        assertThat(transport.creates).singleElement().satisfies(call -> {
            assertThat(call.search()).isEqualTo("search index=main");
            assertThat(call.earliest()).isEqualTo("2024-05-01T08:00:00Z");
            assertThat(call.latest()).isEqualTo("2024-05-01T09:00:00Z");
        });
        assertThat(transport.statusCalls).hasSize(3);
        assertThat(sleeper.waits).containsExactly(1000L, 1000L);
        assertThat(job.getState()).isEqualTo(JobState.DONE);
        assertThat(job.getPolls()).isEqualTo(3);
    }

    @Test
    void relativeWindowTokensPassThrough() {
        controller(5, null).run("search *", TimeWindow.relative("-15m", "now"));

        assertThat(transport.creates.get(0).earliest()).isEqualTo("-15m");
        assertThat(transport.creates.get(0).latest()).isEqualTo("now");
    }

    @Test
    void mixedWindowFormatsInstantBoundOnly() {
        controller(5, null).run("search *", TimeWindow.of(Instant.parse("2024-05-01T08:00:00.750Z"), null, null, "now"));

        assertThat(transport.creates.get(0).earliest()).isEqualTo("2024-05-01T08:00:00Z");
        assertThat(transport.creates.get(0).latest()).isEqualTo("now");
    }

    @ParameterizedTest
    @ValueSource(strings = { "DONE", "PAUSED", "FINALIZING", "finalizing" })
    void readableDispatchStatesEndPolling(String state) {
        transport.readyState = state;
        SearchJobController job = controller(5, null);

        job.run("search *", WINDOW);

        assertThat(transport.statusCalls).hasSize(1);
        assertThat(job.getState()).isEqualTo(JobState.DONE);
    }

    @Test
    void completionFlagWinsOverRunningState() {
        transport.readyFlag = Boolean.TRUE;
        transport.readyState = "RUNNING";

        controller(5, null).run("search *", WINDOW);

        assertThat(transport.statusCalls).hasSize(1);
    }

    @Test
    void pollBudgetExhaustedAfterExactlyMaxPollsChecks() {
        transport.neverDone = true;
        SearchJobController job = controller(4, null);

        assertThatThrownBy(() -> job.run("search *", WINDOW))
            .isInstanceOf(PollTimeoutException.class)
            .hasMessage(PollTimeoutException.DEFAULT_MESSAGE);

        assertThat(transport.statusCalls).hasSize(4);
        assertThat(sleeper.waits).hasSize(3);
        assertThat(job.getState()).isEqualTo(JobState.TIMED_OUT);
    }

    @Test
    void missingHandleFailsCreation() {
        transport.noHandleFor("search *");
        SearchJobController job = controller(4, null);

        assertThatThrownBy(() -> job.run("search *", WINDOW))
            .isInstanceOf(JobCreationException.class)
            .hasMessage("Failed to create Splunk search job");

        assertThat(job.getState()).isEqualTo(JobState.CREATION_FAILED);
        assertThat(transport.statusCalls).isEmpty();
    }

    @Test
    void transportFailureDuringPollIsNotRetried() {
        transport.statusFailure = new SearchTransportException("Splunk request failed: 500", 500, null);
        SearchJobController job = controller(10, null);

        assertThatThrownBy(() -> job.run("search *", WINDOW)).isSameAs(transport.statusFailure);

        assertThat(transport.statusCalls).hasSize(1);
        assertThat(sleeper.waits).isEmpty();
        assertThat(job.getState()).isEqualTo(JobState.FAILED);
    }

    @Test
    void cancellationDuringBackOffStopsPolling() {
        transport.neverDone = true;
        QueryCancellation cancellation = QueryCancellation.create();
        sleeper.onSleep = cancellation::cancel;
        SearchJobController job = controller(10, cancellation);

        assertThatThrownBy(() -> job.run("search *", WINDOW)).isInstanceOf(QueryCancelledException.class);

        assertThat(transport.statusCalls).hasSize(1);
    }

    @Test
    void cancelledBeforeCreateMakesNoRemoteCall() {
        QueryCancellation cancellation = QueryCancellation.create();
        cancellation.cancel();

        assertThatThrownBy(() -> controller(3, cancellation).run("search *", WINDOW)).isInstanceOf(QueryCancelledException.class);

        assertThat(transport.creates).isEmpty();
    }

    @Test
    void controllerTracksASingleJob() {
        SearchJobController job = controller(3, null);
        job.run("search *", WINDOW);

        assertThatThrownBy(() -> job.create("search other", WINDOW)).isInstanceOf(IllegalStateException.class);
    }
}
