package com.nipt.orchestrator.progress;

import com.nipt.orchestrator.processing.JobCounters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ProgressTracker.
 *
 * Most tests use an interval long enough that the background ticker never fires
 * and drive {@code tick()} by hand, so every step is deterministic. One test lets
 * the real ticker run against a short interval.
 */
class ProgressTrackerTest {

    static final Duration NEVER = Duration.ofHours(1);

    /** Records every sink call as a short string. */
    static class RecordingSink implements ProgressSink {
        final List<String> events = new CopyOnWriteArrayList<>();

        @Override public void begin(String label, long total, long initial) {
            events.add("begin " + total + " " + initial);
        }
        @Override public void advance(String label, long delta, long finished, long total) {
            events.add("advance " + delta + " " + finished);
        }
        @Override public void complete(String label, long finished, long total) {
            events.add("complete " + finished + "/" + total);
        }
    }

    JobCounters   counters;
    RecordingSink sink;

    @BeforeEach
    void setUp() {
        counters = new JobCounters();
        sink     = new RecordingSink();
    }

    // ------------------------------------------------------------------
    // start()
    // ------------------------------------------------------------------

    @Test
    void start_totalIsQueuedPlusFinished() {
        counters.submit(10);
        counters.complete(4);

        ProgressTracker tracker = new ProgressTracker("T1proc", counters, sink, NEVER).start();

        assertThat(tracker.total()).isEqualTo(10);
        assertThat(tracker.finished()).isEqualTo(4);
        assertThat(sink.events).containsExactly("begin 10 4");
        assertThat(tracker.isDone()).isFalse();
    }

    @Test
    void start_nothingQueued_completesImmediately() {
        counters.submit(3);
        counters.complete(3);

        ProgressTracker tracker = new ProgressTracker("T1proc", counters, sink, NEVER).start();

        assertThat(tracker.isDone()).isTrue();
        assertThat(sink.events).containsExactly("begin 3 3", "complete 3/3");
    }

    @Test
    void start_twice_rejected() {
        counters.submit(1);
        ProgressTracker tracker = new ProgressTracker("T1proc", counters, sink, NEVER).start();

        assertThatThrownBy(tracker::start).isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // tick()
    // ------------------------------------------------------------------

    @Test
    void tick_queueDrops_reportsDifference() {
        counters.submit(5);
        ProgressTracker tracker = new ProgressTracker("T1proc", counters, sink, NEVER).start();

        counters.complete(2);
        tracker.tick();

        assertThat(tracker.finished()).isEqualTo(2);
        assertThat(sink.events).containsExactly("begin 5 0", "advance 2 2");
    }

    @Test
    void tick_noChange_reportsNothing() {
        counters.submit(5);
        ProgressTracker tracker = new ProgressTracker("T1proc", counters, sink, NEVER).start();

        tracker.tick();
        tracker.tick();

        assertThat(sink.events).containsExactly("begin 5 0");
    }

    @Test
    void tick_lateJobs_rebaseWithoutExtendingTotal() {
        counters.submit(5);
        ProgressTracker tracker = new ProgressTracker("T1proc", counters, sink, NEVER).start();

        counters.complete(2);
        tracker.tick();                    // finished 2, local queue 3
        counters.submit(3);                // queue 6
        tracker.tick();                    // rebase only
        counters.complete(1);              // queue 5
        tracker.tick();                    // finished 3
        counters.complete(5);              // queue empty
        tracker.tick();                    // remainder 2

        assertThat(tracker.total()).isEqualTo(5);
        assertThat(tracker.finished()).isEqualTo(5);
        assertThat(tracker.isDone()).isTrue();
        assertThat(sink.events).containsExactly(
                "begin 5 0", "advance 2 2", "advance 1 3", "advance 2 5", "complete 5/5");
    }

    @Test
    void tick_neverReportsMoreThanTotal() {
        counters.submit(4);
        ProgressTracker tracker = new ProgressTracker("T1proc", counters, sink, NEVER).start();

        counters.submit(10);
        tracker.tick();                    // rebase to 14
        counters.complete(12);             // drop of 12, only 4 remain
        tracker.tick();

        assertThat(tracker.finished()).isEqualTo(4);
        assertThat(sink.events).containsExactly("begin 4 0", "advance 4 4", "complete 4/4");
    }

    @Test
    void tick_neverMutatesCounters() {
        counters.submit(5);
        counters.complete(1);
        ProgressTracker tracker = new ProgressTracker("T1proc", counters, sink, NEVER).start();

        counters.complete(4);
        tracker.tick();

        assertThat(counters.snapshot()).isEqualTo(new JobCounters.Snapshot(0, 5));
    }

    @Test
    void tick_sinkThrows_completesExceptionally() {
        counters.submit(2);
        ProgressSink failing = new RecordingSink() {
            @Override public void advance(String label, long delta, long finished, long total) {
                throw new IllegalStateException("display closed");
            }
        };
        ProgressTracker tracker = new ProgressTracker("T1proc", counters, failing, NEVER).start();

        counters.complete(1);
        tracker.tick();

        assertThat(tracker.completion()).isCompletedExceptionally();
    }

    // ------------------------------------------------------------------
    // Background ticker
    // ------------------------------------------------------------------

    @Test
    void ticker_followsProducerUntilComplete() throws Exception {
        counters.submit(6);
        ProgressTracker tracker = new ProgressTracker("T1proc", counters, sink, Duration.ofMillis(5)).start();

        for (int i = 0; i < 6; i++) {
            counters.complete(1);
            Thread.sleep(10);
        }
        tracker.completion().get(5, TimeUnit.SECONDS);

        assertThat(tracker.finished()).isEqualTo(6);
        assertThat(sink.events).first().isEqualTo("begin 6 0");
        assertThat(sink.events).last().isEqualTo("complete 6/6");
        long reported = sink.events.stream()
                .filter(e -> e.startsWith("advance"))
                .mapToLong(e -> Long.parseLong(e.split(" ")[1]))
                .sum();
        assertThat(reported).isEqualTo(6);
    }

    @Test
    void invalidInterval_fallsBackToDefault() {
        counters.submit(1);
        counters.complete(1);

        ProgressTracker tracker = new ProgressTracker("T1proc", counters, sink, Duration.ZERO).start();

        assertThat(tracker.isDone()).isTrue();
    }
}
