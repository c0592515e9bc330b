package com.nipt.orchestrator.processing;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobCountersTest {

    @Test
    void complete_movesJobsFromQueuedToFinished() {
        JobCounters counters = new JobCounters();
        counters.submit(5);

        JobCounters.Snapshot s = counters.complete(2);

        assertThat(s.queued()).isEqualTo(3);
        assertThat(s.finished()).isEqualTo(2);
        assertThat(s.total()).isEqualTo(5);
    }

    @Test
    void complete_moreThanQueued_cappedAtQueue() {
        JobCounters counters = new JobCounters();
        counters.submit(2);

        assertThat(counters.complete(9)).isEqualTo(new JobCounters.Snapshot(0, 2));
    }

    @Test
    void negativeCount_rejected() {
        JobCounters counters = new JobCounters();

        assertThatThrownBy(() -> counters.submit(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> counters.complete(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentUpdates_totalIsConsistent() throws Exception {
        JobCounters counters = new JobCounters();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 1000; i++) {
            pool.execute(() -> {
                counters.submit(1);
                counters.complete(1);
            });
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(counters.snapshot()).isEqualTo(new JobCounters.Snapshot(0, 1000));
    }
}
