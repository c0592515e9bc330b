package com.nipt.orchestrator.processing;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Queued / finished job tallies of a pipeline interface.
 *
 * Owned and mutated by the interface that schedules jobs. Both numbers live in a
 * single immutable {@link Snapshot} swapped atomically, so readers such as the
 * progress tracker never see a queued count from one update paired with a
 * finished count from another.
 */
public final class JobCounters {

    /** One consistent reading of both counters. */
    public record Snapshot(long queued, long finished) {

        public long total() { return queued + finished; }
    }

    private final AtomicReference<Snapshot> state = new AtomicReference<>(new Snapshot(0, 0));

    /** Add newly submitted jobs to the queue. */
    public Snapshot submit(long jobs) {
        requireNonNegative(jobs);
        return state.updateAndGet(s -> new Snapshot(s.queued() + jobs, s.finished()));
    }

    /** Move up to {@code jobs} jobs from queued to finished. */
    public Snapshot complete(long jobs) {
        requireNonNegative(jobs);
        return state.updateAndGet(s -> {
            long moved = Math.min(jobs, s.queued());
            return new Snapshot(s.queued() - moved, s.finished() + moved);
        });
    }

    public Snapshot snapshot() {
        return state.get();
    }

    private static void requireNonNegative(long jobs) {
        if (jobs < 0) {
            throw new IllegalArgumentException("job count must be >= 0, was " + jobs);
        }
    }
}
