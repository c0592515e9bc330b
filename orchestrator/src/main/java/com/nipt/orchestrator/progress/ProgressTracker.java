package com.nipt.orchestrator.progress;

import com.nipt.orchestrator.processing.JobCounters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Mirrors the job counters of a pipeline interface into a {@link ProgressSink}.
 *
 * <p>The total is fixed when {@link #start()} reads the counters
 * ({@code queued + finished}). A daemon thread then polls on a fixed interval:
 * <ul>
 *   <li>a drop in the queued count is reported as that many finished jobs;</li>
 *   <li>a rise in the queued count (jobs added after start) only rebases the local
 *       view, late jobs never extend the total;</li>
 *   <li>an empty queue reports whatever remains of the total.</li>
 * </ul>
 * The tracker stops itself once its local finished count reaches the total.
 * It only reads the counters and has no cancellation channel.
 */
public final class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(200);

    private final String       label;
    private final JobCounters  counters;
    private final ProgressSink sink;
    private final Duration     interval;

    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    private ScheduledExecutorService ticker;

    // Written by start() before the ticker is scheduled, afterwards only by the ticker thread.
    private long          total;
    private long          queued;
    private volatile long finished;

    public ProgressTracker(String label, JobCounters counters, ProgressSink sink, Duration interval) {
        this.label    = Objects.requireNonNull(label, "label");
        this.counters = Objects.requireNonNull(counters, "counters");
        this.sink     = Objects.requireNonNull(sink, "sink");
        this.interval = interval == null || interval.isZero() || interval.isNegative()
                ? DEFAULT_INTERVAL : interval;
    }

    /** Read the initial counters and begin polling. May be called once. */
    public synchronized ProgressTracker start() {
        if (ticker != null || completion.isDone()) {
            throw new IllegalStateException("Progress tracker '" + label + "' already started");
        }
        JobCounters.Snapshot initial = counters.snapshot();
        total    = initial.total();
        queued   = initial.queued();
        finished = initial.finished();
        sink.begin(label, total, finished);

        if (finished >= total) {
            finish();
            return this;
        }

        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "progress-" + label);
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        ticker.scheduleAtFixedRate(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        log.debug("Tracking {} job(s) of '{}' every {} ms", total, label, millis);
        return this;
    }

    void tick() {
        try {
            JobCounters.Snapshot current = counters.snapshot();
            long delta;
            if (current.queued() == 0) {
                delta = total - finished;
            } else if (current.queued() > queued) {
                queued = current.queued();
                delta  = 0;
            } else {
                delta = queued - current.queued();
            }
            delta = Math.min(delta, total - finished);

            if (delta > 0) {
                queued   = Math.max(0, queued - delta);
                finished = finished + delta;
                sink.advance(label, delta, finished, total);
            }
            if (finished >= total) {
                finish();
            }
        } catch (RuntimeException e) {
            // A periodic task that throws is never scheduled again.
            log.error("Progress tracking of '{}' stopped: {}", label, e.getMessage(), e);
            completion.completeExceptionally(e);
            ticker.shutdown();
        }
    }

    private void finish() {
        sink.complete(label, finished, total);
        completion.complete(null);
        if (ticker != null) {
            ticker.shutdown();
        }
    }

    // ------------------------------------------------------------------
    // Observation
    // ------------------------------------------------------------------

    public String label()    { return label; }
    public long   total()    { return total; }
    public long   finished() { return finished; }
    public boolean isDone()  { return completion.isDone(); }

    /** Completes when the tracker has reported the full total. */
    public CompletableFuture<Void> completion() { return completion; }
}
