package com.nipt.orchestrator.progress;

/**
 * Receives push updates from a {@link ProgressTracker}.
 *
 * The display strategy (console, log, notebook widget, server-sent events) is
 * chosen by whoever creates the tracker. Calls arrive on the tracker's
 * background thread and should return quickly.
 */
public interface ProgressSink {

    /**
     * @param label   what is being tracked, usually the package title
     * @param total   jobs counted when tracking started
     * @param initial jobs already finished at that moment
     */
    void begin(String label, long total, long initial);

    /** {@code delta} more jobs finished; {@code finished} is the new running count. */
    void advance(String label, long delta, long finished, long total);

    void complete(String label, long finished, long total);
}
