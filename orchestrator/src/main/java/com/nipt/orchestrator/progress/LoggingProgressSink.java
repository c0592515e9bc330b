package com.nipt.orchestrator.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: one log line per update.
 */
public class LoggingProgressSink implements ProgressSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressSink.class);

    @Override
    public void begin(String label, long total, long initial) {
        log.info("{}: tracking {} job(s), {} already finished", label, total, initial);
    }

    @Override
    public void advance(String label, long delta, long finished, long total) {
        log.info("{}: {}/{} job(s) finished ({}%)", label, finished, total, percent(finished, total));
    }

    @Override
    public void complete(String label, long finished, long total) {
        log.info("{}: done ({}/{})", label, finished, total);
    }

    private static long percent(long finished, long total) {
        return total == 0 ? 100 : finished * 100 / total;
    }
}
