package com.nipt.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Process-wide defaults for new orchestrators, bound from the {@code nipt.*} properties.
 *
 * @param logging          whether pipeline interfaces write job log files
 * @param numberOfThreads  worker threads handed to each pipeline interface
 * @param verbose          log selections and step descriptions at INFO instead of DEBUG
 * @param progressInterval polling interval of progress trackers
 */
@ConfigurationProperties(prefix = "nipt")
public record NiptProperties(
        @DefaultValue("true")  boolean  logging,
        @DefaultValue("4")     int      numberOfThreads,
        @DefaultValue("false") boolean  verbose,
        @DefaultValue("200ms") Duration progressInterval) {}
