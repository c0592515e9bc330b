package com.nipt.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one {@link PipelineOrchestrator} per client session of the REST API.
 *
 * Sessions live in memory only and are lost on restart.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final Map<UUID, PipelineOrchestrator> sessions = new ConcurrentHashMap<>();
    private final OrchestratorFactory             factory;

    public SessionService(OrchestratorFactory factory) {
        this.factory = factory;
    }

    public UUID open(Path datasetPath, OrchestratorOptions options) {
        PipelineOrchestrator orchestrator = factory.create(datasetPath, options);
        UUID id = UUID.randomUUID();
        sessions.put(id, orchestrator);
        log.info("Session {} opened on {}", id, datasetPath);
        return id;
    }

    public Optional<PipelineOrchestrator> find(UUID id) {
        return Optional.ofNullable(sessions.get(id));
    }

    /** @return false if no session had that id */
    public boolean close(UUID id) {
        PipelineOrchestrator removed = sessions.remove(id);
        if (removed != null) {
            log.info("Session {} closed", id);
        }
        return removed != null;
    }

    public int size() { return sessions.size(); }
}
