package com.nipt.orchestrator.api;

import com.nipt.orchestrator.api.dto.DatasetResponse;
import com.nipt.orchestrator.api.dto.OpenSessionRequest;
import com.nipt.orchestrator.api.dto.SelectPackageRequest;
import com.nipt.orchestrator.api.dto.SessionResponse;
import com.nipt.orchestrator.api.dto.StepResponse;
import com.nipt.orchestrator.dataset.DatasetResolver;
import com.nipt.orchestrator.pipeline.PipelineException;
import com.nipt.orchestrator.processing.RemoveMode;
import com.nipt.orchestrator.service.OrchestratorOptions;
import com.nipt.orchestrator.service.PipelineOrchestrator;
import com.nipt.orchestrator.service.SessionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for orchestration sessions. One session wraps one orchestrator bound to one dataset.
 *
 * POST   /sessions                           - open a session on a dataset
 * GET    /sessions/{id}                      - selection and summary
 * DELETE /sessions/{id}                      - close the session
 * PUT    /sessions/{id}/package              - select an installed or empty package
 * GET    /sessions/{id}/params               - current parameters
 * PATCH  /sessions/{id}/params               - change parameters
 * GET    /sessions/{id}/steps                - registered steps
 * POST   /sessions/{id}/steps/{index}/run    - run a step (blocks until the step returns)
 * DELETE /sessions/{id}/datasets             - destroy produced data by step code
 * GET    /sessions/{id}/datasets/{code}      - files of a step code (204 when there are none)
 * GET    /sessions/{id}/summary              - text summary
 * POST   /sessions/{id}/progress             - start a progress tracker
 */
@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final SessionService sessions;

    public SessionController(SessionService sessions) {
        this.sessions = sessions;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/sessions \
     *     -H "Content-Type: application/json" \
     *     -d '{"datasetPath":"/data/project01","threads":8}'
     */
    @PostMapping
    public ResponseEntity<SessionResponse> open(@RequestBody OpenSessionRequest req) {
        if (req.datasetPath() == null || req.datasetPath().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "datasetPath is required");
        }
        if (req.threads() != null && req.threads() < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "threads must be >= 1");
        }
        UUID id = sessions.open(datasetPath(req.datasetPath()),
                new OrchestratorOptions(req.logging(), req.threads(), req.verbose()));
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(id, session(id)));
    }

    @GetMapping("/{id}")
    public SessionResponse get(@PathVariable UUID id) {
        return SessionResponse.from(id, session(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> close(@PathVariable UUID id) {
        if (!sessions.close(id)) {
            throw notFound(id);
        }
        return ResponseEntity.noContent().build();
    }

    // ------------------------------------------------------------------
    // Selection and parameters
    // ------------------------------------------------------------------

    @PutMapping("/{id}/package")
    public SessionResponse selectPackage(@PathVariable UUID id, @RequestBody SelectPackageRequest req) {
        PipelineOrchestrator orchestrator = session(id);
        if (req.index() != null) {
            orchestrator.setPackage(req.index(), req.params());
        } else if (req.title() != null && !req.title().isBlank()) {
            orchestrator.setEmptyPackage(req.title());
        } else {
            throw new PipelineException(PipelineException.Kind.INVALID_PACKAGE_IDENTIFIER,
                    "Either an integer package index or a title is required");
        }
        return SessionResponse.from(id, orchestrator);
    }

    @GetMapping("/{id}/params")
    public Map<String, Object> getParams(@PathVariable UUID id) {
        return session(id).getParam().orElseThrow(PipelineException::noPackageSelected);
    }

    @PatchMapping("/{id}/params")
    public ResponseEntity<Void> setParams(@PathVariable UUID id, @RequestBody Map<String, Object> params) {
        session(id).setParam(params);
        return ResponseEntity.noContent().build();
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    @GetMapping("/{id}/steps")
    public List<StepResponse> steps(@PathVariable UUID id) {
        return session(id).steps().stream().map(StepResponse::from).toList();
    }

    @PostMapping("/{id}/steps/{index}/run")
    public ResponseEntity<Void> run(@PathVariable UUID id,
                                    @PathVariable int index,
                                    @RequestBody(required = false) Map<String, Object> params) {
        session(id).run(index, params == null ? Map.of() : params);
        return ResponseEntity.noContent().build();
    }

    // ------------------------------------------------------------------
    // Produced data
    // ------------------------------------------------------------------

    @DeleteMapping("/{id}/datasets")
    public ResponseEntity<Void> remove(@PathVariable UUID id,
                                       @RequestParam List<String> codes,
                                       @RequestParam(required = false) String mode) {
        session(id).remove(codes, removeMode(mode));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/datasets/{code}")
    public ResponseEntity<DatasetResponse> dataset(@PathVariable UUID id,
                                                   @PathVariable String code,
                                                   @RequestParam(defaultValue = DatasetResolver.DEFAULT_EXTENSION) String ext,
                                                   @RequestParam(required = false) String regex) {
        return session(id).getDset(code, ext, regex)
                .filter(view -> !view.isEmpty())
                .map(view -> ResponseEntity.ok(DatasetResponse.from(code, view)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping(value = "/{id}/summary", produces = MediaType.TEXT_PLAIN_VALUE)
    public String summary(@PathVariable UUID id) {
        return session(id).toString();
    }

    @PostMapping("/{id}/progress")
    public ResponseEntity<Void> progress(@PathVariable UUID id) {
        return session(id).checkProgression().isPresent()
                ? ResponseEntity.accepted().build()
                : ResponseEntity.noContent().build();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineOrchestrator session(UUID id) {
        return sessions.find(id).orElseThrow(() -> notFound(id));
    }

    private static Path datasetPath(String raw) {
        try {
            return Path.of(raw);
        } catch (InvalidPathException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    private static RemoveMode removeMode(String raw) {
        try {
            return RemoveMode.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + id);
    }
}
