package com.nipt.orchestrator.api;

import com.nipt.orchestrator.pipeline.PipelineException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps rejected orchestration requests to HTTP statuses.
 *
 * Only {@link PipelineException} is mapped here. Failures thrown by plugin steps
 * are left to the default handling and surface as 500.
 *
 * Body: {"kind": "...", "message": "..."}
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, String>> pipeline(PipelineException e) {
        HttpStatus status = switch (e.getKind()) {
            case UNKNOWN_STEP_INDEX  -> HttpStatus.NOT_FOUND;
            case NO_PACKAGE_SELECTED -> HttpStatus.CONFLICT;
            case INVALID_PACKAGE_IDENTIFIER,
                 UNKNOWN_PARAMETER_NAME,
                 INVALID_PARAMETER_VALUE,
                 MALFORMED_STEP_CODE -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status)
                .body(Map.of("kind", e.getKind().name(), "message", e.getMessage()));
    }
}
