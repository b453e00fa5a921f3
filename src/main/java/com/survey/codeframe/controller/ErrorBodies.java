package com.survey.codeframe.controller;

import com.survey.codeframe.exception.CodeframeException;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Maps error kinds to HTTP status codes with a {@code {kind, message}} body.
 */
final class ErrorBodies {

    private ErrorBodies() {
    }

    static ResponseEntity<Object> of(CodeframeException e) {
        int status = switch (e.getKind()) {
            case INPUT_ERROR -> 400;
            case APPLY_CONFLICT_ERROR, GENERATION_CONFLICT -> 409;
            case EMBEDDING_SERVICE_ERROR, EVIDENCE_TIER_ERROR -> 502;
            default -> 500;
        };
        return ResponseEntity.status(status).body(Map.of(
                "kind", e.getKind().name(),
                "message", e.getMessage() != null ? e.getMessage() : ""));
    }

    static ResponseEntity<Object> notFound(String message) {
        return ResponseEntity.status(404).body(Map.of("kind", "NOT_FOUND", "message", message));
    }

    static ResponseEntity<Object> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("kind", "INPUT_ERROR", "message", message));
    }

    static ResponseEntity<Object> internal() {
        return ResponseEntity.status(500).body(Map.of(
                "kind", "INTERNAL_ERROR",
                "message", "An error occurred. Please try again later."));
    }
}
