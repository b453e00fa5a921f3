package com.survey.codeframe.exception;

/**
 * Error kinds exposed on the status endpoint as {@code {kind, message}}.
 */
public enum ErrorKind {
    INPUT_ERROR,
    EMBEDDING_SERVICE_ERROR,
    CLUSTERING_ERROR,
    LABELING_ERROR,
    EVIDENCE_TIER_ERROR,
    APPLY_CONFLICT_ERROR,
    GENERATION_CONFLICT,
    INTERNAL_ERROR
}
