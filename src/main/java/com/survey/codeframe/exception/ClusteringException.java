package com.survey.codeframe.exception;

/**
 * Clustering produced no usable result (insufficient or degenerate data).
 */
public class ClusteringException extends CodeframeException {

    public ClusteringException(String message) {
        super(ErrorKind.CLUSTERING_ERROR, message);
    }

    public ClusteringException(String message, Throwable cause) {
        super(ErrorKind.CLUSTERING_ERROR, message, cause);
    }
}
