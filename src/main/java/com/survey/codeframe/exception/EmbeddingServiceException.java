package com.survey.codeframe.exception;

/**
 * The embedding collaborator could not produce vectors. Aborts the generation.
 */
public class EmbeddingServiceException extends CodeframeException {

    public EmbeddingServiceException(String message) {
        super(ErrorKind.EMBEDDING_SERVICE_ERROR, message);
    }

    public EmbeddingServiceException(String message, Throwable cause) {
        super(ErrorKind.EMBEDDING_SERVICE_ERROR, message, cause);
    }
}
