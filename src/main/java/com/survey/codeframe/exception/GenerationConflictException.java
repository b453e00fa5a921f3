package com.survey.codeframe.exception;

/**
 * Another generation for the same category is still processing.
 */
public class GenerationConflictException extends CodeframeException {

    public GenerationConflictException(String message) {
        super(ErrorKind.GENERATION_CONFLICT, message);
    }

    public GenerationConflictException(String message, Throwable cause) {
        super(ErrorKind.GENERATION_CONFLICT, message, cause);
    }
}
