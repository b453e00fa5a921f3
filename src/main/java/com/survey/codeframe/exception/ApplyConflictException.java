package com.survey.codeframe.exception;

/**
 * Apply requested on a generation that is not in the completed state.
 */
public class ApplyConflictException extends CodeframeException {

    public ApplyConflictException(String message) {
        super(ErrorKind.APPLY_CONFLICT_ERROR, message);
    }

    public ApplyConflictException(String message, Throwable cause) {
        super(ErrorKind.APPLY_CONFLICT_ERROR, message, cause);
    }
}
