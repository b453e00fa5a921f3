package com.survey.codeframe.exception;

/**
 * Invalid generation request (empty category, too few answers, missing credentials).
 */
public class InputException extends CodeframeException {

    public InputException(String message) {
        super(ErrorKind.INPUT_ERROR, message);
    }

    public InputException(String message, Throwable cause) {
        super(ErrorKind.INPUT_ERROR, message, cause);
    }
}
