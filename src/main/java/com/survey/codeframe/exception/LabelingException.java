package com.survey.codeframe.exception;

/**
 * The labeling collaborator returned malformed or out-of-enum output.
 */
public class LabelingException extends CodeframeException {

    public LabelingException(String message) {
        super(ErrorKind.LABELING_ERROR, message);
    }

    public LabelingException(String message, Throwable cause) {
        super(ErrorKind.LABELING_ERROR, message, cause);
    }
}
