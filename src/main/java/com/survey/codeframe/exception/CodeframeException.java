package com.survey.codeframe.exception;

/**
 * Base class for every error raised by the codeframe pipeline.
 * Pipeline stages throw subclasses of this type; the orchestrator turns them
 * into a failed generation carrying {@link #getKind()} and the message.
 */
public abstract class CodeframeException extends RuntimeException {

    private final ErrorKind kind;

    protected CodeframeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CodeframeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
