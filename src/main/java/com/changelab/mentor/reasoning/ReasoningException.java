package com.changelab.mentor.reasoning;

public abstract class ReasoningException extends RuntimeException {
    protected ReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
