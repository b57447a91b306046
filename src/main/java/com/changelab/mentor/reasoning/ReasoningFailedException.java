package com.changelab.mentor.reasoning;

public class ReasoningFailedException extends ReasoningException {
    public ReasoningFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
