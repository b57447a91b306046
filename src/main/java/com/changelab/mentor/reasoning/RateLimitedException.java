package com.changelab.mentor.reasoning;

public class RateLimitedException extends ReasoningException {
    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
