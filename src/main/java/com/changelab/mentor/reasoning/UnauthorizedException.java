package com.changelab.mentor.reasoning;

public class UnauthorizedException extends ReasoningException {
    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
