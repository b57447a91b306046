package com.changelab.mentor.reasoning;

public class ConfigurationException extends ReasoningException {
    public ConfigurationException(String message) {
        super(message, null);
    }
}
