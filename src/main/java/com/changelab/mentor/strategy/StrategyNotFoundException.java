package com.changelab.mentor.strategy;

public class StrategyNotFoundException extends RuntimeException {
    private final String focusKey;

    public StrategyNotFoundException(String focusKey) {
        super("No strategy registered for focus '" + focusKey + "'");
        this.focusKey = focusKey;
    }

    public String getFocusKey() {
        return focusKey;
    }
}
