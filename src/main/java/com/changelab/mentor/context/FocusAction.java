package com.changelab.mentor.context;

import java.util.Locale;

public enum FocusAction {
    REVIEW, GENERATE, SUGGEST;

    public static FocusAction parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("action is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action: " + value, e);
        }
    }
}
