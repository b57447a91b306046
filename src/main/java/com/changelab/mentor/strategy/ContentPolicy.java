package com.changelab.mentor.strategy;

import java.util.List;
import java.util.Locale;

public enum ContentPolicy {
    SOLUTION_LANGUAGE(List.of(
            "create a", "develop a", "design a", "build a", "implement a",
            "establish a", "launch a", "start a", "organize a", "campaign",
            "program to", "initiative to", "project to", "solution",
            "app that", "website that", "system that")),
    PERMISSIVE(List.of());

    private final List<String> lexicon;

    ContentPolicy(List<String> lexicon) {
        this.lexicon = lexicon;
    }

    public boolean permits(String text) {
        return matchedMarker(text) == null;
    }

    public String matchedMarker(String text) {
        if (text == null || lexicon.isEmpty()) return null;
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : lexicon) {
            if (lower.contains(marker)) {
                return marker;
            }
        }
        return null;
    }
}
