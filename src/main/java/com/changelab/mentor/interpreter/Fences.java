package com.changelab.mentor.interpreter;

import java.util.regex.Pattern;

final class Fences {
    private static final Pattern LEADING = Pattern.compile("^```[a-zA-Z]*\\s*");
    private static final Pattern TRAILING = Pattern.compile("\\s*```$");

    private Fences() {}

    static String strip(String raw) {
        if (raw == null) return "";
        String text = raw.trim();
        text = LEADING.matcher(text).replaceFirst("");
        text = TRAILING.matcher(text).replaceFirst("");
        return text.trim();
    }
}
