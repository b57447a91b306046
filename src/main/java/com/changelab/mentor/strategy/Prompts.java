package com.changelab.mentor.strategy;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

final class Prompts {
    static final String NOT_PROVIDED = "(not provided)";

    private Prompts() {}

    static String numbered(List<String> lines) {
        List<String> present = nonBlank(lines);
        if (present.isEmpty()) return NOT_PROVIDED;
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < present.size(); i++) {
            out.append(i + 1).append(". ").append(present.get(i)).append('\n');
        }
        return out.toString().trim();
    }

    static String bulleted(List<String> lines) {
        List<String> present = nonBlank(lines);
        if (present.isEmpty()) return NOT_PROVIDED;
        return present.stream().map(line -> "- " + line).collect(Collectors.joining("\n"));
    }

    static String orNotProvided(String text) {
        return text == null || text.isBlank() ? NOT_PROVIDED : text.trim();
    }

    static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(item -> values.add(item.asText("")));
        }
        return values;
    }

    static List<String> nonBlank(List<String> lines) {
        if (lines == null) return List.of();
        return lines.stream().filter(line -> line != null && !line.isBlank()).map(String::trim).toList();
    }
}
