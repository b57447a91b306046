package com.changelab.mentor.interpreter;

import com.changelab.mentor.interpreter.InterpreterModels.Segmentation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The follow-up question is the last sentence of the last non-blank line when that line ends with
 * {@code ?} and a sentence boundary or an earlier line precedes it. Statements are list items;
 * unmarked text before the first item is one statement, unmarked lines after an item continue it.
 */
@Component
public class HeuristicTextSegmentation implements TextSegmentationStrategy {
    static final int MAX_LIST_STATEMENTS = 5;

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:\\d+[.)]|[-*•])\\s+(.*)$");
    private static final Pattern QUESTION_LABEL = Pattern.compile(
            "^[^\\p{L}\\p{N}]*question\\**\\s*:\\s*\\**\\s*", Pattern.CASE_INSENSITIVE);
    // sentence end followed by whitespace; the last one before the final '?' opens the question
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?](?:\\*\\*)?\\s+");

    @Override
    public Segmentation segment(String text) {
        String body = Fences.strip(text);
        if (body.isEmpty()) {
            return new Segmentation(List.of(), null);
        }

        List<String> lines = new ArrayList<>(List.of(body.split("\\R")));
        String question = null;
        int last = lastNonBlank(lines);
        if (last >= 0 && lines.get(last).trim().endsWith("?")) {
            String line = lines.get(last).trim();
            Matcher marker = LIST_MARKER.matcher(line);
            String content = marker.matches() ? marker.group(1).trim() : line;
            int start = questionStart(content);
            if (start < 0 && !marker.matches() && lastNonBlank(lines.subList(0, last)) >= 0) {
                // a line break after earlier text counts as the boundary
                start = 0;
            }
            if (start >= 0) {
                question = cleanQuestion(content.substring(start));
                String rest = content.substring(0, start).trim();
                if (rest.isEmpty()) {
                    lines.remove(last);
                } else {
                    lines.set(last, marker.matches() ? "- " + rest : rest);
                }
                if (question.isEmpty()) {
                    question = null;
                }
            }
        }

        return new Segmentation(statements(lines), question);
    }

    private List<String> statements(List<String> lines) {
        List<String> preamble = new ArrayList<>();
        List<StringBuilder> items = new ArrayList<>();
        for (String line : lines) {
            if (line.isBlank()) continue;
            Matcher marker = LIST_MARKER.matcher(line);
            if (marker.matches()) {
                items.add(new StringBuilder(marker.group(1).trim()));
            } else if (items.isEmpty()) {
                preamble.add(line.trim());
            } else {
                items.get(items.size() - 1).append(' ').append(line.trim());
            }
        }

        List<String> statements = new ArrayList<>();
        addIfPresent(statements, String.join(" ", preamble));
        items.stream().limit(MAX_LIST_STATEMENTS).forEach(item -> addIfPresent(statements, item.toString()));
        return statements;
    }

    private static int questionStart(String content) {
        // ignore the final '?' itself
        String head = content.substring(0, content.length() - 1);
        Matcher boundary = SENTENCE_BOUNDARY.matcher(head);
        int start = -1;
        while (boundary.find()) {
            start = boundary.end();
        }
        return start;
    }

    private static String cleanQuestion(String question) {
        return QUESTION_LABEL.matcher(question.trim()).replaceFirst("").trim();
    }

    private static void addIfPresent(List<String> statements, String statement) {
        String cleaned = unquote(statement.trim());
        if (!cleaned.isBlank()) {
            statements.add(cleaned);
        }
    }

    static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'') || (first == '“' && last == '”')) {
                return text.substring(1, text.length() - 1).trim();
            }
        }
        return text;
    }

    private static int lastNonBlank(List<String> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (!lines.get(i).isBlank()) return i;
        }
        return -1;
    }
}
