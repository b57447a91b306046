package com.changelab.mentor.interpreter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
public class ItemListParser {
    private final ObjectMapper objectMapper;

    public ItemListParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<String> parse(String raw) {
        String text = Fences.strip(raw);
        if (text.isEmpty()) return List.of();

        Optional<List<String>> direct = readStringArray(text);
        if (direct.isPresent()) return direct.get();

        int open = text.indexOf('[');
        int close = text.lastIndexOf(']');
        if (open >= 0 && close > open) {
            return readStringArray(text.substring(open, close + 1)).orElse(List.of());
        }
        return List.of();
    }

    private Optional<List<String>> readStringArray(String candidate) {
        JsonNode node;
        try {
            node = objectMapper.readTree(candidate);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || !node.isArray()) return Optional.empty();
        List<String> items = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) return Optional.empty();
            String value = element.asText().trim();
            if (!value.isEmpty()) {
                items.add(value);
            }
        }
        return Optional.of(items);
    }
}
