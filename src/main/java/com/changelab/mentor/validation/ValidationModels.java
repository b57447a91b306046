package com.changelab.mentor.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class ValidationModels {
    public record ValidationVerdict(@JsonProperty("isValid") boolean isValid,
                                    @JsonProperty("isUnique") boolean isUnique) {}

    public record CompletionCheck(int validCount, int requiredCount, boolean complete) {}

    public record CheckRequest(String text, Integer minLength, List<String> corpus) {}

    public record CompletionRequest(List<String> entries, int requiredCount, Integer minLength) {}
}
