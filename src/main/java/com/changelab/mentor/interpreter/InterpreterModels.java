package com.changelab.mentor.interpreter;

import java.util.List;

public class InterpreterModels {
    public record Segmentation(List<String> statements, String followUpQuestion) {}

    public record InterpretedResponse(List<String> feedback, String followUpQuestion, List<String> items,
                                      boolean usedFallback) {
        public static InterpretedResponse feedback(List<String> feedback, String followUpQuestion, boolean usedFallback) {
            return new InterpretedResponse(List.copyOf(feedback), followUpQuestion, null, usedFallback);
        }

        public static InterpretedResponse items(List<String> items, boolean usedFallback) {
            return new InterpretedResponse(List.of(), null, List.copyOf(items), usedFallback);
        }
    }
}
