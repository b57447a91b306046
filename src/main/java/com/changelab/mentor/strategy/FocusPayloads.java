package com.changelab.mentor.strategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

public class FocusPayloads {
    public interface FocusPayload {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ZoneAnswersPayload(List<String> answers) implements FocusPayload {
        public List<String> answersOrEmpty() {
            return answers == null ? List.of() : answers;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FieldAnswerPayload(String answer, String what, String who, String where, String why)
            implements FocusPayload {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StationIdeaPayload(String idea) implements FocusPayload {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConvergencePayload(Map<String, String> stationIdeas,
                                     List<String> selectedCandidates,
                                     String coDesignPhase,
                                     List<HistoryLine> history,
                                     String learnerMessage,
                                     List<String> ideaBank,
                                     Integer variantCount) implements FocusPayload {}

    public record HistoryLine(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IncubatorPayload(String passionTopic,
                                   String selectedDomain,
                                   List<String> selectedIssues,
                                   List<String> previousSuggestions,
                                   Boolean regenerate,
                                   String originalStatement,
                                   String tweakInstructions) implements FocusPayload {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmptyPayload() implements FocusPayload {}
}
