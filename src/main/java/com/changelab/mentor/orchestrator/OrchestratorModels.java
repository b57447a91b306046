package com.changelab.mentor.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public class OrchestratorModels {
    public record AiRequest(String projectId, String stageId, String zoneId, String action, JsonNode payload) {}

    public record AiResponse(List<String> feedback, String followUpQuestion, List<String> generatedItems,
                             boolean success, String error) {}

    public record ReviewRecord(List<String> feedback, String followUpQuestion) {}
}
