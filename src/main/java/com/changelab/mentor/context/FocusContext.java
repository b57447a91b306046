package com.changelab.mentor.context;

import com.changelab.mentor.strategy.FocusPayloads.FocusPayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Map;

public record FocusContext(String projectId,
                           String stageId,
                           String zoneId,
                           FocusAction action,
                           String chosenProblem,
                           String passionTopic,
                           Map<String, JsonNode> sections,
                           FocusPayload payload,
                           boolean degraded) {

    public FocusContext {
        sections = sections == null ? Map.of() : Map.copyOf(sections);
    }

    public JsonNode section(String name) {
        JsonNode node = sections.get(name);
        return node == null ? MissingNode.getInstance() : node;
    }

    public <T extends FocusPayload> T payload(Class<T> type) {
        return type.isInstance(payload) ? type.cast(payload) : null;
    }

    public String topic() {
        if (chosenProblem != null && !chosenProblem.isBlank()) return chosenProblem;
        if (passionTopic != null && !passionTopic.isBlank()) return passionTopic;
        return "the problem you care about";
    }
}
