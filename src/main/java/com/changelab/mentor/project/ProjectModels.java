package com.changelab.mentor.project;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class ProjectModels {
    public record ProjectDocument(String projectId, ObjectNode data, long revision, Instant updatedAt) {
        public String text(String field) {
            var node = data.get(field);
            return node == null || node.isNull() ? null : node.asText();
        }
    }

    public record CreateProjectRequest(String passionTopic) {}

    public record CreateProjectResponse(String projectId) {}

    public record PartialUpdateRequest(Map<String, Object> fields) {}

    public record StepProgress(String stepId, boolean complete, boolean unlocked) {}

    public record JourneyProgress(String projectId, List<StepProgress> steps, String frontierStepId) {}

    @FunctionalInterface
    public interface ProjectListener {
        void onChange(ProjectDocument document);
    }
}
