package com.changelab.mentor.context;

import com.changelab.mentor.project.ProjectModels.ProjectDocument;
import com.changelab.mentor.project.ProjectStore;
import com.changelab.mentor.strategy.FocusPayloads.FocusPayload;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class ContextAccumulator {
    private static final Logger log = LoggerFactory.getLogger(ContextAccumulator.class);

    private final ProjectStore projectStore;

    public ContextAccumulator(ProjectStore projectStore) {
        this.projectStore = projectStore;
    }

    public FocusContext accumulate(String projectId, String stageId, String zoneId, FocusAction action,
                                   List<String> sections, FocusPayload payload) {
        Optional<ProjectDocument> document;
        try {
            document = projectStore.get(projectId);
        } catch (RuntimeException e) {
            log.warn("Project {} could not be read; continuing with a degraded context", projectId, e);
            document = Optional.empty();
        }
        if (document.isEmpty()) {
            log.warn("Project {} not found; continuing with a degraded context for {}",
                    projectId, stageId);
            return new FocusContext(projectId, stageId, zoneId, action, null, null, Map.of(), payload, true);
        }

        ProjectDocument project = document.get();
        Map<String, JsonNode> merged = new LinkedHashMap<>();
        for (String section : sections) {
            JsonNode node = project.data().get(section);
            if (node != null && !node.isNull()) {
                merged.put(section, node);
            }
        }
        return new FocusContext(projectId, stageId, zoneId, action,
                project.text("chosenProblem"), project.text("passionTopic"), merged, payload, false);
    }
}
