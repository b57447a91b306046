package com.changelab.mentor.project;

import com.changelab.mentor.project.ProjectModels.JourneyProgress;
import com.changelab.mentor.project.ProjectModels.ProjectDocument;
import com.changelab.mentor.project.ProjectModels.StepProgress;
import com.changelab.mentor.strategy.SolutionStrategies;
import com.changelab.mentor.validation.ResponseValidator;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

@Service
public class JourneyProgressService {
    private static final Map<String, Integer> EXPLORE_REQUIRED = new LinkedHashMap<>();

    static {
        EXPLORE_REQUIRED.put("thinkBig", 3);
        EXPLORE_REQUIRED.put("thinkSmall", 3);
        EXPLORE_REQUIRED.put("causes", 3);
        EXPLORE_REQUIRED.put("motivation", 1);
    }
    private static final List<String> FOUR_WS_FIELDS = List.of("what", "who", "where", "why");
    private static final int FOUR_WS_MIN_LENGTH = 10;
    private static final int STATION_MIN_LENGTH = 16;

    private final ProjectStore projectStore;
    private final ResponseValidator validator;

    public JourneyProgressService(ProjectStore projectStore, ResponseValidator validator) {
        this.projectStore = projectStore;
        this.validator = validator;
    }

    public JourneyProgress progress(String projectId) {
        ProjectDocument document = projectStore.get(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        JsonNode data = document.data();

        Map<String, Predicate<JsonNode>> steps = new LinkedHashMap<>();
        steps.put("explore", this::exploreComplete);
        steps.put("four-ws", this::fourWsComplete);
        steps.put("solutions", this::solutionsComplete);
        steps.put("convergence", d -> hasText(d.path("convergence").path("lockedArtifact")));
        steps.put("decision-tree", d -> false);

        List<StepProgress> result = new ArrayList<>();
        boolean previousComplete = true;
        String frontier = null;
        for (var step : steps.entrySet()) {
            boolean complete = step.getValue().test(data);
            result.add(new StepProgress(step.getKey(), complete, previousComplete));
            if (frontier == null && !complete) {
                frontier = step.getKey();
            }
            previousComplete = previousComplete && complete;
        }
        return new JourneyProgress(projectId, result, frontier);
    }

    boolean exploreComplete(JsonNode data) {
        JsonNode exploration = data.path("problemExploration");
        return EXPLORE_REQUIRED.entrySet().stream().allMatch(zone -> {
            JsonNode node = exploration.path(zone.getKey());
            return validator.completion(texts(node.path("answers")), zone.getValue(),
                    ResponseValidator.DEFAULT_MIN_LENGTH).complete()
                    && node.path("hasCheckedFeedback").asBoolean(false);
        });
    }

    boolean fourWsComplete(JsonNode data) {
        JsonNode statement = data.path("problemStatement");
        return FOUR_WS_FIELDS.stream().allMatch(field -> {
            JsonNode node = statement.path(field);
            return validator.isValid(node.path("answer").asText(""), FOUR_WS_MIN_LENGTH)
                    && node.path("hasCheckedFeedback").asBoolean(false);
        });
    }

    boolean solutionsComplete(JsonNode data) {
        JsonNode wheel = data.path("solutionWheel");
        return SolutionStrategies.STATION_NAMES.keySet().stream().allMatch(station -> {
            JsonNode node = wheel.path(station);
            return validator.isValid(node.path("idea").asText(""), STATION_MIN_LENGTH)
                    && node.path("hasCheckedFeedback").asBoolean(false);
        });
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(item -> values.add(item.asText("")));
        }
        return values;
    }

    private static boolean hasText(JsonNode node) {
        return node.isTextual() && !node.asText().isBlank();
    }
}
