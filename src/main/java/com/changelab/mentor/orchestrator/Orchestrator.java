package com.changelab.mentor.orchestrator;

import com.changelab.mentor.context.ContextAccumulator;
import com.changelab.mentor.context.FocusAction;
import com.changelab.mentor.context.FocusContext;
import com.changelab.mentor.interpreter.InterpreterModels.InterpretedResponse;
import com.changelab.mentor.interpreter.ResponseInterpreter;
import com.changelab.mentor.orchestrator.OrchestratorModels.AiRequest;
import com.changelab.mentor.orchestrator.OrchestratorModels.AiResponse;
import com.changelab.mentor.orchestrator.OrchestratorModels.ReviewRecord;
import com.changelab.mentor.project.ProjectStore;
import com.changelab.mentor.reasoning.ReasoningGateway;
import com.changelab.mentor.strategy.FocusPayloads.FocusPayload;
import com.changelab.mentor.strategy.OutputMode;
import com.changelab.mentor.strategy.StrategyDescriptor;
import com.changelab.mentor.strategy.StrategyRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class Orchestrator {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final StrategyRegistry registry;
    private final ContextAccumulator contextAccumulator;
    private final ReasoningGateway gateway;
    private final ResponseInterpreter interpreter;
    private final ProjectStore projectStore;
    private final ObjectMapper objectMapper;

    public Orchestrator(StrategyRegistry registry,
                        ContextAccumulator contextAccumulator,
                        ReasoningGateway gateway,
                        ResponseInterpreter interpreter,
                        ProjectStore projectStore,
                        ObjectMapper objectMapper) {
        this.registry = registry;
        this.contextAccumulator = contextAccumulator;
        this.gateway = gateway;
        this.interpreter = interpreter;
        this.projectStore = projectStore;
        this.objectMapper = objectMapper;
    }

    public AiResponse handle(AiRequest request) {
        requireText(request.projectId(), "projectId");
        requireText(request.stageId(), "stageId");
        FocusAction action = FocusAction.parse(request.action());

        StrategyDescriptor descriptor = registry.lookup(request.stageId(), request.zoneId());
        FocusPayload payload = bindPayload(descriptor, request.payload());
        FocusContext context = contextAccumulator.accumulate(request.projectId(), request.stageId(),
                request.zoneId(), action, descriptor.contextSections(), payload);

        InterpretedResponse interpreted = run(descriptor, context);
        if (action == FocusAction.REVIEW && descriptor.resultPath() != null && !context.degraded()) {
            recordReview(request.projectId(), descriptor.resultPath(), interpreted);
        }
        return new AiResponse(interpreted.feedback(), interpreted.followUpQuestion(),
                descriptor.outputMode() == OutputMode.ITEMS ? interpreted.items() : null, true, null);
    }

    public InterpretedResponse run(String focusKey, String projectId, FocusAction action, FocusPayload payload) {
        StrategyDescriptor descriptor = registry.lookup(focusKey);
        String[] parts = focusKey.split(":", 2);
        FocusContext context = contextAccumulator.accumulate(projectId, parts[0], parts.length > 1 ? parts[1] : null,
                action, descriptor.contextSections(), payload);
        return run(descriptor, context);
    }

    private InterpretedResponse run(StrategyDescriptor descriptor, FocusContext context) {
        String prompt = descriptor.promptBuilder().build(context);
        String raw = gateway.invoke(descriptor, prompt);
        InterpretedResponse interpreted = interpreter.interpret(descriptor, raw, context);
        log.info("Focus {} ({}) for project {}: {} statement(s), {} item(s){}",
                descriptor.focusKey(), context.action(), context.projectId(),
                interpreted.feedback().size(),
                interpreted.items() == null ? 0 : interpreted.items().size(),
                interpreted.usedFallback() ? ", fallback" : "");
        return interpreted;
    }

    private FocusPayload bindPayload(StrategyDescriptor descriptor, JsonNode payload) {
        JsonNode source = payload == null || payload.isNull() ? objectMapper.createObjectNode() : payload;
        if (!source.isObject()) {
            throw new IllegalArgumentException("payload must be a JSON object");
        }
        try {
            return objectMapper.convertValue(source, descriptor.payloadType());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("payload does not fit focus " + descriptor.focusKey(), e);
        }
    }

    private void recordReview(String projectId, String resultPath, InterpretedResponse interpreted) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(resultPath + ".hasCheckedFeedback", true);
        fields.put(resultPath + ".aiFeedback", new ReviewRecord(interpreted.feedback(), interpreted.followUpQuestion()));
        try {
            projectStore.updatePartial(projectId, fields);
        } catch (RuntimeException e) {
            log.warn("Review for {} could not be recorded on project {}", resultPath, projectId, e);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
