package com.changelab.mentor.strategy;

import com.changelab.mentor.context.FocusContext;
import com.changelab.mentor.strategy.FocusPayloads.ConvergencePayload;
import com.changelab.mentor.strategy.FocusPayloads.HistoryLine;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class ConvergenceStrategies implements StrategyCatalog {
    private static final int HISTORY_WINDOW = 8;

    private static final String CO_FOUNDER = "You are a smart co-founder working with a 12-16 year old student "
            + "who has defined a clear problem and generated eight ideas on a solution wheel. "
            + "Be opinionated and concrete, tie every suggestion to something the student said, "
            + "keep each turn to 2-5 sentences and ask at most one question. "
            + "Never propose harmful, unsafe or discriminatory ideas.";

    @Override
    public List<StrategyDescriptor> descriptors() {
        return List.of(
                StrategyDescriptor.builder("convergence:reflect")
                        .systemInstruction(CO_FOUNDER)
                        .prompt(this::reflectPrompt)
                        .sampling(0.8, 300)
                        .payload(ConvergencePayload.class)
                        .sections("solutionWheel", "problemStatement")
                        .fallback(context -> List.of(
                                "You have eight very different ideas for " + context.topic()
                                        + ". Pick the ones you would be proud to explain to a friend."))
                        .build(),
                StrategyDescriptor.builder("convergence:co-design")
                        .systemInstruction(CO_FOUNDER)
                        .prompt(this::coDesignPrompt)
                        .sampling(0.8, 350)
                        .payload(ConvergencePayload.class)
                        .sections("solutionWheel", "problemStatement")
                        .fallback(context -> List.of(
                                "Let's keep going. Tell me which part of your idea you care about most."))
                        .build(),
                StrategyDescriptor.builder("convergence:variants")
                        .systemInstruction(CO_FOUNDER + " When asked for variants, answer with a JSON array of strings only.")
                        .prompt(this::variantsPrompt)
                        .sampling(0.9, 400)
                        .items()
                        .payload(ConvergencePayload.class)
                        .sections("solutionWheel", "problemStatement")
                        .build(),
                StrategyDescriptor.builder("convergence:selection")
                        .systemInstruction(CO_FOUNDER)
                        .prompt(this::selectionPrompt)
                        .sampling(0.7, 350)
                        .payload(ConvergencePayload.class)
                        .sections("solutionWheel", "problemStatement")
                        .fallback(context -> List.of(
                                "All three ideas are yours. Pick the one you can picture people using next month."))
                        .build());
    }

    private String reflectPrompt(FocusContext context) {
        return "The student's problem: \"" + context.topic() + "\"\n\n"
                + "Their solution wheel ideas (for your reference, do not restate them):\n"
                + stationIdeas(context) + "\n\n"
                + "Write a tight 3-4 sentence reflection: name patterns you notice, spotlight 1-2 promising seeds "
                + "and call out any cliches plainly. One question maximum.";
    }

    private String coDesignPrompt(FocusContext context) {
        ConvergencePayload payload = payload(context);
        String phase = payload.coDesignPhase() == null ? "RANK" : payload.coDesignPhase();
        return "Problem: \"" + context.topic() + "\"\n\n"
                + "Ideas the student selected:\n" + selectedIdeas(context, payload) + "\n"
                + history(payload)
                + "\nCurrent co-design phase: " + phase + ".\n"
                + "Student says: " + Prompts.orNotProvided(payload.learnerMessage()) + "\n\n"
                + "Respond as their co-founder for this phase.";
    }

    private String variantsPrompt(FocusContext context) {
        ConvergencePayload payload = payload(context);
        int count = payload.variantCount() == null ? 3 : payload.variantCount();
        return "Problem: \"" + context.topic() + "\"\n\n"
                + "Direction agreed so far:\n" + selectedIdeas(context, payload) + "\n"
                + history(payload)
                + "\nIdeas the student already kept:\n" + Prompts.bulleted(payload.ideaBank()) + "\n\n"
                + "Write " + count + " distinct one-sentence versions of the concept that differ from the kept ideas. "
                + "Answer with a JSON array of " + count + " strings.";
    }

    private String selectionPrompt(FocusContext context) {
        ConvergencePayload payload = payload(context);
        return "Problem: \"" + context.topic() + "\"\n\n"
                + "The student kept these three ideas:\n" + Prompts.numbered(payload.ideaBank()) + "\n\n"
                + "Compare them honestly in 2-4 numbered points: what each does best and what it risks. "
                + "Finish with one question that helps them pick one.";
    }

    private ConvergencePayload payload(FocusContext context) {
        ConvergencePayload payload = context.payload(ConvergencePayload.class);
        return payload != null ? payload : new ConvergencePayload(null, null, null, null, null, null, null);
    }

    private String stationIdeas(FocusContext context) {
        ConvergencePayload payload = payload(context);
        List<String> lines = new ArrayList<>();
        SolutionStrategies.STATION_NAMES.forEach((id, name) ->
                lines.add(name + ": " + Prompts.orNotProvided(stationIdea(context, payload, id))));
        return String.join("\n", lines);
    }

    private String selectedIdeas(FocusContext context, ConvergencePayload payload) {
        List<String> lines = new ArrayList<>();
        char label = 'A';
        for (String id : nonNull(payload.selectedCandidates())) {
            String name = SolutionStrategies.STATION_NAMES.getOrDefault(id, id);
            lines.add("Idea " + label++ + " (" + name + "): " + Prompts.orNotProvided(stationIdea(context, payload, id)));
        }
        return lines.isEmpty() ? Prompts.NOT_PROVIDED : String.join("\n", lines);
    }

    private String stationIdea(FocusContext context, ConvergencePayload payload, String stationId) {
        Map<String, String> inline = payload.stationIdeas();
        if (inline != null && inline.get(stationId) != null) {
            return inline.get(stationId);
        }
        JsonNode stored = context.section("solutionWheel").path(stationId).path("idea");
        return stored.asText("");
    }

    private String history(ConvergencePayload payload) {
        List<HistoryLine> history = nonNull(payload.history());
        if (history.isEmpty()) return "";
        StringBuilder out = new StringBuilder("\nConversation so far:\n");
        history.subList(Math.max(0, history.size() - HISTORY_WINDOW), history.size()).forEach(line ->
                out.append("collaborator".equals(line.role()) ? "You" : "Student")
                        .append(": ").append(line.content()).append('\n'));
        return out.toString();
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
