package com.changelab.mentor.strategy;

import com.changelab.mentor.context.FocusContext;
import com.changelab.mentor.strategy.FocusPayloads.FieldAnswerPayload;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class FourWsStrategies implements StrategyCatalog {
    private static final Map<String, String> FIELD_QUESTIONS = Map.of(
            "what", "What exactly is the problem?",
            "who", "Who is affected by it?",
            "where", "Where does it happen?",
            "why", "Why does it matter?");

    private static final String PRECISION_INSTRUCTION =
            "You help a 12-16 year old make a problem statement precise. "
                    + "Check that each answer is specific, measurable where possible, and about the problem rather than a fix. "
                    + "Do not suggest solutions or projects.";

    @Override
    public List<StrategyDescriptor> descriptors() {
        List<StrategyDescriptor> descriptors = new ArrayList<>();
        descriptors.add(StrategyDescriptor.builder("four-ws")
                .systemInstruction(PRECISION_INSTRUCTION)
                .prompt(this::wholeStatementPrompt)
                .sampling(0.6, 350)
                .payload(FieldAnswerPayload.class)
                .sections("problemStatement", "problemExploration")
                .policy(ContentPolicy.SOLUTION_LANGUAGE)
                .fallback(context -> List.of(
                        "Read your four answers together: do they describe the same problem about " + context.topic() + "?"))
                .build());
        for (String field : List.of("what", "who", "where", "why")) {
            descriptors.add(field(field));
        }
        return descriptors;
    }

    private StrategyDescriptor field(String field) {
        return StrategyDescriptor.builder("four-ws:" + field)
                .systemInstruction(PRECISION_INSTRUCTION + " Focus only on the question: " + FIELD_QUESTIONS.get(field))
                .prompt(context -> fieldPrompt(context, field))
                .sampling(0.6, 250)
                .payload(FieldAnswerPayload.class)
                .sections("problemStatement", "problemExploration")
                .policy(ContentPolicy.SOLUTION_LANGUAGE)
                .fallback(context -> List.of(
                        "Make your answer to \"" + FIELD_QUESTIONS.get(field) + "\" more specific.",
                        "Use a number, a place or a group of people connected to " + context.topic() + "."))
                .resultPath("problemStatement." + field)
                .build();
    }

    private String fieldPrompt(FocusContext context, String field) {
        FieldAnswerPayload payload = context.payload(FieldAnswerPayload.class);
        String answer = payload != null && payload.answer() != null
                ? payload.answer()
                : context.section("problemStatement").path(field).path("answer").asText("");
        return "Problem: \"" + context.topic() + "\"\n\n"
                + FIELD_QUESTIONS.get(field) + "\nStudent answer: " + Prompts.orNotProvided(answer) + "\n\n"
                + "Give 2-3 numbered points of feedback, then end with one short question.";
    }

    private String wholeStatementPrompt(FocusContext context) {
        FieldAnswerPayload payload = context.payload(FieldAnswerPayload.class);
        JsonNode stored = context.section("problemStatement");
        StringBuilder prompt = new StringBuilder("Problem: \"").append(context.topic()).append("\"\n\n");
        for (String field : List.of("what", "who", "where", "why")) {
            String answer = payload == null ? null : switch (field) {
                case "what" -> payload.what();
                case "who" -> payload.who();
                case "where" -> payload.where();
                default -> payload.why();
            };
            if (answer == null) {
                answer = stored.path(field).path("answer").asText("");
            }
            prompt.append(FIELD_QUESTIONS.get(field)).append(' ').append(Prompts.orNotProvided(answer)).append('\n');
        }
        return prompt.append("\nReview the statement as a whole in 2-4 numbered points, then ask one question.").toString();
    }
}
