package com.changelab.mentor.strategy;

import com.changelab.mentor.context.FocusContext;
import com.changelab.mentor.strategy.FocusPayloads.ZoneAnswersPayload;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ExploreStrategies implements StrategyCatalog {

    @Override
    public List<StrategyDescriptor> descriptors() {
        return List.of(
                zone("thinkBig",
                        "You help a 12-16 year old think in systems about a problem they care about. "
                                + "Point out connections between the parts of the system they listed and what is missing. "
                                + "Do not suggest solutions or projects.",
                        "the big-picture parts of the system"),
                zone("thinkSmall",
                        "You help a 12-16 year old observe a problem closely in everyday life. "
                                + "Push for concrete, observable details: who, where, how often. "
                                + "Do not suggest solutions or projects.",
                        "the small, everyday observations"),
                zone("causes",
                        "You help a 12-16 year old reason about root causes. "
                                + "Separate causes from symptoms and ask what lies underneath. "
                                + "Do not suggest solutions or projects.",
                        "the causes"),
                zone("motivation",
                        "You help a 12-16 year old reflect on why a problem matters to them personally. "
                                + "Be warm and brief. Do not suggest solutions or projects.",
                        "the personal motivation"));
    }

    private StrategyDescriptor zone(String zoneId, String instruction, String zoneLabel) {
        return StrategyDescriptor.builder("explore:" + zoneId)
                .systemInstruction(instruction)
                .prompt(context -> prompt(context, zoneId, zoneLabel))
                .sampling(0.7, 300)
                .payload(ZoneAnswersPayload.class)
                .sections("problemExploration")
                .policy(ContentPolicy.SOLUTION_LANGUAGE)
                .fallback(context -> List.of(
                        "Look again at " + zoneLabel + " of " + context.topic() + " and add one more specific detail.",
                        "Try naming who is affected and where you have seen this happen."))
                .resultPath("problemExploration." + zoneId)
                .build();
    }

    private String prompt(FocusContext context, String zoneId, String zoneLabel) {
        ZoneAnswersPayload payload = context.payload(ZoneAnswersPayload.class);
        List<String> answers = payload != null && !payload.answersOrEmpty().isEmpty()
                ? payload.answersOrEmpty()
                : Prompts.texts(context.section("problemExploration").path(zoneId).path("answers"));
        return "The student is exploring: \"" + context.topic() + "\".\n\n"
                + "Their notes on " + zoneLabel + ":\n" + Prompts.numbered(answers) + "\n\n"
                + "Give 2-3 numbered points of feedback, then end with one short question.";
    }
}
