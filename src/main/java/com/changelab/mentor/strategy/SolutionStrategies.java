package com.changelab.mentor.strategy;

import com.changelab.mentor.context.FocusContext;
import com.changelab.mentor.strategy.FocusPayloads.StationIdeaPayload;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class SolutionStrategies implements StrategyCatalog {
    public static final Map<String, String> STATION_NAMES;

    static {
        Map<String, String> names = new LinkedHashMap<>();
        names.put("hiTech", "Hi Tech");
        names.put("lowTech", "Low Tech");
        names.put("perspectives", "Different Perspectives");
        names.put("superpowers", "Superpowers");
        names.put("bottomlessDollar", "Bottomless Dollar");
        names.put("leader", "Leader of Your Country");
        names.put("friends", "With a Little Help from My Friends");
        names.put("tinySeeds", "From Tiny Seeds");
        STATION_NAMES = Collections.unmodifiableMap(names);
    }

    private static final Map<String, String> STATION_ANGLES = Map.of(
            "hiTech", "how the technology directly addresses the problem and whether it is realistic",
            "lowTech", "whether it works with simple, cheap materials and everyday actions",
            "perspectives", "how the idea looks from the point of view of the people most affected",
            "superpowers", "which part of the impossible idea could be turned into something real",
            "bottomlessDollar", "what the idea would achieve with unlimited money and what part survives without it",
            "leader", "which rule, law or policy change the idea relies on and who it would affect",
            "friends", "who the student would team up with and what each person brings",
            "tinySeeds", "the smallest first step the student could take this week");

    @Override
    public List<StrategyDescriptor> descriptors() {
        return STATION_NAMES.keySet().stream().map(this::station).toList();
    }

    private StrategyDescriptor station(String stationId) {
        String name = STATION_NAMES.get(stationId);
        return StrategyDescriptor.builder("solutions:" + stationId)
                .systemInstruction("You are evaluating a student's \"" + name + "\" solution idea for their change project. "
                        + "Give constructive, encouraging feedback about " + STATION_ANGLES.get(stationId) + ". "
                        + "Help them refine their thinking, do not rewrite their idea.")
                .prompt(context -> prompt(context, stationId, name))
                .sampling(0.7, 300)
                .payload(StationIdeaPayload.class)
                .sections("solutionWheel", "problemStatement")
                .fallback(context -> List.of(
                        "Say in one sentence how this " + name + " idea changes " + context.topic() + ".",
                        "Name the first person who would notice the difference."))
                .resultPath("solutionWheel." + stationId)
                .build();
    }

    private String prompt(FocusContext context, String stationId, String name) {
        StationIdeaPayload payload = context.payload(StationIdeaPayload.class);
        String idea = payload != null && payload.idea() != null
                ? payload.idea()
                : context.section("solutionWheel").path(stationId).path("idea").asText("");
        return "The student's chosen problem is: \"" + context.topic() + "\".\n\n"
                + "Their " + name + " solution idea is:\n" + Prompts.orNotProvided(idea) + "\n\n"
                + "Provide 2-3 bullet points of feedback to help them strengthen it, then one question.";
    }
}
