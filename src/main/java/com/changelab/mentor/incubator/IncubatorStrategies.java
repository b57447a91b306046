package com.changelab.mentor.incubator;

import com.changelab.mentor.context.FocusContext;
import com.changelab.mentor.strategy.ContentPolicy;
import com.changelab.mentor.strategy.FocusPayloads.IncubatorPayload;
import com.changelab.mentor.strategy.StrategyCatalog;
import com.changelab.mentor.strategy.StrategyDescriptor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Component
public class IncubatorStrategies implements StrategyCatalog {
    static final List<String> DEFAULT_DOMAINS = List.of(
            "Access and Inclusion Issues",
            "Quality and Standards Concerns",
            "Safety and Well-being Challenges",
            "Awareness and Knowledge Gaps",
            "Resource and Support Limitations");

    private static final String PROBLEMS_ONLY = "You identify PROBLEMS and CHALLENGES, never solutions. "
            + "You help students aged 10-17 discover issues that need addressing.";

    @Override
    public List<StrategyDescriptor> descriptors() {
        return List.of(
                StrategyDescriptor.builder("incubator:domains")
                        .systemInstruction(PROBLEMS_ONLY + " Always respond with a valid JSON array only.")
                        .prompt(this::domainsPrompt)
                        .sampling(0.8, 200)
                        .items()
                        .payload(IncubatorPayload.class)
                        .policy(ContentPolicy.SOLUTION_LANGUAGE)
                        .minimumCount(3)
                        .fallback(context -> DEFAULT_DOMAINS)
                        .build(),
                StrategyDescriptor.builder("incubator:issues")
                        .systemInstruction(PROBLEMS_ONLY + " Always respond with a valid JSON array only.")
                        .prompt(this::issuesPrompt)
                        .sampling(0.8, 250)
                        .items()
                        .payload(IncubatorPayload.class)
                        .policy(ContentPolicy.SOLUTION_LANGUAGE)
                        .minimumCount(2)
                        .fallback(this::issueFallback)
                        .build(),
                StrategyDescriptor.builder("incubator:statement")
                        .systemInstruction("You write clear PROBLEM statements set in the student's passion topic. "
                                + "You never suggest solutions, you only describe what is wrong or lacking.")
                        .prompt(this::statementPrompt)
                        .sampling(0.6, 150)
                        .payload(IncubatorPayload.class)
                        .policy(ContentPolicy.SOLUTION_LANGUAGE)
                        .fallback(context -> List.of(statementFallback(context)))
                        .build(),
                StrategyDescriptor.builder("incubator:tweak")
                        .systemInstruction("You edit PROBLEM statements on request. The result must still describe "
                                + "a problem, never a solution, and suit students aged 10-17.")
                        .prompt(this::tweakPrompt)
                        .sampling(0.6, 150)
                        .payload(IncubatorPayload.class)
                        .policy(ContentPolicy.SOLUTION_LANGUAGE)
                        .fallback(this::tweakFallback)
                        .build());
    }

    private String domainsPrompt(FocusContext context) {
        IncubatorPayload payload = payload(context);
        StringBuilder prompt = new StringBuilder("The student is passionate about \"")
                .append(topic(context, payload)).append("\".\n\n");
        if (Boolean.TRUE.equals(payload.regenerate()) && payload.previousSuggestions() != null
                && !payload.previousSuggestions().isEmpty()) {
            prompt.append("Do NOT repeat any of these earlier problem areas:\n")
                    .append(payload.previousSuggestions().stream().map(s -> "- \"" + s + "\"")
                            .collect(Collectors.joining("\n")))
                    .append("\n\n");
        }
        return prompt.append("Generate 5 distinct PROBLEM AREAS within this topic, framed as challenges ")
                .append("(for example \"Access and Inclusion Barriers\"), not as programs or fixes.\n")
                .append("Return ONLY a JSON array of 5 strings.")
                .toString();
    }

    private String issuesPrompt(FocusContext context) {
        IncubatorPayload payload = payload(context);
        return "Passion topic: \"" + topic(context, payload) + "\"\n"
                + "Problem area: \"" + domain(payload) + "\"\n\n"
                + "List 3-4 specific ISSUES people face in this area. Each must describe something wrong or lacking, "
                + "for example \"Young players can't afford proper equipment\".\n"
                + "Return ONLY a JSON array of strings.";
    }

    private String statementPrompt(FocusContext context) {
        IncubatorPayload payload = payload(context);
        String topic = topic(context, payload);
        return "Write one clear, concise PROBLEM statement.\n\n"
                + "Passion topic: " + topic + "\n"
                + "Problem area: " + domain(payload) + "\n"
                + "Specific focus: " + issuesPath(payload) + "\n\n"
                + "Format: \"[Affected group in " + topic + "] face/struggle with/lack [specific problem] in [context].\"\n"
                + "Return ONLY the statement without quotation marks.";
    }

    private String tweakPrompt(FocusContext context) {
        IncubatorPayload payload = payload(context);
        return "Original problem statement:\n\"" + nullToEmpty(payload.originalStatement()) + "\"\n\n"
                + "Student's request: \"" + nullToEmpty(payload.tweakInstructions()) + "\"\n\n"
                + "Rewrite the statement following the request while keeping it a problem statement about the same issue. "
                + "Return ONLY the new statement without quotation marks.";
    }

    List<String> issueFallback(FocusContext context) {
        IncubatorPayload payload = payload(context);
        String topic = topic(context, payload);
        String domain = domain(payload).toLowerCase(Locale.ROOT);
        boolean metaDomain = domain.contains("awareness") || domain.contains("knowledge") || domain.contains("information");
        if (metaDomain) {
            return List.of(
                    "Important information about " + topic + " isn't reaching the right people",
                    "Misconceptions and myths about " + topic + " are widespread",
                    "Lack of education about important " + topic + " topics");
        }
        return List.of(
                "Lack of " + domain + " in the " + topic + " community",
                "Poor quality " + domain + " for " + topic + " enthusiasts",
                "Inconsistent " + domain + " across " + topic + " activities",
                "Limited access to " + domain + " for people interested in " + topic);
    }

    String statementFallback(FocusContext context) {
        IncubatorPayload payload = payload(context);
        return "People interested in " + topic(context, payload) + " face challenges with "
                + issuesPath(payload).toLowerCase(Locale.ROOT) + " in their community.";
    }

    private List<String> tweakFallback(FocusContext context) {
        String original = payload(context).originalStatement();
        return original == null || original.isBlank() ? List.of(statementFallback(context)) : List.of(original);
    }

    private IncubatorPayload payload(FocusContext context) {
        IncubatorPayload payload = context.payload(IncubatorPayload.class);
        return payload != null ? payload : new IncubatorPayload(null, null, null, null, null, null, null);
    }

    private String topic(FocusContext context, IncubatorPayload payload) {
        if (payload.passionTopic() != null && !payload.passionTopic().isBlank()) {
            return payload.passionTopic().trim();
        }
        return context.passionTopic() != null && !context.passionTopic().isBlank()
                ? context.passionTopic().trim() : "your topic";
    }

    private String domain(IncubatorPayload payload) {
        return payload.selectedDomain() == null || payload.selectedDomain().isBlank()
                ? "everyday challenges" : payload.selectedDomain().trim();
    }

    private String issuesPath(IncubatorPayload payload) {
        List<String> issues = payload.selectedIssues();
        if (issues == null || issues.isEmpty()) return domain(payload);
        return String.join(" → ", issues);
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
