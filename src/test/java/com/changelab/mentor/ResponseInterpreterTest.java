package com.changelab.mentor;

import com.changelab.mentor.context.FocusAction;
import com.changelab.mentor.context.FocusContext;
import com.changelab.mentor.interpreter.HeuristicTextSegmentation;
import com.changelab.mentor.interpreter.InterpreterModels.Segmentation;
import com.changelab.mentor.interpreter.ItemListParser;
import com.changelab.mentor.interpreter.ResponseInterpreter;
import com.changelab.mentor.strategy.ContentPolicy;
import com.changelab.mentor.strategy.FocusPayloads.FocusPayload;
import com.changelab.mentor.strategy.FocusPayloads.IncubatorPayload;
import com.changelab.mentor.strategy.StrategyRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ResponseInterpreterTest {
    @Autowired
    private ResponseInterpreter interpreter;

    @Autowired
    private ItemListParser itemListParser;

    @Autowired
    private HeuristicTextSegmentation segmentation;

    @Autowired
    private StrategyRegistry registry;

    @Test
    void parsesItemArraysWithAndWithoutFences() {
        assertEquals(List.of("a", "b", "c"), itemListParser.parse("[\"a\",\"b\",\"c\"]"));
        assertEquals(List.of("a", "b", "c"), itemListParser.parse("```json\n[\"a\", \"b\", \"c\"]\n```"));
        assertEquals(List.of("a", "b"), itemListParser.parse("Here you go: [\"a\", \"b\"] hope it helps"));
        assertEquals(List.of(), itemListParser.parse("no list here at all"));
        assertEquals(List.of(), itemListParser.parse("[1, 2, 3]"));
        assertEquals(List.of("kept"), itemListParser.parse("[\"kept\", \"   \"]"));
    }

    @Test
    void splitsNumberedFeedbackAndTrailingQuestion() {
        Segmentation segmented = segmentation.segment("1. foo\n2. bar\n\nWhat do you think?");
        assertEquals(List.of("foo", "bar"), segmented.statements());
        assertEquals("What do you think?", segmented.followUpQuestion());
    }

    @Test
    void keepsPreambleAndCapsListLength() {
        String text = """
                Nice observations overall.
                - one
                * two
                • three
                1) four
                2) five
                3) six
                """;
        Segmentation segmented = segmentation.segment(text);
        assertEquals(List.of("Nice observations overall.", "one", "two", "three", "four", "five"), segmented.statements());
        assertNull(segmented.followUpQuestion());
    }

    @Test
    void unmarkedTextIsOneStatementAndQuestionLabelIsRemoved() {
        Segmentation plain = segmentation.segment("You noticed a real pattern in how the buses run. Keep going.");
        assertEquals(1, plain.statements().size());
        assertNull(plain.followUpQuestion());

        Segmentation labelled = segmentation.segment("- Clear point\n\n🤔 **Question:** Who notices this first?");
        assertEquals(List.of("Clear point"), labelled.statements());
        assertEquals("Who notices this first?", labelled.followUpQuestion());

        Segmentation inline = segmentation.segment("Good detail about the canteen. Who eats there most often?");
        assertEquals(List.of("Good detail about the canteen."), inline.statements());
        assertEquals("Who eats there most often?", inline.followUpQuestion());
    }

    @Test
    void solutionLanguageFilterRejectsBuildPhrasing() {
        assertFalse(ContentPolicy.SOLUTION_LANGUAGE.permits("Create a mobile app to help"));
        assertTrue(ContentPolicy.SOLUTION_LANGUAGE.permits("Lack of access to clean water."));
        assertTrue(ContentPolicy.PERMISSIVE.permits("Create a mobile app to help"));
    }

    @Test
    void questionNeedsABoundaryBeforeIt() {
        Segmentation listed = segmentation.segment("1. foo\n2. bar What do you think?");
        assertEquals(List.of("foo", "bar What do you think?"), listed.statements());
        assertNull(listed.followUpQuestion());

        Segmentation listedWithBoundary = segmentation.segment("1. foo\n2. bar. What do you think?");
        assertEquals(List.of("foo", "bar."), listedWithBoundary.statements());
        assertEquals("What do you think?", listedWithBoundary.followUpQuestion());

        Segmentation onlyQuestion = segmentation.segment("What do you think?");
        assertEquals(List.of("What do you think?"), onlyQuestion.statements());
        assertNull(onlyQuestion.followUpQuestion());
    }

    @Test
    void replyThatIsOnlyAQuestionIsKeptAsFeedback() {
        var descriptor = registry.lookup("solutions", "hiTech");
        var result = interpreter.interpret(descriptor, "Which part of the idea excites you most?",
                context("solutions", "hiTech", null));
        assertFalse(result.usedFallback());
        assertEquals(List.of("Which part of the idea excites you most?"), result.feedback());
        assertNull(result.followUpQuestion());
    }

    @Test
    void filteredFeedbackFallsBackToTopicText() {
        var descriptor = registry.lookup("explore", "causes");
        var context = context("explore", "causes", null);
        var result = interpreter.interpret(descriptor,
                "1. Create a mobile app to help\n2. Launch a campaign at school\n\nWhat else causes it?", context);
        assertTrue(result.usedFallback());
        assertFalse(result.feedback().isEmpty());
        assertTrue(result.feedback().get(0).contains("Too much litter near the river"));
        assertEquals("What else causes it?", result.followUpQuestion());
    }

    @Test
    void emptyFeedbackResponseStillGivesTheLearnerSomething() {
        var descriptor = registry.lookup("solutions", "hiTech");
        var result = interpreter.interpret(descriptor, "   ", context("solutions", "hiTech", null));
        assertTrue(result.usedFallback());
        assertFalse(result.feedback().isEmpty());
        assertNull(result.items());
    }

    @Test
    void itemsBelowMinimumAfterFilteringUseFallbackButUnparsableStaysEmpty() {
        var descriptor = registry.lookup("incubator", "domains");
        var context = context("incubator", "domains",
                new IncubatorPayload("football", null, null, null, null, null, null));

        var filtered = interpreter.interpret(descriptor,
                "[\"Build a new stadium\", \"Campaign for girls teams\", \"Cost barriers for families\"]", context);
        assertTrue(filtered.usedFallback());
        assertEquals(5, filtered.items().size());
        assertTrue(filtered.items().contains("Awareness and Knowledge Gaps"));

        var unparsable = interpreter.interpret(descriptor, "Sorry, I can't help with that.", context);
        assertEquals(List.of(), unparsable.items());
        assertFalse(unparsable.usedFallback());
    }

    @Test
    void issueFallbackUsesInformationVariantForAwarenessDomains() {
        var descriptor = registry.lookup("incubator", "issues");
        var context = context("incubator", "issues",
                new IncubatorPayload("skateboarding", "Awareness and Knowledge Gaps", null, null, null, null, null));
        var result = interpreter.interpret(descriptor, "[\"Develop a skate app\"]", context);
        assertTrue(result.usedFallback());
        assertTrue(result.items().stream().anyMatch(item -> item.contains("isn't reaching the right people")));
    }

    @Test
    void statementQuotesAreStripped() {
        var descriptor = registry.lookup("incubator", "statement");
        var context = context("incubator", "statement",
                new IncubatorPayload("music", "Cost and Affordability", List.of("Instruments are expensive"), null, null, null, null));
        var result = interpreter.interpret(descriptor,
                "\"Young musicians lack affordable instruments in their schools.\"", context);
        assertEquals(List.of("Young musicians lack affordable instruments in their schools."), result.feedback());
        assertFalse(result.usedFallback());
    }

    private static FocusContext context(String stageId, String zoneId,
                                        FocusPayload payload) {
        return new FocusContext("test-project", stageId, zoneId, FocusAction.REVIEW,
                "Too much litter near the river", "nature", Map.of(), payload, false);
    }
}
