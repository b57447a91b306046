package com.changelab.mentor.interpreter;

import com.changelab.mentor.context.FocusContext;
import com.changelab.mentor.interpreter.InterpreterModels.InterpretedResponse;
import com.changelab.mentor.interpreter.InterpreterModels.Segmentation;
import com.changelab.mentor.strategy.ContentPolicy;
import com.changelab.mentor.strategy.OutputMode;
import com.changelab.mentor.strategy.StrategyDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns raw reasoning text into feedback or items, as fixed by the descriptor's output mode, and
 * applies the descriptor's content policy to every statement and item.
 * <p>
 * Malformed output never escapes: feedback falls back to the descriptor's deterministic text,
 * and an unparsable item list comes back empty.
 */
@Component
public class ResponseInterpreter {
    private static final Logger log = LoggerFactory.getLogger(ResponseInterpreter.class);

    private final TextSegmentationStrategy segmentation;
    private final ItemListParser itemListParser;

    public ResponseInterpreter(TextSegmentationStrategy segmentation, ItemListParser itemListParser) {
        this.segmentation = segmentation;
        this.itemListParser = itemListParser;
    }

    public InterpretedResponse interpret(StrategyDescriptor descriptor, String rawText, FocusContext context) {
        return descriptor.outputMode() == OutputMode.ITEMS
                ? interpretItems(descriptor, rawText, context)
                : interpretFeedback(descriptor, rawText, context);
    }

    private InterpretedResponse interpretFeedback(StrategyDescriptor descriptor, String rawText, FocusContext context) {
        Segmentation segmented = segmentation.segment(rawText);
        List<String> statements = permitted(descriptor, segmented.statements());
        String question = segmented.followUpQuestion();
        if (question != null && !permitted(descriptor.contentPolicy(), descriptor.focusKey(), question)) {
            question = null;
        }

        if (statements.size() < descriptor.minimumCount()) {
            log.warn("Feedback for {} kept {} of {} statement(s), below minimum {}; using fallback",
                    descriptor.focusKey(), statements.size(), segmented.statements().size(), descriptor.minimumCount());
            return InterpretedResponse.feedback(descriptor.fallbackFor(context), question, true);
        }
        return InterpretedResponse.feedback(statements, question, false);
    }

    private InterpretedResponse interpretItems(StrategyDescriptor descriptor, String rawText, FocusContext context) {
        List<String> parsed = itemListParser.parse(rawText);
        if (parsed.isEmpty()) {
            log.warn("No item list could be read from the {} response ({} chars)",
                    descriptor.focusKey(), rawText == null ? 0 : rawText.length());
            return InterpretedResponse.items(List.of(), false);
        }

        List<String> items = permitted(descriptor, parsed);
        if (items.size() < descriptor.minimumCount()) {
            log.warn("Items for {} kept {} of {}, below minimum {}; using fallback",
                    descriptor.focusKey(), items.size(), parsed.size(), descriptor.minimumCount());
            return InterpretedResponse.items(descriptor.fallbackFor(context), true);
        }
        return InterpretedResponse.items(items, false);
    }

    private List<String> permitted(StrategyDescriptor descriptor, List<String> candidates) {
        return candidates.stream()
                .filter(text -> permitted(descriptor.contentPolicy(), descriptor.focusKey(), text))
                .toList();
    }

    private boolean permitted(ContentPolicy policy, String focusKey, String text) {
        String marker = policy.matchedMarker(text);
        if (marker == null) return true;
        log.warn("Content policy {} rejected output for {} (matched \"{}\")", policy, focusKey, marker);
        return false;
    }
}
