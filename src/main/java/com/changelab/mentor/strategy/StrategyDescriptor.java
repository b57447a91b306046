package com.changelab.mentor.strategy;

import com.changelab.mentor.context.FocusContext;
import com.changelab.mentor.strategy.FocusPayloads.EmptyPayload;
import com.changelab.mentor.strategy.FocusPayloads.FocusPayload;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Immutable configuration for one focus.
 *
 * @param contextSections project namespaces merged into the focus context
 * @param minimumCount    fewer surviving statements or items than this triggers the fallback
 * @param resultPath      where a successful review is recorded, or {@code null}
 */
public record StrategyDescriptor(String focusKey,
                                 String systemInstruction,
                                 PromptBuilder promptBuilder,
                                 SamplingParams samplingParams,
                                 OutputMode outputMode,
                                 Class<? extends FocusPayload> payloadType,
                                 List<String> contextSections,
                                 ContentPolicy contentPolicy,
                                 int minimumCount,
                                 Function<FocusContext, List<String>> fallback,
                                 String resultPath) {

    public static Builder builder(String focusKey) {
        return new Builder(focusKey);
    }

    public List<String> fallbackFor(FocusContext context) {
        List<String> content = fallback.apply(context);
        return content == null ? List.of() : content;
    }

    public static final class Builder {
        private final String focusKey;
        private String systemInstruction;
        private PromptBuilder promptBuilder;
        private SamplingParams samplingParams = SamplingParams.of(0.7, 300);
        private OutputMode outputMode = OutputMode.FEEDBACK;
        private Class<? extends FocusPayload> payloadType = EmptyPayload.class;
        private List<String> contextSections = List.of();
        private ContentPolicy contentPolicy = ContentPolicy.PERMISSIVE;
        private int minimumCount = 1;
        private Function<FocusContext, List<String>> fallback = context -> List.of();
        private String resultPath;

        private Builder(String focusKey) {
            this.focusKey = focusKey;
        }

        public Builder systemInstruction(String systemInstruction) {
            this.systemInstruction = systemInstruction;
            return this;
        }

        public Builder prompt(PromptBuilder promptBuilder) {
            this.promptBuilder = promptBuilder;
            return this;
        }

        public Builder sampling(double temperature, int maxTokens) {
            this.samplingParams = SamplingParams.of(temperature, maxTokens);
            return this;
        }

        public Builder sampling(SamplingParams samplingParams) {
            this.samplingParams = samplingParams;
            return this;
        }

        public Builder items() {
            this.outputMode = OutputMode.ITEMS;
            return this;
        }

        public Builder payload(Class<? extends FocusPayload> payloadType) {
            this.payloadType = payloadType;
            return this;
        }

        public Builder sections(String... sections) {
            this.contextSections = List.of(sections);
            return this;
        }

        public Builder policy(ContentPolicy contentPolicy) {
            this.contentPolicy = contentPolicy;
            return this;
        }

        public Builder minimumCount(int minimumCount) {
            this.minimumCount = minimumCount;
            return this;
        }

        public Builder fallback(Function<FocusContext, List<String>> fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder resultPath(String resultPath) {
            this.resultPath = resultPath;
            return this;
        }

        public StrategyDescriptor build() {
            Objects.requireNonNull(systemInstruction, "systemInstruction for " + focusKey);
            Objects.requireNonNull(promptBuilder, "promptBuilder for " + focusKey);
            return new StrategyDescriptor(focusKey, systemInstruction, promptBuilder, samplingParams, outputMode,
                    payloadType, contextSections, contentPolicy, minimumCount, fallback, resultPath);
        }
    }
}
