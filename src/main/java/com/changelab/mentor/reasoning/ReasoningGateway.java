package com.changelab.mentor.reasoning;

import com.changelab.mentor.strategy.StrategyDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ReasoningGateway {
    private static final Logger log = LoggerFactory.getLogger(ReasoningGateway.class);

    private final ReasoningClient client;

    public ReasoningGateway(ReasoningClient client) {
        this.client = client;
    }

    public String invoke(StrategyDescriptor descriptor, String prompt) {
        long started = System.currentTimeMillis();
        try {
            String text = client.complete(descriptor.systemInstruction(), prompt, descriptor.samplingParams());
            log.debug("Reasoning call for {} took {} ms", descriptor.focusKey(), System.currentTimeMillis() - started);
            return text == null ? "" : text;
        } catch (ConfigurationException e) {
            log.error("Reasoning call for {} refused: {}", descriptor.focusKey(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ReasoningException classified = ReasoningFailureClassifier.toException(e);
            log.warn("Reasoning call for {} failed as {}: {}", descriptor.focusKey(),
                    classified.getClass().getSimpleName(), e.getMessage());
            throw classified;
        }
    }
}
