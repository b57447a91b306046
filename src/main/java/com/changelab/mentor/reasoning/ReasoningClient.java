package com.changelab.mentor.reasoning;

import com.changelab.mentor.strategy.SamplingParams;

public interface ReasoningClient {
    String complete(String systemInstruction, String userPrompt, SamplingParams samplingParams);
}
