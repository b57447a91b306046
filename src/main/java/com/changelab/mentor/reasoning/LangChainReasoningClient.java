package com.changelab.mentor.reasoning;

import com.changelab.mentor.strategy.SamplingParams;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class LangChainReasoningClient implements ReasoningClient {
    private static final Logger log = LoggerFactory.getLogger(LangChainReasoningClient.class);

    private final ChatModel chatModel;
    private final String defaultModel;

    public LangChainReasoningClient(@Value("${changelab.reasoning.api-key:}") String apiKey,
                                    @Value("${changelab.reasoning.base-url:https://api.openai.com/v1}") String baseUrl,
                                    @Value("${changelab.reasoning.default-model:gpt-4o-mini}") String defaultModel,
                                    @Value("${changelab.reasoning.timeout-seconds:60}") long timeoutSeconds,
                                    @Value("${changelab.reasoning.max-retries:0}") int maxRetries) {
        this.defaultModel = defaultModel;
        if (apiKey == null || apiKey.isBlank()) {
            log.error("changelab.reasoning.api-key is not set; reasoning requests will fail until it is configured");
            this.chatModel = null;
        } else {
            log.info("Reasoning model {} at {} (timeout {}s, retries {})", defaultModel, baseUrl, timeoutSeconds, maxRetries);
            this.chatModel = OpenAiChatModel.builder()
                    .apiKey(apiKey)
                    .baseUrl(baseUrl)
                    .modelName(defaultModel)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .maxRetries(maxRetries)
                    .build();
        }
    }

    @Override
    public String complete(String systemInstruction, String userPrompt, SamplingParams samplingParams) {
        if (chatModel == null) {
            throw new ConfigurationException("Reasoning service is not configured: missing API key");
        }
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(systemInstruction), UserMessage.from(userPrompt))
                .modelName(samplingParams.model() != null ? samplingParams.model() : defaultModel)
                .temperature(samplingParams.temperature())
                .maxOutputTokens(samplingParams.maxTokens())
                .build();
        ChatResponse response = chatModel.chat(request);
        return response.aiMessage() == null ? "" : response.aiMessage().text();
    }
}
