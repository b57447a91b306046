package com.changelab.mentor;

import com.changelab.mentor.reasoning.*;
import com.changelab.mentor.reasoning.ReasoningFailureClassifier.Kind;
import com.changelab.mentor.strategy.SamplingParams;
import com.changelab.mentor.strategy.StrategyRegistry;
import dev.langchain4j.exception.HttpException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ReasoningGatewayTest {
    @Autowired
    private ReasoningGateway gateway;

    @Autowired
    private StrategyRegistry registry;

    @Autowired
    private ScriptedReasoningClient client;

    @Autowired
    private LangChainReasoningClient langChainClient;

    @BeforeEach
    void resetClient() {
        client.reset();
    }

    @Test
    void makesExactlyOneCallPerInvocation() {
        client.reply("1. fine");
        assertEquals("1. fine", gateway.invoke(registry.lookup("explore:thinkBig"), "prompt"));
        assertEquals(1, client.calls());
    }

    @Test
    void classifiesFailuresFromStatusAndMessage() {
        assertEquals(Kind.RATE_LIMITED, ReasoningFailureClassifier.classify(new HttpException(429, "slow down")));
        assertEquals(Kind.UNAUTHORIZED, ReasoningFailureClassifier.classify(
                new RuntimeException("wrapped", new HttpException(401, "bad key"))));
        assertEquals(Kind.UNAUTHORIZED, ReasoningFailureClassifier.classify(new HttpException(403, "forbidden")));
        assertEquals(Kind.RATE_LIMITED, ReasoningFailureClassifier.classify(
                new IllegalStateException("Rate limit reached for gpt-4o-mini")));
        assertEquals(Kind.UNKNOWN, ReasoningFailureClassifier.classify(new HttpException(500, "boom")));
    }

    @Test
    void gatewaySurfacesClassifiedFailuresWithoutRetrying() {
        var descriptor = registry.lookup("solutions:hiTech");

        client.fail(new HttpException(429, "Too Many Requests"));
        assertThrows(RateLimitedException.class, () -> gateway.invoke(descriptor, "p"));

        client.fail(new RuntimeException("wrapped", new HttpException(401, "Incorrect API key")));
        assertThrows(UnauthorizedException.class, () -> gateway.invoke(descriptor, "p"));

        client.fail(new IllegalStateException("connection reset"));
        assertThrows(ReasoningFailedException.class, () -> gateway.invoke(descriptor, "p"));

        assertEquals(3, client.calls());
    }

    @Test
    void missingApiKeyIsAConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> langChainClient.complete("system", "user", SamplingParams.of(0.5, 50)));
    }
}
