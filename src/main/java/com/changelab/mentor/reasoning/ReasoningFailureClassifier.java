package com.changelab.mentor.reasoning;

import dev.langchain4j.exception.HttpException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class ReasoningFailureClassifier {
    public enum Kind { RATE_LIMITED, UNAUTHORIZED, UNKNOWN }

    private static final int MAX_DEPTH = 20;

    private ReasoningFailureClassifier() {}

    public static Kind classify(Throwable failure) {
        List<Throwable> chain = causeChain(failure);

        for (Throwable t : chain) {
            if (t instanceof HttpException http) {
                int status = http.statusCode();
                if (status == 429) return Kind.RATE_LIMITED;
                if (status == 401 || status == 403) return Kind.UNAUTHORIZED;
            }
        }

        for (Throwable t : chain) {
            String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (message.contains("rate limit") || message.contains("rate_limit") || message.contains("too many requests")) {
                return Kind.RATE_LIMITED;
            }
            if (message.contains("invalid api key") || message.contains("incorrect api key")) {
                return Kind.UNAUTHORIZED;
            }
        }
        return Kind.UNKNOWN;
    }

    public static ReasoningException toException(Throwable failure) {
        if (failure instanceof ReasoningException known) {
            return known;
        }
        String detail = failure.getClass().getSimpleName();
        return switch (classify(failure)) {
            case RATE_LIMITED -> new RateLimitedException("Reasoning service rate limit reached, try again shortly", failure);
            case UNAUTHORIZED -> new UnauthorizedException("Reasoning service rejected the credentials", failure);
            case UNKNOWN -> new ReasoningFailedException("Reasoning service call failed (" + detail + ")", failure);
        };
    }

    private static List<Throwable> causeChain(Throwable failure) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = failure;
        while (current != null && chain.size() < MAX_DEPTH) {
            chain.add(current);
            Throwable next = current.getCause();
            if (next == current) break;
            current = next;
        }
        return chain;
    }
}
