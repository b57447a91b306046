package com.changelab.mentor.strategy;

public record SamplingParams(String model, double temperature, int maxTokens) {
    public static SamplingParams of(double temperature, int maxTokens) {
        return new SamplingParams(null, temperature, maxTokens);
    }
}
