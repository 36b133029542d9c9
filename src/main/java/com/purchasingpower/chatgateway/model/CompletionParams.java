package com.purchasingpower.chatgateway.model;

import lombok.Builder;
import lombok.Value;

/**
 * Caller-supplied generation parameters. Every field is optional; an adapter
 * substitutes its own configured default for anything left null.
 */
@Value
@Builder(toBuilder = true)
public class CompletionParams {

    String model;
    Double temperature;
    Integer maxTokens;

    public static CompletionParams defaults() {
        return CompletionParams.builder().build();
    }

    public double temperatureOr(double fallback) {
        return temperature != null ? temperature : fallback;
    }

    public int maxTokensOr(int fallback) {
        return maxTokens != null ? maxTokens : fallback;
    }
}
