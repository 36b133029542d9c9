package com.purchasingpower.chatgateway.model;

import java.time.Duration;

/**
 * Outcome of one provider attempt. Kept only for the lifetime of a request.
 */
public record ProviderResult(
        String providerName,
        boolean success,
        String text,
        ErrorKind error,
        String errorMessage,
        Duration latency
) {

    public static ProviderResult success(String providerName, String text, Duration latency) {
        return new ProviderResult(providerName, true, text, null, null, latency);
    }

    public static ProviderResult failure(String providerName, ErrorKind error, String errorMessage, Duration latency) {
        return new ProviderResult(providerName, false, null, error, errorMessage, latency);
    }

    public ProviderResult withProviderName(String name) {
        return new ProviderResult(name, success, text, error, errorMessage, latency);
    }
}
