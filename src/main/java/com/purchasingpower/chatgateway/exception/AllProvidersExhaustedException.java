package com.purchasingpower.chatgateway.exception;

import com.purchasingpower.chatgateway.model.ProviderResult;
import lombok.Getter;

import java.util.List;

@Getter
public class AllProvidersExhaustedException extends RuntimeException {

    public static final String DEFAULT_MESSAGE = "All AI services are currently unavailable";

    private final List<ProviderResult> attempts;

    public AllProvidersExhaustedException(List<ProviderResult> attempts) {
        super(DEFAULT_MESSAGE);
        this.attempts = List.copyOf(attempts);
    }
}
