package com.purchasingpower.chatgateway.orchestrator;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which path produced a reply: {@code provider-N} (1-based chain position),
 * {@code fallback} or {@code moderation}.
 */
public record SourceLabel(Kind kind, int providerPosition) {

    public enum Kind { PROVIDER, FALLBACK, MODERATION }

    public static final SourceLabel FALLBACK = new SourceLabel(Kind.FALLBACK, 0);
    public static final SourceLabel MODERATION = new SourceLabel(Kind.MODERATION, 0);

    public SourceLabel {
        if (kind == Kind.PROVIDER && providerPosition < 1) {
            throw new IllegalArgumentException("Provider position is 1-based: " + providerPosition);
        }
    }

    public static SourceLabel provider(int position) {
        return new SourceLabel(Kind.PROVIDER, position);
    }

    @JsonValue
    public String label() {
        return switch (kind) {
            case PROVIDER -> "provider-" + providerPosition;
            case FALLBACK -> "fallback";
            case MODERATION -> "moderation";
        };
    }

    @Override
    public String toString() {
        return label();
    }
}
