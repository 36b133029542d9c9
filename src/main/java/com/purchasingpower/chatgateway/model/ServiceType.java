package com.purchasingpower.chatgateway.model;

/**
 * External completion backends, used by ExternalCallLogger for consistent
 * log prefixes.
 *
 * @see com.purchasingpower.chatgateway.util.ExternalCallLogger
 */
public enum ServiceType {
    GROQ("🟠", "Groq"),
    HUGGINGFACE("🟡", "HuggingFace");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
