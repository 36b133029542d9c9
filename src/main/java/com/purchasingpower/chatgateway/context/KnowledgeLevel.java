package com.purchasingpower.chatgateway.context;

/**
 * Inferred familiarity of the user with the subject matter.
 */
public enum KnowledgeLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED
}
