package com.purchasingpower.chatgateway.context;

/**
 * What the latest user message is trying to do.
 */
public enum ConversationIntent {
    GREETING,
    HELP_REQUEST,
    CLARIFICATION,
    ACKNOWLEDGMENT,
    OTHER
}
