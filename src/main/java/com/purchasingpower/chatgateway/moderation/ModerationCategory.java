package com.purchasingpower.chatgateway.moderation;

/**
 * Classes of disallowed content, each with its own canned reply.
 */
public enum ModerationCategory {
    SEXUAL,
    PROFANITY,
    EXPLICIT
}
