package com.purchasingpower.chatgateway.fallback;

/**
 * Groups of fallback templates. The first four are chosen by emotional tone,
 * the rest by intent and topics when the tone is neutral.
 */
public enum ResponseFamily {
    SUPPORTIVE,
    EXPLORATORY,
    CLARIFYING,
    ADVANCED,
    GREETING,
    ACKNOWLEDGMENT,
    SUBJECT,
    STUDY_HELP,
    GENERAL
}
