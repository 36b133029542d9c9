package com.purchasingpower.chatgateway.moderation;

/**
 * What a matching {@link ModerationRule} does to the verdict.
 */
public enum RuleEffect {
    /** Blocks the text under the rule's category unless an ALLOW rule overrides it. */
    BLOCK,
    /** Cancels BLOCK matches for the categories listed in {@code overrides}. */
    ALLOW,
    /** Skips every category. Evaluated before anything else. */
    BYPASS
}
