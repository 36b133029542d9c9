package com.purchasingpower.chatgateway.moderation;

/**
 * Result of classifying one user message.
 *
 * @param allowed     whether the text may proceed to the providers
 * @param category    blocking category, null when allowed
 * @param cannedReply reply to return instead of a completion, null when allowed
 * @param ruleId      id of the deciding rule (block or bypass), null for a plain allow
 * @param bypassed    true when the quiz/assessment bypass rule decided the verdict
 */
public record ModerationVerdict(
        boolean allowed,
        ModerationCategory category,
        String cannedReply,
        String ruleId,
        boolean bypassed
) {

    private static final ModerationVerdict ALLOW = new ModerationVerdict(true, null, null, null, false);

    public static ModerationVerdict allow() {
        return ALLOW;
    }

    public static ModerationVerdict bypass(String ruleId) {
        return new ModerationVerdict(true, null, null, ruleId, true);
    }

    public static ModerationVerdict block(ModerationCategory category, String cannedReply, String ruleId) {
        return new ModerationVerdict(false, category, cannedReply, ruleId, false);
    }

    public boolean blocked() {
        return !allowed;
    }
}
