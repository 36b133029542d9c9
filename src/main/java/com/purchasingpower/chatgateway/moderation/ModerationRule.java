package com.purchasingpower.chatgateway.moderation;

import java.util.Collection;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One compiled row of the moderation rule table.
 *
 * @param id        stable identifier, used in logs and verdicts
 * @param effect    what a match does
 * @param category  category blocked by a BLOCK rule, null otherwise
 * @param priority  higher wins among BLOCK matches
 * @param pattern   matcher applied with {@code find()}
 * @param overrides categories cancelled by an ALLOW rule
 */
public record ModerationRule(
        String id,
        RuleEffect effect,
        ModerationCategory category,
        int priority,
        Pattern pattern,
        Set<ModerationCategory> overrides
) {

    public ModerationRule {
        if (effect == RuleEffect.BLOCK && category == null) {
            throw new IllegalArgumentException("BLOCK rule '" + id + "' needs a category");
        }
        if (effect == RuleEffect.ALLOW && (overrides == null || overrides.isEmpty())) {
            throw new IllegalArgumentException("ALLOW rule '" + id + "' must override at least one category");
        }
        overrides = overrides == null ? Set.of() : Set.copyOf(overrides);
    }

    public boolean matchesAny(Collection<String> variants) {
        for (String variant : variants) {
            if (pattern.matcher(variant).find()) {
                return true;
            }
        }
        return false;
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}
