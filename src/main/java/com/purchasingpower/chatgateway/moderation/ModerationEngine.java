package com.purchasingpower.chatgateway.moderation;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies user text against the {@link ModerationRuleTable}.
 *
 * <p>Evaluation order:
 * <ol>
 *   <li>BYPASS rules (quiz/assessment generation) on the lowercased text: any match allows.</li>
 *   <li>ALLOW rules collect the categories they override.</li>
 *   <li>BLOCK rules whose category is not overridden are matched against every
 *       {@link TextVariants text variant}; the highest priority match decides, ties go
 *       to the rule listed first.</li>
 * </ol>
 *
 * <p>Fails open: blank input, or any unexpected error while matching, yields an allow.
 * The engine holds no mutable state and is safe to share between requests.
 */
@Slf4j
public class ModerationEngine {

    private final ModerationRuleTable table;
    private final List<ModerationRule> bypassRules;
    private final List<ModerationRule> allowRules;
    private final List<ModerationRule> blockRules;

    public ModerationEngine(ModerationRuleTable table) {
        this.table = table;
        this.bypassRules = table.rulesWithEffect(RuleEffect.BYPASS);
        this.allowRules = table.rulesWithEffect(RuleEffect.ALLOW);
        this.blockRules = table.rulesWithEffect(RuleEffect.BLOCK);
    }

    public ModerationVerdict classify(String text) {
        if (text == null || text.isBlank()) {
            return ModerationVerdict.allow();
        }
        try {
            return evaluate(text);
        } catch (RuntimeException e) {
            log.warn("Moderation failed open for input of {} chars", text.length(), e);
            return ModerationVerdict.allow();
        }
    }

    /**
     * True when the text is recognised as a quiz/assessment generation request.
     */
    public boolean isExempt(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = TextVariants.lowercase(text);
        return bypassRules.stream().anyMatch(rule -> rule.matches(lower));
    }

    private ModerationVerdict evaluate(String text) {
        String lower = TextVariants.lowercase(text);
        for (ModerationRule rule : bypassRules) {
            if (rule.matches(lower)) {
                log.debug("Moderation bypassed by rule '{}'", rule.id());
                return ModerationVerdict.bypass(rule.id());
            }
        }

        List<String> variants = TextVariants.of(text);

        Set<ModerationCategory> overridden = EnumSet.noneOf(ModerationCategory.class);
        for (ModerationRule rule : allowRules) {
            if (rule.matchesAny(variants)) {
                overridden.addAll(rule.overrides());
            }
        }

        ModerationRule winner = null;
        for (ModerationRule rule : blockRules) {
            if (overridden.contains(rule.category())) {
                continue;
            }
            if ((winner == null || rule.priority() > winner.priority()) && rule.matchesAny(variants)) {
                winner = rule;
            }
        }

        if (winner == null) {
            if (!overridden.isEmpty()) {
                log.debug("Moderation allow-rules overrode categories {}", overridden);
            }
            return ModerationVerdict.allow();
        }
        log.info("🛡️ Content blocked: category={}, rule={}", winner.category(), winner.id());
        return ModerationVerdict.block(winner.category(), table.cannedReplyFor(winner.category()), winner.id());
    }
}
