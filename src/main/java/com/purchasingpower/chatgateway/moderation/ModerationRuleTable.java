package com.purchasingpower.chatgateway.moderation;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Immutable, declarative moderation rules plus one canned reply per category.
 *
 * <p>The table is loaded once at startup (see {@code moderation-rules.json}).
 * Each rule carries either a list of whole-word {@code terms}, a list of regular
 * expression {@code patterns}, or both; they are compiled into a single
 * case-insensitive pattern. Adding a category or an exception is a data change.
 */
@Slf4j
public final class ModerationRuleTable {

    private final String version;
    private final List<ModerationRule> rules;
    private final Map<ModerationCategory, String> cannedReplies;

    public ModerationRuleTable(String version, List<ModerationRule> rules, Map<ModerationCategory, String> cannedReplies) {
        this.version = version;
        this.rules = List.copyOf(rules);
        EnumMap<ModerationCategory, String> replies = new EnumMap<>(ModerationCategory.class);
        replies.putAll(cannedReplies);
        for (ModerationRule rule : this.rules) {
            if (rule.effect() == RuleEffect.BLOCK && !replies.containsKey(rule.category())) {
                throw new IllegalStateException("No canned reply configured for category " + rule.category());
            }
        }
        this.cannedReplies = Collections.unmodifiableMap(replies);
    }

    public static ModerationRuleTable load(InputStream in, ObjectMapper objectMapper) {
        try {
            TableDefinition definition = objectMapper.readValue(in, TableDefinition.class);
            List<ModerationRule> compiled = new ArrayList<>();
            for (RuleDefinition rule : definition.getRules()) {
                compiled.add(rule.compile());
            }
            ModerationRuleTable table = new ModerationRuleTable(definition.getVersion(), compiled, definition.getCannedReplies());
            log.info("Loaded moderation rules v{}: {} rules, categories={}",
                    table.version, compiled.size(), table.cannedReplies.keySet());
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read moderation rule table", e);
        }
    }

    public String getVersion() {
        return version;
    }

    public List<ModerationRule> getRules() {
        return rules;
    }

    public List<ModerationRule> rulesWithEffect(RuleEffect effect) {
        return rules.stream().filter(r -> r.effect() == effect).toList();
    }

    public String cannedReplyFor(ModerationCategory category) {
        return cannedReplies.get(category);
    }

    @Data
    static class TableDefinition {
        private String version;
        private List<RuleDefinition> rules = new ArrayList<>();
        private Map<ModerationCategory, String> cannedReplies = new EnumMap<>(ModerationCategory.class);
    }

    @Data
    static class RuleDefinition {
        private String id;
        private RuleEffect effect;
        private ModerationCategory category;
        private int priority;
        private List<String> terms = new ArrayList<>();
        private List<String> patterns = new ArrayList<>();
        private Set<ModerationCategory> overrides = EnumSet.noneOf(ModerationCategory.class);

        ModerationRule compile() {
            List<String> alternatives = new ArrayList<>();
            if (!terms.isEmpty()) {
                alternatives.add("\\b(?:" + terms.stream()
                        .map(ModerationRuleTable::termPattern)
                        .collect(Collectors.joining("|")) + ")\\b");
            }
            alternatives.addAll(patterns);
            if (alternatives.isEmpty()) {
                throw new IllegalStateException("Moderation rule '" + id + "' has neither terms nor patterns");
            }
            Pattern pattern = Pattern.compile(String.join("|", alternatives),
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            return new ModerationRule(id, effect, category, priority, pattern, overrides);
        }
    }

    /**
     * Quotes a term and lets any run of spaces inside it match flexible whitespace.
     */
    private static String termPattern(String term) {
        String[] words = term.trim().split("\\s+");
        List<String> quoted = new ArrayList<>(words.length);
        for (String word : words) {
            quoted.add(Pattern.quote(word));
        }
        return String.join("\\s+", quoted);
    }
}
