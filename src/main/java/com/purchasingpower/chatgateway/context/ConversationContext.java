package com.purchasingpower.chatgateway.context;

import java.util.EnumSet;
import java.util.Set;

/**
 * Read-only view derived from the trailing window of a conversation. Never persisted.
 *
 * @param topics         detected subject areas, iterated in {@link TopicTag} declaration order
 * @param emotionalTone  strongest tone cue found
 * @param knowledgeLevel inferred level, {@code INTERMEDIATE} when inconclusive
 * @param intent         intent of the most recent user message
 * @param followUp       true when the window holds more than one user turn
 */
public record ConversationContext(
        Set<TopicTag> topics,
        EmotionalTone emotionalTone,
        KnowledgeLevel knowledgeLevel,
        ConversationIntent intent,
        boolean followUp
) {

    public ConversationContext {
        EnumSet<TopicTag> copy = EnumSet.noneOf(TopicTag.class);
        if (topics != null) {
            copy.addAll(topics);
        }
        topics = Set.copyOf(copy);
        emotionalTone = emotionalTone != null ? emotionalTone : EmotionalTone.NEUTRAL;
        knowledgeLevel = knowledgeLevel != null ? knowledgeLevel : KnowledgeLevel.INTERMEDIATE;
        intent = intent != null ? intent : ConversationIntent.OTHER;
    }

    public static ConversationContext neutral() {
        return new ConversationContext(Set.of(), EmotionalTone.NEUTRAL, KnowledgeLevel.INTERMEDIATE,
                ConversationIntent.OTHER, false);
    }

    /**
     * Topic display names in declaration order, for example {@code "mathematics, programming"}.
     */
    public String topicList() {
        StringBuilder sb = new StringBuilder();
        for (TopicTag tag : TopicTag.values()) {
            if (topics.contains(tag)) {
                if (sb.length() > 0) {
                    sb.append(", ");
                }
                sb.append(tag.getDisplayName());
            }
        }
        return sb.toString();
    }

    public boolean hasTopics() {
        return !topics.isEmpty();
    }
}
