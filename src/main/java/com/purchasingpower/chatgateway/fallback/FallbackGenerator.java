package com.purchasingpower.chatgateway.fallback;

import com.purchasingpower.chatgateway.context.ConversationContext;
import com.purchasingpower.chatgateway.context.ConversationIntent;
import com.purchasingpower.chatgateway.context.KnowledgeLevel;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Builds a templated reply from a {@link ConversationContext} when no provider answered.
 *
 * <p>The family is chosen from the emotional tone first; a neutral tone falls through to
 * the intent, then to the detected topics. Inside the family, topic-slot templates are
 * preferred when topics were detected, and the {@link TemplateSelector} picks among the
 * candidates. The result is never blank.
 */
@Slf4j
public class FallbackGenerator {

    /** Used only if the catalog somehow yields nothing usable. */
    public static final String LAST_RESORT_REPLY =
            "I'm here to support your learning journey! What specific topic, subject, or question would you like to explore together?";

    private final FallbackTemplateCatalog catalog;
    private final TemplateSelector selector;

    public FallbackGenerator(FallbackTemplateCatalog catalog, TemplateSelector selector) {
        this.catalog = catalog;
        this.selector = selector;
    }

    public String generate(ConversationContext context) {
        ConversationContext ctx = context != null ? context : ConversationContext.neutral();
        ResponseFamily family = familyFor(ctx);
        FallbackTemplate template = pick(family, ctx);
        if (template == null && family != ResponseFamily.GENERAL) {
            template = pick(ResponseFamily.GENERAL, ctx);
        }
        if (template == null) {
            return LAST_RESORT_REPLY;
        }
        String text = render(template, ctx);
        log.debug("Fallback reply from family {} (topics={}, followUp={})", family, ctx.topics(), ctx.followUp());
        return text.isBlank() ? LAST_RESORT_REPLY : text;
    }

    public ResponseFamily familyFor(ConversationContext ctx) {
        switch (ctx.emotionalTone()) {
            case FRUSTRATED:
                return ResponseFamily.SUPPORTIVE;
            case CURIOUS:
                return ResponseFamily.EXPLORATORY;
            case CONFUSED:
                return ResponseFamily.CLARIFYING;
            case CONFIDENT:
                return ResponseFamily.ADVANCED;
            default:
                break;
        }
        switch (ctx.intent()) {
            case GREETING:
                return ResponseFamily.GREETING;
            case CLARIFICATION:
                return ResponseFamily.CLARIFYING;
            case ACKNOWLEDGMENT:
                return ResponseFamily.ACKNOWLEDGMENT;
            default:
                break;
        }
        if (ctx.hasTopics()) {
            return ResponseFamily.SUBJECT;
        }
        if (ctx.intent() == ConversationIntent.HELP_REQUEST) {
            return ResponseFamily.STUDY_HELP;
        }
        return ResponseFamily.GENERAL;
    }

    private FallbackTemplate pick(ResponseFamily family, ConversationContext ctx) {
        List<FallbackTemplate> members = catalog.templatesFor(family);
        if (members == null || members.isEmpty()) {
            return null;
        }
        List<FallbackTemplate> candidates = List.of();
        if (ctx.hasTopics()) {
            candidates = members.stream()
                    .filter(FallbackTemplate::topicSlot)
                    .filter(t -> t.suitsTurn(ctx.followUp()))
                    .toList();
        }
        if (candidates.isEmpty()) {
            candidates = members.stream()
                    .filter(t -> !t.topicSlot())
                    .filter(t -> t.suitsTurn(ctx.followUp()))
                    .toList();
        }
        if (candidates.isEmpty()) {
            candidates = members.stream().filter(FallbackTemplate::isGeneric).toList();
        }
        if (candidates.isEmpty()) {
            return null;
        }
        int index = Math.floorMod(selector.select(candidates.size()), candidates.size());
        return candidates.get(index);
    }

    private static String render(FallbackTemplate template, ConversationContext ctx) {
        return template.text()
                .replace(FallbackTemplate.TOPICS_PLACEHOLDER, ctx.topicList())
                .replace(FallbackTemplate.LEVEL_PLACEHOLDER, levelIntro(ctx.knowledgeLevel()))
                .trim();
    }

    static String levelIntro(KnowledgeLevel level) {
        return switch (level) {
            case BEGINNER -> "Let's build on the basics";
            case ADVANCED -> "Given your strong grasp of the concepts";
            default -> "Based on your growing understanding";
        };
    }
}
