package com.purchasingpower.chatgateway.context;

import com.purchasingpower.chatgateway.model.ChatMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a {@link ConversationContext} from the trailing window of a conversation.
 *
 * <p>Only user-authored messages inside the window are inspected. Topic, tone and
 * knowledge level are aggregated over the whole window, so message order inside it
 * does not change the result. Intent is read from the most recent user message.
 * Deterministic and total: a null or empty history yields {@link ConversationContext#neutral()}.
 */
@Slf4j
public class ContextAnalyzer {

    public static final int DEFAULT_WINDOW_SIZE = 6;

    private static final Pattern ADVANCED_TERMS = Pattern.compile(
            "\\b(?:algorithm|implementation|optimization|abstraction|polymorphism|derivative|integral|synthesis|analysis|asymptotic|concurrency)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NOVICE_TERMS = Pattern.compile(
            "\\b(?:what is|how do|basic|basics|simple|beginner|start|first time|new to)\\b",
            Pattern.CASE_INSENSITIVE);

    /** Advanced-vocabulary hits needed before the level can be ADVANCED. */
    private static final int ADVANCED_THRESHOLD = 3;

    private static final Pattern GREETING = Pattern.compile(
            "^(?:hello|hi|hey|good\\s+(?:morning|afternoon|evening)|kumusta)[\\s\\p{Punct}]*$");
    private static final Pattern ACKNOWLEDGMENT = Pattern.compile(
            "^(?:thanks|thank you|thx|ok|okay|got it|makes sense|cool|great|perfect|i see|understood|alright)\\b");
    private static final Pattern CLARIFICATION = Pattern.compile(
            "\\b(?:what do you mean|unclear|confus\\w*|don'?t (?:get|understand)|clarify|not sure|rephrase|say that again)\\b");
    private static final Pattern HELP_REQUEST = Pattern.compile(
            "\\b(?:help|how (?:do|can|to|does)|can you|could you|explain|what is|what are|why (?:does|is)|stuck|show me)\\b");

    private final int windowSize;

    public ContextAnalyzer() {
        this(DEFAULT_WINDOW_SIZE);
    }

    public ContextAnalyzer(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive, was " + windowSize);
        }
        this.windowSize = windowSize;
    }

    public ConversationContext analyze(List<ChatMessage> history) {
        if (history == null || history.isEmpty()) {
            return ConversationContext.neutral();
        }

        List<ChatMessage> window = history.subList(Math.max(0, history.size() - windowSize), history.size());

        EnumSet<TopicTag> topics = EnumSet.noneOf(TopicTag.class);
        EnumSet<EmotionalTone> cues = EnumSet.noneOf(EmotionalTone.class);
        int advancedCount = 0;
        int noviceCount = 0;
        int userTurns = 0;
        String latestUserText = null;

        for (ChatMessage message : window) {
            if (message == null || !message.isFromUser()) {
                continue;
            }
            String text = message.textView();
            userTurns++;
            latestUserText = text;

            for (TopicTag tag : TopicTag.values()) {
                if (tag.mentionedIn(text)) {
                    topics.add(tag);
                }
            }
            for (EmotionalTone tone : EmotionalTone.values()) {
                if (tone.cuedBy(text)) {
                    cues.add(tone);
                }
            }
            advancedCount += count(ADVANCED_TERMS, text);
            noviceCount += count(NOVICE_TERMS, text);
        }

        ConversationContext context = new ConversationContext(
                topics,
                strongestTone(cues),
                knowledgeLevel(advancedCount, noviceCount),
                intentOf(latestUserText),
                userTurns > 1);

        log.debug("Context analysed over {} messages: topics={}, tone={}, level={}, intent={}",
                window.size(), context.topics(), context.emotionalTone(), context.knowledgeLevel(), context.intent());
        return context;
    }

    /**
     * Intent of a single message. Greeting needs the whole message to be a greeting.
     */
    public ConversationIntent intentOf(String text) {
        if (text == null || text.isBlank()) {
            return ConversationIntent.OTHER;
        }
        String lower = text.toLowerCase(Locale.ROOT).trim();
        if (GREETING.matcher(lower).matches()) {
            return ConversationIntent.GREETING;
        }
        if (!lower.contains("?") && ACKNOWLEDGMENT.matcher(lower).find()) {
            return ConversationIntent.ACKNOWLEDGMENT;
        }
        if (CLARIFICATION.matcher(lower).find()) {
            return ConversationIntent.CLARIFICATION;
        }
        if (HELP_REQUEST.matcher(lower).find()) {
            return ConversationIntent.HELP_REQUEST;
        }
        return ConversationIntent.OTHER;
    }

    private static EmotionalTone strongestTone(EnumSet<EmotionalTone> cues) {
        // EnumSet iterates in declaration order, which is the override order
        return cues.isEmpty() ? EmotionalTone.NEUTRAL : cues.iterator().next();
    }

    private static KnowledgeLevel knowledgeLevel(int advancedCount, int noviceCount) {
        if (advancedCount >= ADVANCED_THRESHOLD && advancedCount > noviceCount) {
            return KnowledgeLevel.ADVANCED;
        }
        if (noviceCount > 0 && noviceCount >= advancedCount) {
            return KnowledgeLevel.BEGINNER;
        }
        return KnowledgeLevel.INTERMEDIATE;
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    public int getWindowSize() {
        return windowSize;
    }
}
