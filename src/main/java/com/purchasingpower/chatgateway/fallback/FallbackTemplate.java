package com.purchasingpower.chatgateway.fallback;

/**
 * One row of the fallback template table.
 *
 * <p>Placeholders: {@code {topics}} (comma separated topic names) and
 * {@code {levelIntro}} (a knowledge-level dependent lead-in).
 *
 * @param responseType family the template belongs to
 * @param topicSlot    true when the text uses {@code {topics}} and needs at least one topic
 * @param followUp     null for any turn, true for follow-up turns only, false for first turns only
 * @param text         template text
 */
public record FallbackTemplate(
        ResponseFamily responseType,
        boolean topicSlot,
        Boolean followUp,
        String text
) {

    public static final String TOPICS_PLACEHOLDER = "{topics}";
    public static final String LEVEL_PLACEHOLDER = "{levelIntro}";

    public FallbackTemplate {
        if (responseType == null) {
            throw new IllegalArgumentException("responseType is required");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Template text must not be blank (" + responseType + ")");
        }
        if (topicSlot != text.contains(TOPICS_PLACEHOLDER)) {
            throw new IllegalArgumentException("topicSlot must be set exactly when the text uses "
                    + TOPICS_PLACEHOLDER + ": " + text);
        }
    }

    /**
     * Usable for any conversation, whatever its topics or turn count.
     */
    public boolean isGeneric() {
        return !topicSlot && followUp == null;
    }

    boolean suitsTurn(boolean isFollowUp) {
        return followUp == null || followUp == isFollowUp;
    }
}
