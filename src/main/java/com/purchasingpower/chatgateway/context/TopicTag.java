package com.purchasingpower.chatgateway.context;

import java.util.regex.Pattern;

/**
 * Subject areas recognised in user messages, each with its keyword class.
 */
public enum TopicTag {
    MATHEMATICS("mathematics", "\\b(?:math|maths|calculus|algebra|geometry|trigonometry|statistics)\\b"),
    SCIENCE("science", "\\b(?:physics|chemistry|biology|science|lab|experiment)\\b"),
    PROGRAMMING("programming", "\\b(?:code|coding|programming|javascript|python|java|react|api|database|algorithm)\\b"),
    WRITING("writing", "\\b(?:write|writing|essay|grammar|literature|english|composition)\\b"),
    SOCIAL_STUDIES("social studies", "\\b(?:history|geography|social|politics|economics|culture)\\b"),
    CREATIVE_ARTS("creative arts", "\\b(?:art|design|creative|music|visual|aesthetic)\\b");

    private final String displayName;
    private final Pattern keywords;

    TopicTag(String displayName, String keywordRegex) {
        this.displayName = displayName;
        this.keywords = Pattern.compile(keywordRegex, Pattern.CASE_INSENSITIVE);
    }

    public String getDisplayName() {
        return displayName;
    }

    boolean mentionedIn(String text) {
        return keywords.matcher(text).find();
    }
}
