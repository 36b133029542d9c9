package com.purchasingpower.chatgateway.context;

import java.util.regex.Pattern;

/**
 * Tone inferred from phrase cues. Declaration order is the override order:
 * a frustration cue anywhere in the window beats a curiosity cue, and so on.
 * {@link #NEUTRAL} has no cue and is the default.
 */
public enum EmotionalTone {
    FRUSTRATED("\\b(?:frustrated|frustrating|stuck|confused|don'?t understand|help)\\b"),
    CURIOUS("\\b(?:interesting|curious|wonder|explore|learn more)\\b"),
    CONFUSED("\\b(?:unclear|confusing|not sure|don'?t get)\\b"),
    CONFIDENT("\\b(?:understand|got it|makes sense|clear now)\\b"),
    NEUTRAL(null);

    private final Pattern cue;

    EmotionalTone(String cueRegex) {
        this.cue = cueRegex != null ? Pattern.compile(cueRegex, Pattern.CASE_INSENSITIVE) : null;
    }

    boolean cuedBy(String text) {
        return cue != null && cue.matcher(text).find();
    }
}
