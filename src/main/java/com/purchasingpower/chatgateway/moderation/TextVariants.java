package com.purchasingpower.chatgateway.moderation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalized spellings of a text that blocking rules are matched against, so
 * that "s e x", "s3x" and "seeeex" are caught the same way as "sex".
 */
final class TextVariants {

    private static final Pattern SPACED_LETTERS = Pattern.compile("\\b(?:\\p{L} ){2,}\\p{L}\\b");
    private static final Pattern STRETCHED_LETTERS = Pattern.compile("(\\p{L})\\1{2,}");

    private TextVariants() {
    }

    static String lowercase(String text) {
        return text.toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Lowercased text first, then the de-leeted, letter-joined and de-stretched
     * spellings. Duplicates are dropped.
     */
    static List<String> of(String text) {
        String lower = lowercase(text);
        Set<String> variants = new LinkedHashSet<>();
        variants.add(lower);
        String unleeted = unleet(lower);
        variants.add(unleeted);
        variants.add(joinSpacedLetters(unleeted));
        variants.add(STRETCHED_LETTERS.matcher(unleeted).replaceAll("$1"));
        return List.copyOf(variants);
    }

    static String unleet(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            sb.append(switch (c) {
                case '1' -> 'i';
                case '0' -> 'o';
                case '3' -> 'e';
                case '4', '@' -> 'a';
                case '$' -> 's';
                default -> c;
            });
        }
        return sb.toString();
    }

    static String joinSpacedLetters(String text) {
        Matcher m = SPACED_LETTERS.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(m.group().replace(" ", "")));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
