package com.purchasingpower.chatgateway.postprocess;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes completion text before it reaches the caller.
 *
 * <ul>
 *   <li>Reasoning blocks ({@code <think>}, {@code <thinking>}, {@code [thinking]}) are moved
 *       out of the answer into {@link ProcessedResponse#reasoningText()}. An unclosed opening
 *       tag swallows the rest of the text; a closing tag without an opener ends a leading block.</li>
 *   <li>Markup outside fenced code blocks is normalized: {@code #Heading} gets a space, bullets
 *       become {@code "- "}, top-level ordered lists are renumbered from 1, runs of three or more
 *       asterisks glued to text become bold markers, trailing whitespace and repeated blank
 *       lines are removed.</li>
 * </ul>
 *
 * <p>Idempotent: processing the visible text of a result again returns the same text.
 */
@Slf4j
public class ResponsePostProcessor {

    private static final List<Pattern> REASONING_BLOCKS = List.of(
            Pattern.compile("<think>(.*?)</think>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE),
            Pattern.compile("<thinking>(.*?)</thinking>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[thinking](.*?)\\[/thinking]", Pattern.DOTALL | Pattern.CASE_INSENSITIVE));
    private static final Pattern UNCLOSED_OPENER = Pattern.compile(
            "<think(?:ing)?>|\\[thinking]", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORPHAN_CLOSER = Pattern.compile(
            "</think(?:ing)?>|\\[/thinking]", Pattern.CASE_INSENSITIVE);

    private static final Pattern FENCE = Pattern.compile("^(\\s*)`{3,}(.*)$");
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})(?=[^#\\s])");
    private static final Pattern BULLET = Pattern.compile("^(\\s*)[•*+\\-]\\s+");
    private static final Pattern ORDERED_ITEM = Pattern.compile("^(\\d+)[.)]\\s+");
    private static final Pattern STRAY_EMPHASIS = Pattern.compile("\\*{3,}(?=[^*\\s])|(?<=[^*\\s])\\*{3,}");

    public ProcessedResponse process(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return new ProcessedResponse("", null);
        }
        List<String> reasoning = new ArrayList<>();
        String answer = extractReasoning(rawText, reasoning);
        String visible = normalizeMarkup(answer);
        String reasoningText = reasoning.isEmpty() ? null : String.join("\n\n", reasoning);
        if (reasoningText != null) {
            log.debug("Split {} chars of reasoning from the answer", reasoningText.length());
        }
        return new ProcessedResponse(visible, reasoningText);
    }

    /**
     * Re-processes an already processed fragment, keeping its reasoning segment.
     */
    public ProcessedResponse process(ProcessedResponse fragment) {
        ProcessedResponse again = process(fragment.visibleText());
        if (!fragment.hasReasoning()) {
            return again;
        }
        String reasoning = again.hasReasoning()
                ? fragment.reasoningText() + "\n\n" + again.reasoningText()
                : fragment.reasoningText();
        return new ProcessedResponse(again.visibleText(), reasoning);
    }

    private String extractReasoning(String text, List<String> reasoning) {
        String remaining = text;
        for (Pattern block : REASONING_BLOCKS) {
            Matcher m = block.matcher(remaining);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                addReasoning(reasoning, m.group(1));
                m.appendReplacement(sb, "");
            }
            m.appendTail(sb);
            remaining = sb.toString();
        }

        Matcher closer = ORPHAN_CLOSER.matcher(remaining);
        if (closer.find()) {
            addReasoning(reasoning, remaining.substring(0, closer.start()));
            remaining = remaining.substring(closer.end());
        }

        Matcher opener = UNCLOSED_OPENER.matcher(remaining);
        if (opener.find()) {
            addReasoning(reasoning, remaining.substring(opener.end()));
            remaining = remaining.substring(0, opener.start());
        }
        return remaining;
    }

    private static void addReasoning(List<String> reasoning, String segment) {
        if (segment != null && !segment.isBlank()) {
            reasoning.add(segment.trim());
        }
    }

    private String normalizeMarkup(String text) {
        String[] lines = text.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        List<String> out = new ArrayList<>(lines.length);
        boolean inFence = false;
        boolean inOrderedList = false;
        int counter = 0;

        for (String raw : lines) {
            Matcher fence = FENCE.matcher(raw);
            if (fence.matches()) {
                out.add(fence.group(1) + "```" + fence.group(2).stripTrailing());
                inFence = !inFence;
                inOrderedList = false;
                continue;
            }
            if (inFence) {
                out.add(raw);
                continue;
            }

            String line = raw.stripTrailing();
            if (line.isEmpty()) {
                if (!out.isEmpty() && !out.get(out.size() - 1).isEmpty()) {
                    out.add("");
                }
                continue;
            }

            line = HEADING.matcher(line).replaceFirst("$1 ");
            line = STRAY_EMPHASIS.matcher(line).replaceAll("**");

            Matcher ordered = ORDERED_ITEM.matcher(line);
            if (ordered.find()) {
                counter = inOrderedList ? counter + 1 : 1;
                inOrderedList = true;
                line = counter + ". " + line.substring(ordered.end());
            } else {
                line = BULLET.matcher(line).replaceFirst("$1- ");
                if (!Character.isWhitespace(raw.charAt(0)) && !line.startsWith("- ")) {
                    inOrderedList = false;
                }
            }
            out.add(line);
        }

        while (!out.isEmpty() && out.get(0).isEmpty()) {
            out.remove(0);
        }
        while (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) {
            out.remove(out.size() - 1);
        }
        return String.join("\n", out);
    }
}
