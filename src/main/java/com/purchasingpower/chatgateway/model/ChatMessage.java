package com.purchasingpower.chatgateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.StringJoiner;

/**
 * One role-tagged message of a conversation.
 *
 * <p>{@code content} is either a plain string or an array of content parts
 * ({@code {"type":"text","text":...}}, {@code {"type":"image_url",...}}).
 * Moderation and adapters that only understand text use {@link #fullText()}.
 */
@Value
@Builder
@Jacksonized
public class ChatMessage {

    MessageRole role;
    JsonNode content;

    public static ChatMessage user(String text) {
        return of(MessageRole.USER, text);
    }

    public static ChatMessage assistant(String text) {
        return of(MessageRole.ASSISTANT, text);
    }

    public static ChatMessage system(String text) {
        return of(MessageRole.SYSTEM, text);
    }

    public static ChatMessage of(MessageRole role, String text) {
        return ChatMessage.builder()
                .role(role)
                .content(TextNode.valueOf(text != null ? text : ""))
                .build();
    }

    /**
     * Plain-text view of the content: the string itself, or the first text part
     * of a structured content array. Never null.
     */
    public String textView() {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            for (JsonNode part : content) {
                if ("text".equals(part.path("type").asText()) && part.hasNonNull("text")) {
                    return part.path("text").asText();
                }
            }
            return "";
        }
        return content.toString();
    }

    /**
     * Every text part of the content, joined by newlines. For plain string content
     * this is the string itself. Never null.
     */
    public String fullText() {
        if (content == null || !content.isArray()) {
            return textView();
        }
        StringJoiner text = new StringJoiner("\n");
        for (JsonNode part : content) {
            if ("text".equals(part.path("type").asText()) && part.hasNonNull("text")) {
                text.add(part.path("text").asText());
            }
        }
        return text.toString();
    }

    /**
     * True when the content carries a non-text part (an image, for example).
     */
    @JsonIgnore
    public boolean isMultimodal() {
        if (content == null || !content.isArray()) {
            return false;
        }
        for (JsonNode part : content) {
            if (!"text".equals(part.path("type").asText("text"))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Copy of this message with the content reduced to its text parts.
     */
    public ChatMessage toTextOnly() {
        return of(role, fullText());
    }

    @JsonIgnore
    public boolean isFromUser() {
        return role == MessageRole.USER;
    }
}
