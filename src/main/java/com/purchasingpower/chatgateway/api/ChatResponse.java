package com.purchasingpower.chatgateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.chatgateway.model.ChatMessage;
import com.purchasingpower.chatgateway.model.MessageRole;
import com.purchasingpower.chatgateway.orchestrator.Reply;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response from the chat completions endpoint. The shape is the same whether the
 * text came from a provider, the fallback generator or moderation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatResponse {

    private boolean success;

    @Builder.Default
    private List<Choice> choices = new ArrayList<>();

    private String model;
    private String source;
    private String reasoning;
    private Usage usage;
    private String error;

    public static ChatResponse from(Reply reply, List<ChatMessage> messages) {
        return ChatResponse.builder()
                .success(true)
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(new AssistantMessage(MessageRole.ASSISTANT.getWireName(), reply.getVisibleText()))
                        .finishReason(reply.isFromProvider() ? "stop" : reply.getSourceLabel().label())
                        .build()))
                .model(reply.getModel())
                .source(reply.getSourceLabel().label())
                .reasoning(reply.getReasoningText())
                .usage(Usage.estimate(messages, reply.getVisibleText()))
                .build();
    }

    public static ChatResponse error(String error) {
        return ChatResponse.builder()
            .success(false)
            .error(error)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Choice {
        private int index;
        private AssistantMessage message;

        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AssistantMessage {
        private String role;
        private String content;
    }

    /**
     * Rough token counts, estimated at four characters per token.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Usage {

        @JsonProperty("prompt_tokens")
        private int promptTokens;

        @JsonProperty("completion_tokens")
        private int completionTokens;

        @JsonProperty("total_tokens")
        private int totalTokens;

        static Usage estimate(List<ChatMessage> messages, String completion) {
            int promptChars = messages.stream().mapToInt(m -> m.fullText().length()).sum();
            int prompt = estimateTokens(promptChars);
            int completionTokens = estimateTokens(completion != null ? completion.length() : 0);
            return new Usage(prompt, completionTokens, prompt + completionTokens);
        }

        private static int estimateTokens(int chars) {
            return (chars + 3) / 4;
        }
    }
}
