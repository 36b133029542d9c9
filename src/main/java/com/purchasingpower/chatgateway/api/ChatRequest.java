package com.purchasingpower.chatgateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.chatgateway.model.ChatMessage;
import com.purchasingpower.chatgateway.model.CompletionParams;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request for the chat completions endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    /**
     * Conversation, oldest first. Content is a string or an array of content parts.
     */
    private List<ChatMessage> messages;

    /**
     * Requested model. Honored only when the serving provider allows it.
     */
    private String model;

    /**
     * Sampling temperature, 0 to 2.
     */
    private Double temperature;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    public CompletionParams toParams() {
        return CompletionParams.builder()
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
    }
}
