package com.purchasingpower.chatgateway.client;

import com.purchasingpower.chatgateway.model.ChatMessage;
import com.purchasingpower.chatgateway.model.CompletionParams;
import com.purchasingpower.chatgateway.model.ProviderResult;

import java.util.List;

/**
 * Uniform completion capability over one remote backend (Groq, HuggingFace, etc.).
 *
 * Implementations shape the payload for their backend, bound each call with
 * their own timeout and report backend failures as a failed {@link ProviderResult}
 * carrying an {@link com.purchasingpower.chatgateway.model.ErrorKind}. They hold no
 * mutable state shared with other providers.
 */
public interface LLMProvider {

    /**
     * Turn a conversation into completion text.
     *
     * @param messages conversation, oldest first
     * @param params   optional model, temperature and token budget
     * @return the completion, or a failure; never null and never thrown for backend errors
     */
    ProviderResult complete(List<ChatMessage> messages, CompletionParams params);

    /**
     * Provider id (for logging, ordering and health reporting).
     */
    String getProviderName();

    /**
     * False when no credential is configured. Decided once, at construction.
     */
    boolean isConfigured();

    /**
     * Model that a call with the given requested model would use.
     */
    String resolveModel(String requestedModel);
}
