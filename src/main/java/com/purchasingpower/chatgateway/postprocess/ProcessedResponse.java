package com.purchasingpower.chatgateway.postprocess;

/**
 * Visible answer plus the reasoning segment split off from it, if any.
 *
 * @param visibleText   normalized user-facing text, never null
 * @param reasoningText internal reasoning extracted from the raw text, or null
 */
public record ProcessedResponse(String visibleText, String reasoningText) {

    public ProcessedResponse {
        visibleText = visibleText != null ? visibleText : "";
    }

    public boolean hasReasoning() {
        return reasoningText != null;
    }
}
