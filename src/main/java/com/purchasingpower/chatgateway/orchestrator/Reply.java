package com.purchasingpower.chatgateway.orchestrator;

import com.purchasingpower.chatgateway.moderation.ModerationCategory;
import com.purchasingpower.chatgateway.model.ProviderResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Terminal result of one orchestration run.
 */
@Value
@Builder
public class Reply {

    String visibleText;

    /** Reasoning split off the provider text, or null. */
    String reasoningText;

    SourceLabel sourceLabel;

    /** Model that produced the text; null for fallback and moderation replies. */
    String model;

    /** Set only when {@link #sourceLabel} is moderation. */
    ModerationCategory moderationCategory;

    @Singular
    List<ProviderResult> attempts;

    public boolean isFromProvider() {
        return sourceLabel.kind() == SourceLabel.Kind.PROVIDER;
    }
}
