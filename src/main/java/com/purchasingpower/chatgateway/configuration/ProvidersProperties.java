package com.purchasingpower.chatgateway.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
public class ProvidersProperties {

    public static final String GROQ = "groq";
    public static final String HUGGINGFACE = "huggingface";
    public static final String GROQ_DEEPSEEK = "groq-deepseek";

    /**
     * Provider ids in the order they are attempted.
     */
    @NotEmpty
    private List<String> order = new ArrayList<>(List.of(GROQ, HUGGINGFACE, GROQ_DEEPSEEK));

    @NotNull
    private Duration attemptTimeout = Duration.ofSeconds(15);

    /**
     * Prepended when the conversation carries no system message of its own.
     */
    private String systemPrompt;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ProviderProperties groq = new ProviderProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ProviderProperties huggingface = new ProviderProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ProviderProperties groqDeepseek = new ProviderProperties();
}
