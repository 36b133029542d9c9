package com.purchasingpower.chatgateway.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Connection and default generation settings for one completion backend.
 */
@Data
public class ProviderProperties {

    /**
     * Backend credential. Blank, or a value starting with "placeholder", marks the
     * backend as unavailable for the lifetime of the process.
     */
    private String apiKey;

    @NotBlank
    private String baseUrl;

    @NotBlank
    private String defaultModel;

    /**
     * Models a caller may request explicitly. Anything else falls back to the default model.
     */
    private List<String> allowedModels = new ArrayList<>();

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double defaultTemperature = 0.7;

    @Min(1)
    private int defaultMaxTokens = 1024;

    @NotNull
    private Duration timeout = Duration.ofSeconds(15);

    /**
     * Nucleus sampling, only sent by backends that accept it.
     */
    private Double topP;

    private List<String> stopSequences = new ArrayList<>();

    public boolean isConfigured() {
        return apiKey != null
                && !apiKey.isBlank()
                && !apiKey.trim().toLowerCase(Locale.ROOT).startsWith("placeholder");
    }

    public String resolveModel(String requestedModel) {
        if (requestedModel != null && allowedModels.contains(requestedModel)) {
            return requestedModel;
        }
        return defaultModel;
    }
}
