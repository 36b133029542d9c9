package com.purchasingpower.chatgateway.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class FallbackProperties {

    /**
     * When false, an exhausted provider chain is reported as 503 instead of a templated reply.
     */
    private boolean enabled = true;

    /**
     * Seed for template selection. Unset means a fresh random source per process.
     */
    private Long seed;

    @NotBlank
    private String templatesLocation = "classpath:fallback-templates.json";
}
