package com.purchasingpower.chatgateway.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ModerationProperties {

    @NotBlank
    private String rulesLocation = "classpath:moderation-rules.json";
}
