package com.purchasingpower.chatgateway.configuration;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class HealthProperties {

    private boolean probeEnabled = false;

    @NotNull
    private Duration probeInterval = Duration.ofMinutes(5);
}
