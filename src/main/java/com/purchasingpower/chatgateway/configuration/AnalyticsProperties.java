package com.purchasingpower.chatgateway.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class AnalyticsProperties {

    private boolean enabled = true;

    @Min(1)
    private int corePoolSize = 2;

    @Min(1)
    private int maxPoolSize = 4;

    @Min(0)
    private int queueCapacity = 500;
}
