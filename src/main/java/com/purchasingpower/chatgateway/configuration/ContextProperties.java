package com.purchasingpower.chatgateway.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ContextProperties {

    /**
     * Number of trailing messages inspected when inferring conversation context.
     */
    @Min(1)
    private int windowSize = 6;
}
