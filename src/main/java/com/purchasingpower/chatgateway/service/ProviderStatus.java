package com.purchasingpower.chatgateway.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.chatgateway.model.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Operator view of one provider in the chain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProviderStatus {

    private int position;
    private String provider;
    private String model;
    private boolean configured;

    /** Null until the provider has been probed. */
    private Boolean lastProbeSuccess;

    private Instant lastProbeAt;
    private Long lastProbeLatencyMs;
    private ErrorKind lastError;
    private String lastErrorMessage;
}
