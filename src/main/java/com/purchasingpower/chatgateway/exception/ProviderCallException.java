package com.purchasingpower.chatgateway.exception;

import com.purchasingpower.chatgateway.model.ErrorKind;
import lombok.Getter;

/**
 * Provider attempt that escaped its adapter with an exception instead of a failed result.
 */
@Getter
public class ProviderCallException extends RuntimeException {

    private final String providerName;
    private final ErrorKind errorKind;

    public ProviderCallException(String providerName, ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
        this.errorKind = errorKind;
    }
}
