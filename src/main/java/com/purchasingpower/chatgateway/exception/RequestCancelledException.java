package com.purchasingpower.chatgateway.exception;

import lombok.Getter;

/**
 * The calling thread was interrupted while the request was being served.
 * {@code providerName} is null when no attempt was in flight.
 */
@Getter
public class RequestCancelledException extends RuntimeException {

    private final String providerName;

    public RequestCancelledException(String providerName, Throwable cause) {
        super("Request cancelled during attempt on " + providerName, cause);
        this.providerName = providerName;
    }

    public RequestCancelledException(Throwable cause) {
        super("Request cancelled before the fallback reply", cause);
        this.providerName = null;
    }
}
