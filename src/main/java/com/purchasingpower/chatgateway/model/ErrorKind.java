package com.purchasingpower.chatgateway.model;

/**
 * Shared failure taxonomy for provider calls.
 */
public enum ErrorKind {
    /** Missing or rejected credential. */
    UNAUTHENTICATED,
    RATE_LIMITED,
    TIMEOUT,
    /** The backend answered but nothing usable could be parsed out of it. */
    MALFORMED_RESPONSE,
    NETWORK_FAILURE,
    /** 5xx or another status the adapter has no specific mapping for. */
    UPSTREAM_ERROR,
    /** Orchestrator-level: every adapter failed and no fallback text was produced. */
    ALL_PROVIDERS_EXHAUSTED
}
