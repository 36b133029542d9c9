package com.purchasingpower.chatgateway.exception;

/**
 * Inbound conversation cannot be processed. Raised before any provider is attempted.
 */
public class InvalidChatRequestException extends RuntimeException {

    public InvalidChatRequestException(String message) {
        super(message);
    }
}
