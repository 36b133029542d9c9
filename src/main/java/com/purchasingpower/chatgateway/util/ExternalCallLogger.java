package com.purchasingpower.chatgateway.util;

import com.purchasingpower.chatgateway.model.CallContext;
import com.purchasingpower.chatgateway.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging for outbound provider calls.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
