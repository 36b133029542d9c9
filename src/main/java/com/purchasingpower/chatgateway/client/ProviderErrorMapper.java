package com.purchasingpower.chatgateway.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.purchasingpower.chatgateway.model.ErrorKind;
import com.purchasingpower.chatgateway.util.ExternalCallLogger;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps backend failures onto the shared {@link ErrorKind} taxonomy.
 */
public final class ProviderErrorMapper {

    private ProviderErrorMapper() {
    }

    public static ErrorKind fromStatus(int status) {
        if (status == 401 || status == 403) {
            return ErrorKind.UNAUTHENTICATED;
        }
        if (status == 429) {
            return ErrorKind.RATE_LIMITED;
        }
        if (status == 408 || status == 504) {
            return ErrorKind.TIMEOUT;
        }
        return ErrorKind.UPSTREAM_ERROR;
    }

    public static ErrorKind fromThrowable(Throwable error) {
        Throwable root = Exceptions.unwrap(error);
        // Read timeouts arrive wrapped in a request exception, so look for them first.
        for (Throwable t = root; t != null; t = next(t)) {
            if (t instanceof TimeoutException || t instanceof io.netty.handler.timeout.TimeoutException) {
                return ErrorKind.TIMEOUT;
            }
        }
        for (Throwable t = root; t != null; t = next(t)) {
            if (t instanceof WebClientResponseException responseException) {
                return fromStatus(responseException.getStatusCode().value());
            }
            if (t instanceof JsonProcessingException || t instanceof DecodingException) {
                return ErrorKind.MALFORMED_RESPONSE;
            }
            if (t instanceof WebClientRequestException || t instanceof IOException) {
                return ErrorKind.NETWORK_FAILURE;
            }
        }
        return ErrorKind.NETWORK_FAILURE;
    }

    private static Throwable next(Throwable t) {
        Throwable cause = t.getCause();
        return cause == t ? null : cause;
    }

    /**
     * Short, loggable description of a failure. Response bodies are truncated.
     */
    public static String describe(Throwable error) {
        Throwable root = Exceptions.unwrap(error);
        if (root instanceof WebClientResponseException responseException) {
            String body = responseException.getResponseBodyAsString();
            return responseException.getStatusCode().value() + " "
                    + ExternalCallLogger.truncate(body, 200);
        }
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }
}
