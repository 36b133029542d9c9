package com.purchasingpower.chatgateway.client;

import com.fasterxml.jackson.core.JsonParseException;
import com.purchasingpower.chatgateway.model.ErrorKind;
import io.netty.handler.timeout.ReadTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Provider Error Mapper Tests")
class ProviderErrorMapperTest {

    @ParameterizedTest
    @CsvSource({
            "401, UNAUTHENTICATED",
            "403, UNAUTHENTICATED",
            "429, RATE_LIMITED",
            "408, TIMEOUT",
            "504, TIMEOUT",
            "400, UPSTREAM_ERROR",
            "500, UPSTREAM_ERROR",
            "502, UPSTREAM_ERROR"
    })
    void fromStatus(int status, ErrorKind expected) {
        assertThat(ProviderErrorMapper.fromStatus(status)).isEqualTo(expected);
    }

    @Test
    @DisplayName("A read timeout inside a request exception is still a timeout")
    void wrappedTimeout_ShouldBeTimeout() {
        WebClientRequestException wrapped = new WebClientRequestException(
                new IOException("read failed", ReadTimeoutException.INSTANCE),
                HttpMethod.POST, URI.create("https://api.groq.com/openai/v1/chat/completions"), new HttpHeaders());

        assertThat(ProviderErrorMapper.fromThrowable(wrapped)).isEqualTo(ErrorKind.TIMEOUT);
    }

    @Test
    @DisplayName("Checked exceptions propagated out of block() are unwrapped")
    void propagatedCheckedException_ShouldBeUnwrapped() {
        assertThat(ProviderErrorMapper.fromThrowable(Exceptions.propagate(new TimeoutException("slow"))))
                .isEqualTo(ErrorKind.TIMEOUT);
        assertThat(ProviderErrorMapper.fromThrowable(Exceptions.propagate(new ConnectException("refused"))))
                .isEqualTo(ErrorKind.NETWORK_FAILURE);
    }

    @Test
    void responseException_ShouldUseStatus() {
        WebClientResponseException tooMany = WebClientResponseException.create(
                429, "Too Many Requests", new HttpHeaders(),
                "{\"error\":\"slow down\"}".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);

        assertThat(ProviderErrorMapper.fromThrowable(tooMany)).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(ProviderErrorMapper.describe(tooMany)).isEqualTo("429 {\"error\":\"slow down\"}");
    }

    @Test
    void parseFailure_ShouldBeMalformed() {
        JsonParseException parse = new JsonParseException(null, "Unexpected character '<'");

        assertThat(ProviderErrorMapper.fromThrowable(parse)).isEqualTo(ErrorKind.MALFORMED_RESPONSE);
        assertThat(ProviderErrorMapper.describe(parse)).startsWith("JsonParseException: ");
    }

    @Test
    void unknownFailure_ShouldDefaultToNetworkFailure() {
        assertThat(ProviderErrorMapper.fromThrowable(new IllegalStateException("boom")))
                .isEqualTo(ErrorKind.NETWORK_FAILURE);
    }
}
