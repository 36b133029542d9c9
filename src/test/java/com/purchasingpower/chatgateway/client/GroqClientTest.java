package com.purchasingpower.chatgateway.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.chatgateway.configuration.ProviderProperties;
import com.purchasingpower.chatgateway.model.ChatMessage;
import com.purchasingpower.chatgateway.model.CompletionParams;
import com.purchasingpower.chatgateway.model.ErrorKind;
import com.purchasingpower.chatgateway.model.ProviderResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Groq Client Tests")
class GroqClientTest {

    private static final List<ChatMessage> CONVERSATION = List.of(ChatMessage.user("What is 2 + 2?"));

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private ProviderProperties props;

    @BeforeEach
    void setUp() {
        props = new ProviderProperties();
        props.setApiKey("gsk-test-key");
        props.setBaseUrl("https://api.groq.com/openai/v1");
        props.setDefaultModel("llama-3.3-70b-versatile");
        props.setAllowedModels(List.of("llama-3.3-70b-versatile", "llama-3.1-8b-instant"));
        props.setTimeout(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Should post to chat completions with a bearer key and read the first choice")
    void complete_ShouldReturnFirstChoice() {
        // Given
        GroqClient client = client(respond(HttpStatus.OK,
                "{\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"4\"}}]}"));

        // When
        ProviderResult result = client.complete(CONVERSATION, CompletionParams.defaults());

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.text()).isEqualTo("4");
        assertThat(result.providerName()).isEqualTo("groq");
        assertThat(result.latency()).isNotNull();

        ClientRequest request = lastRequest.get();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo("https://api.groq.com/openai/v1/chat/completions");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer gsk-test-key");
    }

    @ParameterizedTest
    @CsvSource({
            "401, UNAUTHENTICATED",
            "403, UNAUTHENTICATED",
            "429, RATE_LIMITED",
            "504, TIMEOUT",
            "500, UPSTREAM_ERROR",
            "503, UPSTREAM_ERROR"
    })
    @DisplayName("Should map error statuses onto the shared error kinds")
    void errorStatus_ShouldBeMapped(int status, ErrorKind expected) {
        GroqClient client = client(respond(HttpStatus.valueOf(status), "{\"error\":{\"message\":\"nope\"}}"));

        ProviderResult result = client.complete(CONVERSATION, CompletionParams.defaults());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo(expected);
        assertThat(result.errorMessage()).startsWith(String.valueOf(status));
    }

    @Test
    @DisplayName("Unparseable or empty bodies are malformed responses")
    void badBody_ShouldBeMalformed() {
        assertThat(client(respond(HttpStatus.OK, "<html>gateway</html>"))
                .complete(CONVERSATION, CompletionParams.defaults()).error())
                .isEqualTo(ErrorKind.MALFORMED_RESPONSE);
        assertThat(client(respond(HttpStatus.OK, "{\"choices\":[]}"))
                .complete(CONVERSATION, CompletionParams.defaults()).error())
                .isEqualTo(ErrorKind.MALFORMED_RESPONSE);
    }

    @Test
    @DisplayName("A backend that never answers times out")
    void silentBackend_ShouldTimeOut() {
        props.setTimeout(Duration.ofMillis(100));
        GroqClient client = client(request -> Mono.never());

        ProviderResult result = client.complete(CONVERSATION, CompletionParams.defaults());

        assertThat(result.error()).isEqualTo(ErrorKind.TIMEOUT);
    }

    @Test
    @DisplayName("Connection problems are network failures")
    void connectionFailure_ShouldBeNetworkFailure() {
        GroqClient client = client(request -> Mono.error(new IOException("Connection reset by peer")));

        ProviderResult result = client.complete(CONVERSATION, CompletionParams.defaults());

        assertThat(result.error()).isEqualTo(ErrorKind.NETWORK_FAILURE);
    }

    @Test
    @DisplayName("Without a key the provider is unavailable and makes no call")
    void missingKey_ShouldNotCallBackend() {
        props.setApiKey("placeholder-set-me");
        GroqClient client = client(respond(HttpStatus.OK, "{}"));

        ProviderResult result = client.complete(CONVERSATION, CompletionParams.defaults());

        assertThat(client.isConfigured()).isFalse();
        assertThat(result.error()).isEqualTo(ErrorKind.UNAUTHENTICATED);
        assertThat(lastRequest.get()).isNull();
    }

    @Test
    @DisplayName("Only allowed models may be requested")
    void requestedModel_ShouldBeRestrictedToAllowList() {
        GroqClient client = client(respond(HttpStatus.OK, "{}"));

        assertThat(client.resolveModel("llama-3.1-8b-instant")).isEqualTo("llama-3.1-8b-instant");
        assertThat(client.resolveModel("gpt-4")).isEqualTo("llama-3.3-70b-versatile");
        assertThat(client.resolveModel(null)).isEqualTo("llama-3.3-70b-versatile");
    }

    private GroqClient client(ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            lastRequest.set(request);
            return exchange.exchange(request);
        };
        return new GroqClient("groq", props, objectMapper, WebClient.builder().exchangeFunction(recording));
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }
}
