package com.purchasingpower.chatgateway.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.chatgateway.configuration.ProviderProperties;
import com.purchasingpower.chatgateway.model.CallContext;
import com.purchasingpower.chatgateway.model.ChatMessage;
import com.purchasingpower.chatgateway.model.CompletionParams;
import com.purchasingpower.chatgateway.model.ErrorKind;
import com.purchasingpower.chatgateway.model.ProviderResult;
import com.purchasingpower.chatgateway.model.ServiceType;
import com.purchasingpower.chatgateway.util.ExternalCallLogger;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions on Groq.
 *
 * One instance per configured model: the primary fast model and the DeepSeek
 * reasoning model share this client with different {@link ProviderProperties}.
 */
@Slf4j
public class GroqClient implements LLMProvider {

    static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    private final String providerName;
    private final ProviderProperties props;
    private final ObjectMapper objectMapper;
    private final WebClient groqWebClient;
    private final boolean configured;

    public GroqClient(String providerName, ProviderProperties props, ObjectMapper objectMapper,
                      WebClient.Builder webClientBuilder) {
        this.providerName = providerName;
        this.props = props;
        this.objectMapper = objectMapper;
        this.configured = props.isConfigured();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
                .responseTimeout(props.getTimeout());

        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (configured) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey());
        } else {
            log.warn("⚠️ {} has no API key configured, provider skipped until restart", providerName);
        }
        this.groqWebClient = builder.build();
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public String resolveModel(String requestedModel) {
        return props.resolveModel(requestedModel);
    }

    @Override
    public ProviderResult complete(List<ChatMessage> messages, CompletionParams params) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GROQ, providerName, log);
        if (!configured) {
            return ProviderResult.failure(providerName, ErrorKind.UNAUTHENTICATED,
                    "API key not configured", callCtx.getElapsed());
        }

        String model = resolveModel(params.getModel());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", toWireMessages(messages));
        body.put("max_tokens", params.maxTokensOr(props.getDefaultMaxTokens()));
        body.put("temperature", params.temperatureOr(props.getDefaultTemperature()));
        body.put("stream", false);

        callCtx.logRequest("Chat completion",
                "Model", model,
                "Messages", messages.size());

        try {
            String json = groqWebClient.post()
                    .uri(CHAT_COMPLETIONS_PATH)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(props.getTimeout())
                    .block();

            String content = extractContent(json);
            if (content == null || content.isBlank()) {
                callCtx.logFailure(ErrorKind.MALFORMED_RESPONSE, "No message content in response", null);
                return ProviderResult.failure(providerName, ErrorKind.MALFORMED_RESPONSE,
                        "No message content in response", callCtx.getElapsed());
            }

            callCtx.logResponse("Completion received",
                    "Response Length", content.length() + " chars",
                    "Response", ExternalCallLogger.truncate(content, 500));
            return ProviderResult.success(providerName, content, callCtx.getElapsed());

        } catch (Exception e) {
            ErrorKind kind = ProviderErrorMapper.fromThrowable(e);
            String message = ProviderErrorMapper.describe(e);
            callCtx.logFailure(kind, message, e);
            return ProviderResult.failure(providerName, kind, message, callCtx.getElapsed());
        }
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        return messages.stream()
                .map(m -> {
                    Map<String, Object> wire = new LinkedHashMap<>();
                    wire.put("role", m.getRole().getWireName());
                    // Structured (multimodal) content is passed through as-is
                    wire.put("content", m.getContent() != null && m.getContent().isArray()
                            ? m.getContent()
                            : m.textView());
                    return wire;
                })
                .toList();
    }

    private String extractContent(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return null;
        }
        JsonNode root = objectMapper.readTree(json);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }
}
