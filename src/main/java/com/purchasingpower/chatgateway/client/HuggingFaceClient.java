package com.purchasingpower.chatgateway.client;

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
 * HuggingFace text-generation inference.
 *
 * The endpoint takes a single prompt string, so the conversation is rendered in
 * ChatML ({@code <|im_start|>role ... <|im_end|>}) and ends with an open assistant turn.
 * Only the text view of each message is sent.
 */
@Slf4j
public class HuggingFaceClient implements LLMProvider {

    static final String IM_START = "<|im_start|>";
    static final String IM_END = "<|im_end|>";

    private final String providerName;
    private final ProviderProperties props;
    private final ObjectMapper objectMapper;
    private final WebClient hfWebClient;
    private final boolean configured;

    public HuggingFaceClient(String providerName, ProviderProperties props, ObjectMapper objectMapper,
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
        this.hfWebClient = builder.build();
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
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.HUGGINGFACE, providerName, log);
        if (!configured) {
            return ProviderResult.failure(providerName, ErrorKind.UNAUTHENTICATED,
                    "API key not configured", callCtx.getElapsed());
        }

        String model = resolveModel(params.getModel());
        String prompt = toChatMlPrompt(messages);
        double temperature = params.temperatureOr(props.getDefaultTemperature());

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("max_new_tokens", params.maxTokensOr(props.getDefaultMaxTokens()));
        parameters.put("return_full_text", false);
        if (temperature > 0) {
            parameters.put("temperature", temperature);
            parameters.put("do_sample", true);
        } else {
            parameters.put("do_sample", false);
        }
        if (props.getTopP() != null) {
            parameters.put("top_p", props.getTopP());
        }
        if (!props.getStopSequences().isEmpty()) {
            parameters.put("stop", props.getStopSequences());
        }

        Map<String, Object> body = Map.of(
                "inputs", prompt,
                "parameters", parameters);

        callCtx.logRequest("Text generation",
                "Model", model,
                "Prompt Length", prompt.length() + " chars",
                "Prompt", ExternalCallLogger.truncate(prompt, 500));

        try {
            String json = hfWebClient.post()
                    // Model ids contain a slash, which a URI variable would encode
                    .uri("/" + model)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(props.getTimeout())
                    .block();

            JsonNode root = json == null || json.isBlank() ? null : objectMapper.readTree(json);
            if (root != null && root.hasNonNull("error")) {
                String upstream = root.path("error").asText();
                callCtx.logFailure(ErrorKind.UPSTREAM_ERROR, upstream, null);
                return ProviderResult.failure(providerName, ErrorKind.UPSTREAM_ERROR, upstream, callCtx.getElapsed());
            }

            String content = cleanup(extractGeneratedText(root));
            if (content.isBlank()) {
                callCtx.logFailure(ErrorKind.MALFORMED_RESPONSE, "No generated_text in response", null);
                return ProviderResult.failure(providerName, ErrorKind.MALFORMED_RESPONSE,
                        "No generated_text in response", callCtx.getElapsed());
            }

            callCtx.logResponse("Text generated",
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

    static String toChatMlPrompt(List<ChatMessage> messages) {
        StringBuilder prompt = new StringBuilder();
        for (ChatMessage message : messages) {
            prompt.append(IM_START)
                    .append(message.getRole().getWireName())
                    .append('\n')
                    .append(message.fullText())
                    .append(IM_END)
                    .append('\n');
        }
        prompt.append(IM_START).append("assistant\n");
        return prompt.toString();
    }

    /**
     * The endpoint answers either {@code [{"generated_text": ...}]} or {@code {"generated_text": ...}}.
     */
    private static String extractGeneratedText(JsonNode root) {
        if (root == null) {
            return "";
        }
        JsonNode node = root.isArray() ? root.path(0) : root;
        JsonNode text = node.path("generated_text");
        return text.isTextual() ? text.asText() : "";
    }

    private static String cleanup(String text) {
        String cleaned = text;
        int end = cleaned.indexOf(IM_END);
        if (end >= 0) {
            cleaned = cleaned.substring(0, end);
        }
        return cleaned.trim();
    }
}
