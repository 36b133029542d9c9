package com.purchasingpower.chatgateway.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.chatgateway.configuration.AppProperties;
import com.purchasingpower.chatgateway.configuration.ProvidersProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Builds the ordered provider chain from {@code app.providers.order}.
 *
 * Known ids: {@code groq}, {@code huggingface}, {@code groq-deepseek}. An unknown id
 * fails startup rather than silently shortening the chain.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderChainFactory {

    private final AppProperties props;
    private final ObjectMapper objectMapper;
    private final WebClient.Builder webClientBuilder;

    private List<LLMProvider> providers = List.of();

    @PostConstruct
    public void init() {
        List<LLMProvider> chain = new ArrayList<>();
        for (String id : props.getProviders().getOrder()) {
            chain.add(create(id.trim().toLowerCase(Locale.ROOT)));
        }
        this.providers = Collections.unmodifiableList(chain);

        log.info("🚀 Provider chain configured: {}", props.getProviders().getOrder());
        for (int i = 0; i < providers.size(); i++) {
            LLMProvider provider = providers.get(i);
            log.info("   {}. {} (model={}, configured={})", i + 1, provider.getProviderName(),
                    provider.resolveModel(null), provider.isConfigured());
        }
    }

    /**
     * Providers in the order they are attempted.
     */
    public List<LLMProvider> getProviders() {
        return providers;
    }

    public LLMProvider getProvider(String name) {
        return providers.stream()
                .filter(p -> p.getProviderName().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + name));
    }

    private LLMProvider create(String id) {
        ProvidersProperties providerProps = props.getProviders();
        return switch (id) {
            case ProvidersProperties.GROQ ->
                    new GroqClient(id, providerProps.getGroq(), objectMapper, webClientBuilder);
            case ProvidersProperties.GROQ_DEEPSEEK ->
                    new GroqClient(id, providerProps.getGroqDeepseek(), objectMapper, webClientBuilder);
            case ProvidersProperties.HUGGINGFACE ->
                    new HuggingFaceClient(id, providerProps.getHuggingface(), objectMapper, webClientBuilder);
            default -> throw new IllegalStateException("Unknown provider id in app.providers.order: " + id);
        };
    }
}
