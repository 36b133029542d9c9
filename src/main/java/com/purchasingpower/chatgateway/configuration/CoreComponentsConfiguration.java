package com.purchasingpower.chatgateway.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.chatgateway.client.ProviderChainFactory;
import com.purchasingpower.chatgateway.context.ContextAnalyzer;
import com.purchasingpower.chatgateway.fallback.FallbackGenerator;
import com.purchasingpower.chatgateway.fallback.FallbackTemplateCatalog;
import com.purchasingpower.chatgateway.fallback.RandomTemplateSelector;
import com.purchasingpower.chatgateway.fallback.TemplateSelector;
import com.purchasingpower.chatgateway.moderation.ModerationEngine;
import com.purchasingpower.chatgateway.moderation.ModerationRuleTable;
import com.purchasingpower.chatgateway.orchestrator.CompletionOrchestrator;
import com.purchasingpower.chatgateway.orchestrator.ConversationAnalyticsService;
import com.purchasingpower.chatgateway.postprocess.ResponsePostProcessor;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Wires the orchestration pipeline. The rule and template tables are loaded once
 * at startup and shared read-only by all requests.
 */
@Configuration
@RequiredArgsConstructor
public class CoreComponentsConfiguration {

    private final AppProperties props;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @Bean
    public ModerationRuleTable moderationRuleTable() {
        String location = props.getModeration().getRulesLocation();
        try (InputStream in = open(location)) {
            return ModerationRuleTable.load(in, objectMapper);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read moderation rules from " + location, e);
        }
    }

    @Bean
    public ModerationEngine moderationEngine(ModerationRuleTable moderationRuleTable) {
        return new ModerationEngine(moderationRuleTable);
    }

    @Bean
    public ContextAnalyzer contextAnalyzer() {
        return new ContextAnalyzer(props.getContext().getWindowSize());
    }

    @Bean
    public FallbackTemplateCatalog fallbackTemplateCatalog() {
        String location = props.getFallback().getTemplatesLocation();
        try (InputStream in = open(location)) {
            return FallbackTemplateCatalog.load(in, objectMapper);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read fallback templates from " + location, e);
        }
    }

    @Bean
    public TemplateSelector templateSelector() {
        Long seed = props.getFallback().getSeed();
        return seed != null ? new RandomTemplateSelector(seed) : new RandomTemplateSelector();
    }

    @Bean
    public FallbackGenerator fallbackGenerator(FallbackTemplateCatalog fallbackTemplateCatalog,
                                               TemplateSelector templateSelector) {
        return new FallbackGenerator(fallbackTemplateCatalog, templateSelector);
    }

    @Bean
    public ResponsePostProcessor responsePostProcessor() {
        return new ResponsePostProcessor();
    }

    @Bean
    public CompletionOrchestrator completionOrchestrator(ModerationEngine moderationEngine,
                                                         ProviderChainFactory providerChainFactory,
                                                         ContextAnalyzer contextAnalyzer,
                                                         FallbackGenerator fallbackGenerator,
                                                         ResponsePostProcessor responsePostProcessor,
                                                         ConversationAnalyticsService analyticsService,
                                                         @Qualifier("providerAttemptExecutor") ThreadPoolTaskExecutor providerAttemptExecutor) {
        ProvidersProperties providers = props.getProviders();
        return CompletionOrchestrator.builder()
                .moderationEngine(moderationEngine)
                .providers(providerChainFactory.getProviders())
                .contextAnalyzer(contextAnalyzer)
                .fallbackGenerator(fallbackGenerator)
                .postProcessor(responsePostProcessor)
                .analyticsService(props.getAnalytics().isEnabled() ? analyticsService : null)
                .attemptExecutor(providerAttemptExecutor)
                .attemptTimeout(providers.getAttemptTimeout())
                .fallbackEnabled(props.getFallback().isEnabled())
                .systemPrompt(providers.getSystemPrompt())
                .build();
    }

    private InputStream open(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IOException("Resource not found: " + location);
        }
        return resource.getInputStream();
    }
}
