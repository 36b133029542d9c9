package com.purchasingpower.chatgateway.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.chatgateway.configuration.AppProperties;
import com.purchasingpower.chatgateway.configuration.ProviderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Provider Chain Factory Tests")
class ProviderChainFactoryTest {

    private AppProperties props;

    @BeforeEach
    void setUp() {
        props = new AppProperties();
        configure(props.getProviders().getGroq(), "https://api.groq.com/openai/v1", "llama-3.3-70b-versatile");
        configure(props.getProviders().getHuggingface(), "https://api-inference.huggingface.co/models",
                "Qwen/Qwen2.5-72B-Instruct");
        configure(props.getProviders().getGroqDeepseek(), "https://api.groq.com/openai/v1",
                "deepseek-r1-distill-llama-70b");
    }

    @Test
    @DisplayName("Chain follows the configured order")
    void init_ShouldFollowConfiguredOrder() {
        props.getProviders().setOrder(List.of("huggingface", "groq-deepseek", "groq"));

        ProviderChainFactory factory = factory();

        assertThat(factory.getProviders()).extracting(LLMProvider::getProviderName)
                .containsExactly("huggingface", "groq-deepseek", "groq");
        assertThat(factory.getProvider("GROQ")).isInstanceOf(GroqClient.class);
    }

    @Test
    @DisplayName("Provider ids are matched the same way under any default locale")
    void init_ShouldIgnoreDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            props.getProviders().setOrder(List.of(" HUGGINGFACE ", "GROQ"));

            ProviderChainFactory factory = factory();

            assertThat(factory.getProviders()).extracting(LLMProvider::getProviderName)
                    .containsExactly("huggingface", "groq");
            assertThat(factory.getProviders().get(0)).isInstanceOf(HuggingFaceClient.class);
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void unknownProviderId_ShouldFailStartup() {
        props.getProviders().setOrder(List.of("groq", "openai"));

        assertThatThrownBy(this::factory)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("openai");
    }

    private ProviderChainFactory factory() {
        ProviderChainFactory factory = new ProviderChainFactory(props, new ObjectMapper(), WebClient.builder());
        factory.init();
        return factory;
    }

    private static void configure(ProviderProperties provider, String baseUrl, String model) {
        provider.setBaseUrl(baseUrl);
        provider.setDefaultModel(model);
    }
}
