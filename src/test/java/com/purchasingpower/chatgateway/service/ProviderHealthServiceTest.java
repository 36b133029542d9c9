package com.purchasingpower.chatgateway.service;

import com.purchasingpower.chatgateway.client.LLMProvider;
import com.purchasingpower.chatgateway.client.ProviderChainFactory;
import com.purchasingpower.chatgateway.configuration.AppProperties;
import com.purchasingpower.chatgateway.model.ErrorKind;
import com.purchasingpower.chatgateway.model.ProviderResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Provider Health Service Tests")
class ProviderHealthServiceTest {

    private LLMProvider groq;
    private LLMProvider huggingFace;
    private LLMProvider deepSeek;
    private AppProperties props;
    private ProviderHealthService service;

    @BeforeEach
    void setUp() {
        groq = provider("groq", true, "llama-3.3-70b-versatile");
        huggingFace = provider("huggingface", true, "Qwen/Qwen2.5-72B-Instruct");
        deepSeek = provider("groq-deepseek", false, "deepseek-r1-distill-llama-70b");

        ProviderChainFactory chain = mock(ProviderChainFactory.class);
        when(chain.getProviders()).thenReturn(List.of(groq, huggingFace, deepSeek));

        props = new AppProperties();
        service = new ProviderHealthService(chain, props);
    }

    @Test
    @DisplayName("Before any probe only credential presence is reported")
    void statuses_BeforeProbe() {
        List<ProviderStatus> statuses = service.getStatuses();

        assertThat(statuses).extracting(ProviderStatus::getProvider)
                .containsExactly("groq", "huggingface", "groq-deepseek");
        assertThat(statuses).extracting(ProviderStatus::getPosition).containsExactly(1, 2, 3);
        assertThat(statuses).extracting(ProviderStatus::isConfigured).containsExactly(true, true, false);
        assertThat(statuses).allSatisfy(s -> assertThat(s.getLastProbeSuccess()).isNull());
    }

    @Test
    @DisplayName("Probing records outcomes and skips providers without a key")
    void probeAll_ShouldRecordOutcomes() {
        // Given
        when(groq.complete(any(), any()))
                .thenReturn(ProviderResult.success("groq", "OK", Duration.ofMillis(120)));
        when(huggingFace.complete(any(), any()))
                .thenReturn(ProviderResult.failure("huggingface", ErrorKind.RATE_LIMITED, "429 slow down",
                        Duration.ofMillis(40)));

        // When
        List<ProviderStatus> statuses = service.probeAll();

        // Then
        assertThat(statuses.get(0).getLastProbeSuccess()).isTrue();
        assertThat(statuses.get(0).getLastProbeLatencyMs()).isEqualTo(120L);
        assertThat(statuses.get(0).getLastProbeAt()).isNotNull();

        assertThat(statuses.get(1).getLastProbeSuccess()).isFalse();
        assertThat(statuses.get(1).getLastError()).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(statuses.get(1).getLastErrorMessage()).isEqualTo("429 slow down");

        assertThat(statuses.get(2).getLastProbeSuccess()).isNull();
        verify(deepSeek, never()).complete(any(), any());
    }

    @Test
    @DisplayName("Probe uses a tiny deterministic request")
    void probe_ShouldUseSmallRequest() {
        when(groq.complete(any(), any())).thenReturn(ProviderResult.success("groq", "OK", Duration.ZERO));
        when(huggingFace.complete(any(), any())).thenReturn(ProviderResult.success("huggingface", "OK", Duration.ZERO));

        service.probeAll();

        verify(groq).complete(ProviderHealthService.PROBE_CONVERSATION, ProviderHealthService.PROBE_PARAMS);
        assertThat(ProviderHealthService.PROBE_PARAMS.getMaxTokens()).isEqualTo(10);
        assertThat(ProviderHealthService.PROBE_PARAMS.getTemperature()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("A throwing adapter is recorded as a failed probe")
    void probe_ThrowingAdapter() {
        when(groq.complete(any(), any())).thenThrow(new IllegalStateException("boom"));
        when(huggingFace.complete(any(), any())).thenReturn(ProviderResult.success("huggingface", "OK", Duration.ZERO));

        List<ProviderStatus> statuses = service.probeAll();

        assertThat(statuses.get(0).getLastProbeSuccess()).isFalse();
        assertThat(statuses.get(0).getLastErrorMessage()).isEqualTo("boom");
        assertThat(statuses.get(0).getLastProbeLatencyMs()).isNull();
        assertThat(statuses.get(1).getLastProbeSuccess()).isTrue();
    }

    @Test
    @DisplayName("Scheduled probing is off unless enabled")
    void scheduledProbe_Disabled() {
        service.scheduledProbe();
        verify(groq, never()).complete(any(), any());

        props.getHealth().setProbeEnabled(true);
        when(groq.complete(any(), any())).thenReturn(ProviderResult.success("groq", "OK", Duration.ZERO));
        when(huggingFace.complete(any(), any())).thenReturn(ProviderResult.success("huggingface", "OK", Duration.ZERO));
        service.scheduledProbe();
        verify(groq).complete(any(), any());
    }

    private static LLMProvider provider(String name, boolean configured, String model) {
        LLMProvider provider = mock(LLMProvider.class);
        when(provider.getProviderName()).thenReturn(name);
        when(provider.isConfigured()).thenReturn(configured);
        when(provider.resolveModel(null)).thenReturn(model);
        return provider;
    }
}
