package com.purchasingpower.chatgateway.service;

import com.purchasingpower.chatgateway.client.LLMProvider;
import com.purchasingpower.chatgateway.client.ProviderChainFactory;
import com.purchasingpower.chatgateway.client.ProviderErrorMapper;
import com.purchasingpower.chatgateway.configuration.AppProperties;
import com.purchasingpower.chatgateway.model.ChatMessage;
import com.purchasingpower.chatgateway.model.CompletionParams;
import com.purchasingpower.chatgateway.model.ProviderResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks credential presence and the latest probe outcome per provider.
 *
 * Probes go straight to the adapters and never through the orchestrator, so they
 * do not influence reply construction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderHealthService {

    static final List<ChatMessage> PROBE_CONVERSATION =
            List.of(ChatMessage.user("Hello, respond with just \"OK\""));
    static final CompletionParams PROBE_PARAMS = CompletionParams.builder()
            .temperature(0.0)
            .maxTokens(10)
            .build();

    private final ProviderChainFactory providerChainFactory;
    private final AppProperties props;
    private final Map<String, ProbeRecord> lastProbes = new ConcurrentHashMap<>();

    /**
     * Status for every provider, in chain order.
     */
    public List<ProviderStatus> getStatuses() {
        List<LLMProvider> providers = providerChainFactory.getProviders();
        List<ProviderStatus> statuses = new ArrayList<>(providers.size());
        for (int i = 0; i < providers.size(); i++) {
            LLMProvider provider = providers.get(i);
            ProbeRecord probe = lastProbes.get(provider.getProviderName());
            ProviderStatus.ProviderStatusBuilder status = ProviderStatus.builder()
                    .position(i + 1)
                    .provider(provider.getProviderName())
                    .model(provider.resolveModel(null))
                    .configured(provider.isConfigured());
            if (probe != null) {
                status.lastProbeSuccess(probe.result().success())
                        .lastProbeAt(probe.at())
                        .lastProbeLatencyMs(probe.result().latency() != null ? probe.result().latency().toMillis() : null)
                        .lastError(probe.result().error())
                        .lastErrorMessage(probe.result().errorMessage());
            }
            statuses.add(status.build());
        }
        return statuses;
    }

    /**
     * Probe every configured provider with a tiny conversation. Providers without
     * a credential are skipped; they stay unavailable for the process lifetime.
     */
    public List<ProviderStatus> probeAll() {
        for (LLMProvider provider : providerChainFactory.getProviders()) {
            if (!provider.isConfigured()) {
                log.debug("Skipping probe of unconfigured provider {}", provider.getProviderName());
                continue;
            }
            probe(provider);
        }
        return getStatuses();
    }

    @Scheduled(fixedDelayString = "${app.health.probe-interval:PT5M}",
            initialDelayString = "${app.health.probe-interval:PT5M}")
    public void scheduledProbe() {
        if (!props.getHealth().isProbeEnabled()) {
            return;
        }
        log.debug("Running scheduled provider probe");
        probeAll();
    }

    private void probe(LLMProvider provider) {
        ProviderResult result;
        try {
            result = provider.complete(PROBE_CONVERSATION, PROBE_PARAMS);
        } catch (RuntimeException e) {
            log.warn("Probe of {} threw: {}", provider.getProviderName(), e.getMessage());
            result = ProviderResult.failure(provider.getProviderName(),
                    ProviderErrorMapper.fromThrowable(e),
                    e.getMessage(), null);
        }
        lastProbes.put(provider.getProviderName(), new ProbeRecord(result, Instant.now()));
        if (result.success()) {
            log.info("💚 Probe of {} succeeded", provider.getProviderName());
        } else {
            log.warn("💔 Probe of {} failed: {} {}", provider.getProviderName(), result.error(), result.errorMessage());
        }
    }

    private record ProbeRecord(ProviderResult result, Instant at) {
    }
}
