package com.purchasingpower.chatgateway.orchestrator;

import com.purchasingpower.chatgateway.context.ContextAnalyzer;
import com.purchasingpower.chatgateway.context.ConversationContext;
import com.purchasingpower.chatgateway.model.ChatMessage;
import com.purchasingpower.chatgateway.model.ProviderResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Detached, best-effort analytics over a finished exchange.
 *
 * Runs on the analytics executor after the reply has been built. Nothing here
 * feeds back into the reply; failures are logged and dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationAnalyticsService {

    private final ContextAnalyzer contextAnalyzer;

    @Async("analyticsExecutor")
    public void recordExchange(List<ChatMessage> messages, Reply reply) {
        try {
            ConversationContext ctx = contextAnalyzer.analyze(messages);
            log.debug("📊 Exchange analytics: source={}, topics=[{}], tone={}, level={}, intent={}, followUp={}",
                    reply.getSourceLabel(),
                    ctx.topicList(),
                    ctx.emotionalTone(),
                    ctx.knowledgeLevel(),
                    ctx.intent(),
                    ctx.followUp());
            for (ProviderResult attempt : reply.getAttempts()) {
                log.debug("   attempt {}: success={}, error={}, latency={}ms",
                        attempt.providerName(),
                        attempt.success(),
                        attempt.error(),
                        attempt.latency() != null ? attempt.latency().toMillis() : -1);
            }
        } catch (Exception e) {
            log.warn("Analytics failed for {} reply: {}", reply.getSourceLabel(), e.getMessage());
        }
    }
}
