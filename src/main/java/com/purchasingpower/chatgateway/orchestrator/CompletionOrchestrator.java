package com.purchasingpower.chatgateway.orchestrator;

import com.purchasingpower.chatgateway.client.LLMProvider;
import com.purchasingpower.chatgateway.client.ProviderErrorMapper;
import com.purchasingpower.chatgateway.context.ContextAnalyzer;
import com.purchasingpower.chatgateway.context.ConversationContext;
import com.purchasingpower.chatgateway.exception.AllProvidersExhaustedException;
import com.purchasingpower.chatgateway.exception.InvalidChatRequestException;
import com.purchasingpower.chatgateway.exception.ProviderCallException;
import com.purchasingpower.chatgateway.exception.RequestCancelledException;
import com.purchasingpower.chatgateway.fallback.FallbackGenerator;
import com.purchasingpower.chatgateway.model.ChatMessage;
import com.purchasingpower.chatgateway.model.CompletionParams;
import com.purchasingpower.chatgateway.model.ErrorKind;
import com.purchasingpower.chatgateway.model.MessageRole;
import com.purchasingpower.chatgateway.model.ProviderResult;
import com.purchasingpower.chatgateway.moderation.ModerationEngine;
import com.purchasingpower.chatgateway.moderation.ModerationVerdict;
import com.purchasingpower.chatgateway.postprocess.ProcessedResponse;
import com.purchasingpower.chatgateway.postprocess.ResponsePostProcessor;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns a conversation into exactly one {@link Reply}.
 *
 * <ol>
 *   <li>Moderation of the latest user message. A block returns the canned reply.</li>
 *   <li>Providers in chain order, each attempted once with a bounded wait. The first
 *       success whose post-processed text is non-blank wins.</li>
 *   <li>When every provider failed, the context-flavored fallback reply.</li>
 * </ol>
 *
 * Providers without a credential are skipped on every request; they keep their
 * chain position for labelling. Attempts are sequential. A timed-out attempt is abandoned (its future cancelled)
 * and counts as a {@link ErrorKind#TIMEOUT} failure. If the calling thread is
 * interrupted, the in-flight attempt is cancelled and no fallback is computed.
 */
@Slf4j
public class CompletionOrchestrator {

    public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(15);

    private final ModerationEngine moderationEngine;
    private final List<LLMProvider> providers;
    private final ContextAnalyzer contextAnalyzer;
    private final FallbackGenerator fallbackGenerator;
    private final ResponsePostProcessor postProcessor;
    private final ConversationAnalyticsService analyticsService;
    private final AsyncTaskExecutor attemptExecutor;
    private final Duration attemptTimeout;
    private final boolean fallbackEnabled;
    private final String systemPrompt;

    @Builder
    public CompletionOrchestrator(ModerationEngine moderationEngine,
                                  List<LLMProvider> providers,
                                  ContextAnalyzer contextAnalyzer,
                                  FallbackGenerator fallbackGenerator,
                                  ResponsePostProcessor postProcessor,
                                  ConversationAnalyticsService analyticsService,
                                  AsyncTaskExecutor attemptExecutor,
                                  Duration attemptTimeout,
                                  Boolean fallbackEnabled,
                                  String systemPrompt) {
        if (moderationEngine == null || fallbackGenerator == null) {
            throw new IllegalArgumentException("moderationEngine and fallbackGenerator are required");
        }
        this.moderationEngine = moderationEngine;
        this.providers = providers != null ? List.copyOf(providers) : List.of();
        this.contextAnalyzer = contextAnalyzer != null ? contextAnalyzer : new ContextAnalyzer();
        this.fallbackGenerator = fallbackGenerator;
        this.postProcessor = postProcessor != null ? postProcessor : new ResponsePostProcessor();
        this.analyticsService = analyticsService;
        this.attemptExecutor = attemptExecutor != null ? attemptExecutor : new SimpleAsyncTaskExecutor("provider-attempt-");
        this.attemptTimeout = attemptTimeout != null ? attemptTimeout : DEFAULT_ATTEMPT_TIMEOUT;
        this.fallbackEnabled = fallbackEnabled == null || fallbackEnabled;
        this.systemPrompt = systemPrompt;
    }

    public Reply respond(List<ChatMessage> messages) {
        return respond(messages, CompletionParams.defaults());
    }

    public Reply respond(List<ChatMessage> messages, CompletionParams params) {
        CompletionParams effectiveParams = params != null ? params : CompletionParams.defaults();
        String latestUserText = validate(messages, effectiveParams);

        ModerationVerdict verdict = moderationEngine.classify(latestUserText);
        if (verdict.blocked()) {
            Reply reply = Reply.builder()
                    .visibleText(verdict.cannedReply())
                    .sourceLabel(SourceLabel.MODERATION)
                    .moderationCategory(verdict.category())
                    .build();
            dispatchAnalytics(messages, reply);
            return reply;
        }
        if (verdict.bypassed()) {
            log.info("Moderation bypassed by rule {}", verdict.ruleId());
        }

        List<ChatMessage> conversation = withSystemPrompt(messages);
        List<ProviderResult> attempts = new ArrayList<>();

        for (int i = 0; i < providers.size(); i++) {
            LLMProvider provider = providers.get(i);
            if (!provider.isConfigured()) {
                continue;
            }
            ProviderResult result = attempt(provider, conversation, effectiveParams);

            if (result.success()) {
                ProcessedResponse processed = postProcessor.process(result.text());
                if (!processed.visibleText().isBlank()) {
                    attempts.add(result);
                    Reply reply = Reply.builder()
                            .visibleText(processed.visibleText())
                            .reasoningText(processed.reasoningText())
                            .sourceLabel(SourceLabel.provider(i + 1))
                            .model(provider.resolveModel(effectiveParams.getModel()))
                            .attempts(attempts)
                            .build();
                    log.info("✅ Reply from {} ({}) after {} attempt(s)",
                            reply.getSourceLabel(), provider.getProviderName(), attempts.size());
                    dispatchAnalytics(messages, reply);
                    return reply;
                }
                result = ProviderResult.failure(provider.getProviderName(), ErrorKind.MALFORMED_RESPONSE,
                        "Reply was empty after post-processing", result.latency());
            }

            log.warn("⚠️ Provider {} failed with {}: {}, advancing chain",
                    provider.getProviderName(), result.error(), result.errorMessage());
            attempts.add(result);
        }

        return fallbackReply(messages, attempts);
    }

    private ProviderResult attempt(LLMProvider provider, List<ChatMessage> conversation, CompletionParams params) {
        String name = provider.getProviderName();
        if (Thread.currentThread().isInterrupted()) {
            throw new RequestCancelledException(name, null);
        }

        long start = System.nanoTime();
        Future<ProviderResult> future;
        try {
            future = attemptExecutor.submit(() -> provider.complete(conversation, params));
        } catch (RejectedExecutionException e) {
            return ProviderResult.failure(name, ErrorKind.NETWORK_FAILURE,
                    "No capacity to run attempt: " + e.getMessage(), elapsedSince(start));
        }

        try {
            ProviderResult result = future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ProviderResult.failure(name, ErrorKind.MALFORMED_RESPONSE, "Provider returned no result", elapsedSince(start));
            }
            return result.withProviderName(name);

        } catch (TimeoutException e) {
            future.cancel(true);
            return ProviderResult.failure(name, ErrorKind.TIMEOUT,
                    "No response within " + attemptTimeout.toMillis() + "ms", elapsedSince(start));

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ProviderCallException failure = new ProviderCallException(
                    name, ProviderErrorMapper.fromThrowable(cause), ProviderErrorMapper.describe(cause), cause);
            log.warn("Provider {} threw instead of returning a result", name, failure);
            return ProviderResult.failure(name, failure.getErrorKind(), failure.getMessage(), elapsedSince(start));

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(name, e);
        }
    }

    private Reply fallbackReply(List<ChatMessage> messages, List<ProviderResult> attempts) {
        if (Thread.currentThread().isInterrupted()) {
            throw new RequestCancelledException(null);
        }
        if (!fallbackEnabled) {
            log.error("❌ All {} providers failed and fallback is disabled", attempts.size());
            throw new AllProvidersExhaustedException(attempts);
        }

        String text;
        try {
            ConversationContext ctx = contextAnalyzer.analyze(messages);
            text = fallbackGenerator.generate(ctx);
            log.info("🔁 All {} providers failed, using {} fallback reply", attempts.size(),
                    fallbackGenerator.familyFor(ctx));
        } catch (RuntimeException e) {
            log.error("Fallback generation failed, using last-resort reply", e);
            text = FallbackGenerator.LAST_RESORT_REPLY;
        }

        ProcessedResponse processed = postProcessor.process(text);
        Reply reply = Reply.builder()
                .visibleText(processed.visibleText().isBlank() ? FallbackGenerator.LAST_RESORT_REPLY : processed.visibleText())
                .reasoningText(processed.reasoningText())
                .sourceLabel(SourceLabel.FALLBACK)
                .attempts(attempts)
                .build();
        dispatchAnalytics(messages, reply);
        return reply;
    }

    /**
     * Checks the request and returns the latest user text.
     */
    private String validate(List<ChatMessage> messages, CompletionParams params) {
        if (messages == null || messages.isEmpty()) {
            throw new InvalidChatRequestException("Messages array is required and must not be empty");
        }
        ChatMessage latestUser = null;
        for (int i = 0; i < messages.size(); i++) {
            ChatMessage message = messages.get(i);
            if (message == null || message.getRole() == null) {
                throw new InvalidChatRequestException("Message " + i + " has no role");
            }
            if (message.isFromUser()) {
                latestUser = message;
            }
        }
        if (latestUser == null || latestUser.fullText().isBlank()) {
            throw new InvalidChatRequestException("The latest user message must contain text");
        }
        if (params.getTemperature() != null
                && (params.getTemperature() < 0.0 || params.getTemperature() > 2.0)) {
            throw new InvalidChatRequestException("temperature must be between 0 and 2");
        }
        if (params.getMaxTokens() != null && params.getMaxTokens() < 1) {
            throw new InvalidChatRequestException("max_tokens must be at least 1");
        }
        return latestUser.fullText();
    }

    private List<ChatMessage> withSystemPrompt(List<ChatMessage> messages) {
        if (systemPrompt == null || systemPrompt.isBlank()
                || messages.stream().anyMatch(m -> m.getRole() == MessageRole.SYSTEM)) {
            return messages;
        }
        List<ChatMessage> conversation = new ArrayList<>(messages.size() + 1);
        conversation.add(ChatMessage.system(systemPrompt));
        conversation.addAll(messages);
        return conversation;
    }

    private void dispatchAnalytics(List<ChatMessage> messages, Reply reply) {
        if (analyticsService == null) {
            return;
        }
        try {
            analyticsService.recordExchange(List.copyOf(messages), reply);
        } catch (RuntimeException e) {
            log.warn("Could not dispatch analytics: {}", e.getMessage());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public List<LLMProvider> getProviders() {
        return providers;
    }
}
