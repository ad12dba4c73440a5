package com.bistroAssist.queryDemo.orchestrator.service;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.context.ContextRetriever;
import com.bistroAssist.queryDemo.context.model.BusinessFacts;
import com.bistroAssist.queryDemo.context.model.ContextBundle;
import com.bistroAssist.queryDemo.context.model.ConversationSession;
import com.bistroAssist.queryDemo.context.model.ConversationTurn;
import com.bistroAssist.queryDemo.context.store.BusinessFactsStore;
import com.bistroAssist.queryDemo.context.store.ConversationStore;
import com.bistroAssist.queryDemo.intent.IntentClassifier;
import com.bistroAssist.queryDemo.intent.model.IntentResult;
import com.bistroAssist.queryDemo.llm.GenerationStream;
import com.bistroAssist.queryDemo.orchestrator.admission.QueryValidator;
import com.bistroAssist.queryDemo.orchestrator.admission.RateLimitResult;
import com.bistroAssist.queryDemo.orchestrator.admission.RateLimiter;
import com.bistroAssist.queryDemo.orchestrator.analytics.AnalyticsDispatcher;
import com.bistroAssist.queryDemo.orchestrator.analytics.QueryLogRecord;
import com.bistroAssist.queryDemo.orchestrator.analytics.QueryStatus;
import com.bistroAssist.queryDemo.orchestrator.dto.QueryRequest;
import com.bistroAssist.queryDemo.orchestrator.dto.QueryResponse;
import com.bistroAssist.queryDemo.orchestrator.exception.BusinessNotFoundException;
import com.bistroAssist.queryDemo.orchestrator.exception.ProcessingTimeoutException;
import com.bistroAssist.queryDemo.orchestrator.exception.QueryValidationException;
import com.bistroAssist.queryDemo.orchestrator.exception.RateLimitExceededException;
import com.bistroAssist.queryDemo.orchestrator.model.GeneratedAnswer;
import com.bistroAssist.queryDemo.orchestrator.model.OrchestrationState;
import com.bistroAssist.queryDemo.orchestrator.model.PipelineStage;
import com.bistroAssist.queryDemo.orchestrator.model.StepMetric;
import com.bistroAssist.queryDemo.orchestrator.streaming.QueryEventChannel;
import com.bistroAssist.queryDemo.orchestrator.streaming.StreamEvent;
import com.bistroAssist.queryDemo.orchestrator.streaming.StreamHandle;
import com.bistroAssist.queryDemo.rules.BusinessRulesEngine;
import com.bistroAssist.queryDemo.rules.model.RuleActionType;
import com.bistroAssist.queryDemo.rules.model.RuleContext;
import com.bistroAssist.queryDemo.rules.model.RuleEvaluationResult;
import com.bistroAssist.queryDemo.util.CustomerIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Query orchestrator - owns the processing of one customer query from admission to answer.
 *
 * Responsibilities:
 * - Admit the query (validation and rate limiting, on the caller thread)
 * - Resolve the business and the conversation session
 * - Classify intent, retrieve context and evaluate business rules, degrading each on failure
 * - Generate the answer (single shot or streamed), falling back to canned answers
 * - Bound the whole pipeline by the processing timeout
 * - Record conversation turns and hand analytics to the sink
 */
@Slf4j
@Service
public class QueryOrchestratorService {

    static final Duration MIN_TIMEOUT = Duration.ofSeconds(1);
    static final Duration MAX_TIMEOUT = Duration.ofSeconds(30);

    private static final double INPUT_COST_PER_1K = 0.005;
    private static final double OUTPUT_COST_PER_1K = 0.015;
    private static final double NO_CONTEXT_CONFIDENCE_FACTOR = 0.8;
    private static final double DEGRADED_INTENT_CONFIDENCE = 0.1;

    private final QueryValidator queryValidator;
    private final RateLimiter rateLimiter;
    private final BusinessFactsStore businessFactsStore;
    private final ConversationStore conversationStore;
    private final IntentClassifier intentClassifier;
    private final ContextRetriever contextRetriever;
    private final BusinessRulesEngine rulesEngine;
    private final ResponseGenerationService generationService;
    private final FallbackResponseCatalog fallbackCatalog;
    private final AnalyticsDispatcher analytics;
    private final PipelineStepRunner stepRunner;
    private final Executor pipelineExecutor;
    private final Clock clock;
    private final Duration timeout;

    public QueryOrchestratorService(QueryValidator queryValidator,
                                    RateLimiter rateLimiter,
                                    BusinessFactsStore businessFactsStore,
                                    ConversationStore conversationStore,
                                    IntentClassifier intentClassifier,
                                    ContextRetriever contextRetriever,
                                    BusinessRulesEngine rulesEngine,
                                    ResponseGenerationService generationService,
                                    FallbackResponseCatalog fallbackCatalog,
                                    AnalyticsDispatcher analytics,
                                    PipelineStepRunner stepRunner,
                                    @Qualifier("pipelineExecutor") Executor pipelineExecutor,
                                    Clock clock,
                                    AssistantProperties properties) {
        this.queryValidator = queryValidator;
        this.rateLimiter = rateLimiter;
        this.businessFactsStore = businessFactsStore;
        this.conversationStore = conversationStore;
        this.intentClassifier = intentClassifier;
        this.contextRetriever = contextRetriever;
        this.rulesEngine = rulesEngine;
        this.generationService = generationService;
        this.fallbackCatalog = fallbackCatalog;
        this.analytics = analytics;
        this.stepRunner = stepRunner;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
        this.timeout = clampTimeout(properties.getPipeline().getTimeout());
    }

    public QueryResponse processQuery(String businessId, QueryRequest request) {
        return processQuery(businessId, request, UUID.randomUUID().toString());
    }

    /**
     * Processes a query and waits for the complete answer.
     *
     * @throws QueryValidationException    if the request is invalid
     * @throws RateLimitExceededException  if the caller exceeded its quota
     * @throws BusinessNotFoundException   if the business is unknown
     * @throws ProcessingTimeoutException  if the pipeline did not finish in time
     */
    public QueryResponse processQuery(String businessId, QueryRequest request, String correlationId) {
        OrchestrationState state = newState(businessId, request, correlationId);
        log.info("Starting query processing - correlationId: {}, businessId: {}", correlationId, businessId);

        admit(state, false);

        CompletableFuture<QueryResponse> pipeline = CompletableFuture.supplyAsync(() -> runPipeline(state), pipelineExecutor);
        try {
            return pipeline.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            state.setAbandoned(true);
            pipeline.cancel(true);
            PipelineStage reached = state.getStage();
            state.setStage(PipelineStage.FAILED);
            log.error("Query processing timed out - correlationId: {}, businessId: {}, stage: {}, query: {}, steps: {}",
                    correlationId, businessId, reached, state.getQueryText(), state.getMetrics().getSteps());
            analytics.dispatchError(failureRecord(state, QueryStatus.TIMEOUT, reached, e, false), e);
            throw new ProcessingTimeoutException(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.setAbandoned(true);
            throw new IllegalStateException("Interrupted while processing query " + correlationId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Query processing failed - correlationId: " + correlationId, cause);
        }
    }

    public StreamHandle processStreamingQuery(String businessId, QueryRequest request, QueryEventChannel channel) {
        return processStreamingQuery(businessId, request, channel, UUID.randomUUID().toString());
    }

    /**
     * Starts a streamed query. Admission errors are thrown to the caller; everything after that
     * is reported through the channel.
     *
     * @return Handle that cancels the stream
     */
    public StreamHandle processStreamingQuery(String businessId, QueryRequest request,
                                              QueryEventChannel channel, String correlationId) {
        OrchestrationState state = newState(businessId, request, correlationId);
        log.info("Starting streaming query - correlationId: {}, businessId: {}", correlationId, businessId);

        admit(state, true);

        StreamHandle handle = new StreamHandle(correlationId, channel);
        FutureTask<Void> producer = new FutureTask<>(() -> produceStream(state, channel), null);
        pipelineExecutor.execute(producer);
        handle.attach(producer);

        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            if (!channel.isOpen()) {
                return;
            }
            PipelineStage reached = state.getStage();
            if (channel.finish(StreamEvent.error("PROCESSING_TIMEOUT", "Query processing exceeded " + timeout.toMillis() + " ms"))) {
                state.setAbandoned(true);
                log.error("Streaming query timed out - correlationId: {}, businessId: {}, stage: {}, query: {}, steps: {}",
                        correlationId, businessId, reached, state.getQueryText(), state.getMetrics().getSteps());
                analytics.dispatchError(failureRecord(state, QueryStatus.TIMEOUT, reached, null, true), null);
                handle.cancel();
            }
        });
        return handle;
    }

    // Admission: VALIDATING then RATE_LIMITING, both fatal
    private void admit(OrchestrationState state, boolean streaming) {
        try {
            stepRunner.runAction(state, PipelineStage.VALIDATING,
                    () -> queryValidator.validate(state.getBusinessId(), state.getRequest()));
            stepRunner.runAction(state, PipelineStage.RATE_LIMITING, () -> {
                RateLimitResult limit = rateLimiter.tryAcquire(rateLimitKey(state));
                if (!limit.allowed()) {
                    throw new RateLimitExceededException(
                            "Rate limit exceeded. Try again in " + limit.retryAfterSeconds() + " seconds",
                            limit.retryAfterSeconds());
                }
            });
        } catch (RuntimeException e) {
            log.warn("Query rejected - correlationId: {}, businessId: {}, reason: {}",
                    state.getCorrelationId(), state.getBusinessId(), e.getMessage());
            analytics.dispatch(failureRecord(state, QueryStatus.REJECTED, lastStage(state), e, streaming));
            throw e;
        }
    }

    private QueryResponse runPipeline(OrchestrationState state) {
        try {
            prepare(state);

            // Step: GENERATING - degrade to a canned answer
            GeneratedAnswer answer = stepRunner.runDegradableStep(state, PipelineStage.GENERATING,
                    () -> generationService.generate(state),
                    e -> generationService.fallbackAnswer(state));
            String text = generationService.finalizeText(answer.getText(), answer, rulesOf(state));
            answer = answer.toBuilder().text(text).build();
            state.setAnswer(answer);

            if (state.isAbandoned()) {
                log.warn("Discarding answer of abandoned query - correlationId: {}", state.getCorrelationId());
                return null;
            }
            recordTurns(state);
            QueryResponse response = buildResponse(state);
            logSuccess(state, response, false);
            return response;
        } catch (RuntimeException e) {
            handleFailure(state, e, false);
            throw e;
        }
    }

    /**
     * Session, intent, context and rules. Only the session step is fatal.
     */
    private void prepare(OrchestrationState state) {
        // Step: SESSION_RESOLVING
        stepRunner.runAction(state, PipelineStage.SESSION_RESOLVING, () -> {
            BusinessFacts facts = businessFactsStore.findBusiness(state.getBusinessId())
                    .orElseThrow(() -> new BusinessNotFoundException(state.getBusinessId()));
            state.setBusinessFacts(facts);
            QueryRequest request = state.getRequest();
            state.setSession(conversationStore.getOrCreate(state.getBusinessId(), request.getSessionId(), request.getCustomerId()));
        });

        // Step: INTENT_CLASSIFYING
        state.setIntentResult(stepRunner.runDegradableStep(state, PipelineStage.INTENT_CLASSIFYING,
                () -> intentClassifier.classify(state.getQueryText()),
                e -> IntentResult.unknown(DEGRADED_INTENT_CONFIDENCE, "Intent classification failed")));

        // Step: CONTEXT_RETRIEVING
        state.setContextBundle(stepRunner.runDegradableStep(state, PipelineStage.CONTEXT_RETRIEVING,
                () -> contextRetriever.retrieve(state.getBusinessId(), state.getQueryText(), state.getSession().getSessionId()),
                e -> ContextBundle.empty()));

        // Step: RULES_EVALUATING
        state.setRuleResult(stepRunner.runDegradableStep(state, PipelineStage.RULES_EVALUATING,
                () -> rulesEngine.evaluate(buildRuleContext(state)),
                e -> RuleEvaluationResult.empty()));

        log.info("Query prepared - correlationId: {}, sessionId: {}, intent: {}, confidence: {}, matches: {}, actions: {}",
                state.getCorrelationId(), state.getSession().getSessionId(), state.getIntentResult().getIntent(),
                state.getIntentResult().getConfidence(), state.getContextBundle().totalMatches(),
                state.getRuleResult().getAppliedActions().size());
    }

    private void produceStream(OrchestrationState state, QueryEventChannel channel) {
        try {
            prepare(state);
            if (channel.isCancelled()) {
                logCancelled(state);
                return;
            }

            GeneratedAnswer answer = stepRunner.runStep(state, PipelineStage.GENERATING, () -> streamAnswer(state, channel));
            if (answer == null) {
                logCancelled(state);
                return;
            }
            state.setAnswer(answer);
            recordTurns(state);

            // The text already went out as chunks
            QueryResponse summary = buildResponse(state);
            summary.setResponse(null);
            if (!channel.finish(StreamEvent.done(summary))) {
                logCancelled(state);
                return;
            }
            logSuccess(state, summary, true);
        } catch (RuntimeException e) {
            if (state.isAbandoned() || channel.isCancelled()) {
                log.info("Streaming query stopped after cancellation - correlationId: {}, error: {}",
                        state.getCorrelationId(), e.toString());
                return;
            }
            handleFailure(state, e, true);
            channel.finish(StreamEvent.error(errorCode(e), clientMessage(e)));
        }
    }

    /**
     * Forwards provider chunks to the channel.
     *
     * @return the complete answer, or null when the consumer went away
     */
    private GeneratedAnswer streamAnswer(OrchestrationState state, QueryEventChannel channel) {
        RuleEvaluationResult rules = rulesOf(state);
        if (rules.hasAction(RuleActionType.BLOCK_RESPONSE)) {
            GeneratedAnswer blocked = generationService.blockedAnswer(rules);
            return channel.send(StreamEvent.chunk(blocked.getText())) ? blocked : null;
        }

        GenerationStream stream = openStreamOrNull(state);
        if (stream == null) {
            GeneratedAnswer fallback = generationService.fallbackAnswer(state);
            String text = generationService.finalizeText(fallback.getText(), fallback, rules);
            return channel.send(StreamEvent.chunk(text)) ? fallback.toBuilder().text(text).build() : null;
        }

        channel.onCancel(stream::close);
        try (stream) {
            StringBuilder text = new StringBuilder();
            String prefix = generationService.streamPrefix(rules);
            if (!prefix.isEmpty()) {
                text.append(prefix);
                if (!channel.send(StreamEvent.chunk(prefix))) {
                    return null;
                }
            }
            while (stream.hasNext()) {
                String chunk = stream.next();
                if (chunk == null || chunk.isEmpty()) {
                    continue;
                }
                text.append(chunk);
                if (!channel.send(StreamEvent.chunk(chunk))) {
                    return null;
                }
            }
            if (channel.isCancelled()) {
                return null;
            }
            String suffix = generationService.streamSuffix(rules);
            if (!suffix.isEmpty()) {
                text.append(suffix);
                if (!channel.send(StreamEvent.chunk(suffix))) {
                    return null;
                }
            }
            return GeneratedAnswer.builder()
                    .text(text.toString())
                    .model(stream.model())
                    .promptTokens(stream.promptTokens())
                    .completionTokens(stream.completionTokens())
                    .build();
        }
    }

    private GenerationStream openStreamOrNull(OrchestrationState state) {
        try {
            return generationService.openStream(state);
        } catch (RuntimeException e) {
            log.warn("Could not open generation stream, sending fallback answer - correlationId: {}, error: {}",
                    state.getCorrelationId(), e.toString());
            return null;
        }
    }

    private RuleContext buildRuleContext(OrchestrationState state) {
        ContextBundle bundle = state.getContextBundle();
        QueryRequest request = state.getRequest();

        Map<String, Object> context = new LinkedHashMap<>();
        if (request.getContext() != null) {
            context.putAll(request.getContext());
        }
        context.put("menu", bundle.getMenuMatches());
        context.put("policies", bundle.getPolicyMatches());
        context.put("faqs", bundle.getFaqMatches());
        context.put("businessFacts", bundle.getBusinessFacts());
        context.put("sources", bundle.contributingSources());

        Map<String, Object> customer = new LinkedHashMap<>();
        customer.put("id", request.getCustomerId());
        customer.put("preferences", request.getPreferences() != null ? request.getPreferences() : Map.of());
        customer.put("returning", state.getSession().getTurnCount() > 0);

        return RuleContext.builder()
                .businessId(state.getBusinessId())
                .queryText(state.getQueryText())
                .intent(state.getIntentResult().getIntent())
                .intentConfidence(state.getIntentResult().getConfidence())
                .sessionId(state.getSession().getSessionId())
                .turnCount(state.getSession().getTurnCount())
                .context(context)
                .customer(customer)
                .build();
    }

    private void recordTurns(OrchestrationState state) {
        ConversationSession session = state.getSession();
        Instant now = clock.instant();
        try {
            conversationStore.appendTurn(state.getBusinessId(), session.getSessionId(),
                    ConversationTurn.user(state.getQueryText(), state.getIntentResult().getIntent(), now));
            conversationStore.appendTurn(state.getBusinessId(), session.getSessionId(),
                    ConversationTurn.assistant(state.getAnswer().getText(), now));
        } catch (RuntimeException e) {
            log.error("Failed to record conversation turns - correlationId: {}, sessionId: {}",
                    state.getCorrelationId(), session.getSessionId(), e);
        }
    }

    private QueryResponse buildResponse(OrchestrationState state) {
        GeneratedAnswer answer = state.getAnswer();
        IntentResult intent = state.getIntentResult();
        ContextBundle bundle = state.getContextBundle();
        RuleEvaluationResult rules = rulesOf(state);
        ConversationSession session = state.getSession();
        int totalTokens = answer.getPromptTokens() + answer.getCompletionTokens();

        return QueryResponse.builder()
                .response(answer.getText())
                .confidence(answerConfidence(answer, intent, bundle))
                .sources(bundle.sourceIds())
                .intent(intent.getIntent())
                .suggestedFollowUps(fallbackCatalog.suggestions(intent.getIntent()))
                .usage(QueryResponse.Usage.builder()
                        .promptTokens(answer.getPromptTokens())
                        .completionTokens(answer.getCompletionTokens())
                        .totalTokens(totalTokens)
                        .estimatedCost(estimateCost(answer.getPromptTokens(), answer.getCompletionTokens()))
                        .build())
                .session(QueryResponse.SessionInfo.builder()
                        .sessionId(session.getSessionId())
                        .turnCount(session.getTurnCount())
                        .expiresAt(session.getExpiresAt())
                        .build())
                .metadata(QueryResponse.Metadata.builder()
                        .correlationId(state.getCorrelationId())
                        .contextSources(bundle.contributingSources())
                        .model(answer.getModel())
                        .processingTimeMs(elapsedMs(state))
                        .appliedRules(rules.getApplicableRules().size())
                        .conflictsResolved(rules.getConflictsResolved())
                        .escalated(rules.hasAction(RuleActionType.ESCALATE))
                        .fallback(answer.isFallback())
                        .intentConfidence(intent.getConfidence())
                        .build())
                .build();
    }

    /**
     * Fallback answers carry a fixed confidence; otherwise intent confidence blended with the
     * mean match confidence, penalised for very short or very long answers.
     */
    static double answerConfidence(GeneratedAnswer answer, IntentResult intent, ContextBundle bundle) {
        if (answer.isFallback()) {
            return FallbackResponseCatalog.FALLBACK_CONFIDENCE;
        }
        double confidence = bundle.totalMatches() > 0
                ? (intent.getConfidence() + bundle.averageConfidence()) / 2
                : intent.getConfidence() * NO_CONTEXT_CONFIDENCE_FACTOR;
        int length = answer.getText() != null ? answer.getText().length() : 0;
        if (length < 20) {
            confidence *= 0.6;
        }
        if (length > 1000) {
            confidence *= 0.8;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    static double estimateCost(int promptTokens, int completionTokens) {
        return promptTokens / 1000.0 * INPUT_COST_PER_1K + completionTokens / 1000.0 * OUTPUT_COST_PER_1K;
    }

    static Duration clampTimeout(Duration configured) {
        if (configured == null) {
            return Duration.ofSeconds(10);
        }
        if (configured.compareTo(MIN_TIMEOUT) < 0) {
            return MIN_TIMEOUT;
        }
        return configured.compareTo(MAX_TIMEOUT) > 0 ? MAX_TIMEOUT : configured;
    }

    private void logSuccess(OrchestrationState state, QueryResponse response, boolean streaming) {
        state.setStage(PipelineStage.LOGGING);
        GeneratedAnswer answer = state.getAnswer();
        QueryStatus status = answer.isBlocked() ? QueryStatus.BLOCKED
                : answer.isFallback() ? QueryStatus.FALLBACK : QueryStatus.SUCCESS;
        analytics.dispatch(baseRecord(state, streaming)
                .status(status)
                .responseLength(answer.getText() != null ? answer.getText().length() : 0)
                .confidence(response.getConfidence())
                .model(answer.getModel())
                .contextSources(response.getMetadata().getContextSources())
                .appliedRules(response.getMetadata().getAppliedRules())
                .escalated(response.getMetadata().isEscalated())
                .promptTokens(answer.getPromptTokens())
                .completionTokens(answer.getCompletionTokens())
                .estimatedCost(response.getUsage().getEstimatedCost())
                .build());
        state.setStage(PipelineStage.DONE);
        log.info("Query completed - correlationId: {}, status: {}, intent: {}, model: {}, processingTimeMs: {}",
                state.getCorrelationId(), status, response.getIntent(), answer.getModel(), elapsedMs(state));
    }

    private void logCancelled(OrchestrationState state) {
        if (state.isAbandoned()) {
            return;
        }
        state.setAbandoned(true);
        log.info("Streaming query cancelled by consumer - correlationId: {}, stage: {}",
                state.getCorrelationId(), state.getStage());
        analytics.dispatch(failureRecord(state, QueryStatus.CANCELLED, state.getStage(), null, true));
    }

    private void handleFailure(OrchestrationState state, RuntimeException e, boolean streaming) {
        if (state.isAbandoned()) {
            return;
        }
        PipelineStage failed = lastStage(state);
        state.setStage(PipelineStage.FAILED);
        log.error("Query processing failed - correlationId: {}, businessId: {}, stage: {}, query: {}, steps: {}",
                state.getCorrelationId(), state.getBusinessId(), failed, state.getQueryText(),
                state.getMetrics().getSteps(), e);
        analytics.dispatchError(failureRecord(state, QueryStatus.ERROR, failed, e, streaming), e);
    }

    private QueryLogRecord failureRecord(OrchestrationState state, QueryStatus status, PipelineStage failedStage,
                                         Throwable error, boolean streaming) {
        return baseRecord(state, streaming)
                .status(status)
                .failedStage(failedStage)
                .errorMessage(error != null ? error.getMessage() : null)
                .build();
    }

    private QueryLogRecord.QueryLogRecordBuilder baseRecord(OrchestrationState state, boolean streaming) {
        QueryRequest request = state.getRequest();
        IntentResult intent = state.getIntentResult();
        return QueryLogRecord.builder()
                .correlationId(state.getCorrelationId())
                .businessId(state.getBusinessId())
                .sessionId(state.getSession() != null ? state.getSession().getSessionId()
                        : request != null ? request.getSessionId() : null)
                .customerId(request != null && request.getCustomerId() != null
                        ? CustomerIdMasker.mask(request.getCustomerId()) : null)
                .queryText(state.getQueryText())
                .intent(intent != null ? intent.getIntent() : null)
                .intentConfidence(intent != null ? intent.getConfidence() : 0.0)
                .streaming(streaming)
                .processingTimeMs(elapsedMs(state))
                .steps(state.getMetrics().getSteps())
                .timestamp(clock.instant());
    }

    /**
     * The stage a failure happened in, read from the recorded step metrics.
     */
    private static PipelineStage lastStage(OrchestrationState state) {
        List<StepMetric> steps = state.getMetrics().getSteps();
        return steps.isEmpty() ? PipelineStage.VALIDATING : PipelineStage.valueOf(steps.get(steps.size() - 1).stepName());
    }

    private OrchestrationState newState(String businessId, QueryRequest request, String correlationId) {
        return OrchestrationState.builder()
                .correlationId(correlationId)
                .businessId(businessId)
                .request(request != null ? request : new QueryRequest())
                .startedAt(clock.instant())
                .build();
    }

    private long elapsedMs(OrchestrationState state) {
        return Duration.between(state.getStartedAt(), clock.instant()).toMillis();
    }

    private static String rateLimitKey(OrchestrationState state) {
        QueryRequest request = state.getRequest();
        String caller = request.getCustomerId() != null ? request.getCustomerId()
                : request.getSessionId() != null ? request.getSessionId() : "anonymous";
        return state.getBusinessId() + ":" + caller;
    }

    private static RuleEvaluationResult rulesOf(OrchestrationState state) {
        return state.getRuleResult() != null ? state.getRuleResult() : RuleEvaluationResult.empty();
    }

    private static String errorCode(RuntimeException e) {
        if (e instanceof BusinessNotFoundException) {
            return "BUSINESS_NOT_FOUND";
        }
        return "INTERNAL_ERROR";
    }

    private static String clientMessage(RuntimeException e) {
        if (e instanceof BusinessNotFoundException) {
            return e.getMessage();
        }
        return "An unexpected error occurred";
    }
}
