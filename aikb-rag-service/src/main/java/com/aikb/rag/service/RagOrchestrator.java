package com.aikb.rag.service;

import com.aikb.rag.audit.AuditEntry;
import com.aikb.rag.audit.AuditSink;
import com.aikb.rag.budget.BudgetController;
import com.aikb.rag.budget.RequestBudget;
import com.aikb.rag.config.RagProperties;
import com.aikb.rag.error.MalformedResponseException;
import com.aikb.rag.error.RagFailureKind;
import com.aikb.rag.error.RagQueryException;
import com.aikb.rag.error.StageTimeoutException;
import com.aikb.rag.error.UpstreamException;
import com.aikb.rag.llm.AnswerGenerator;
import com.aikb.rag.llm.EmbeddingsClient;
import com.aikb.rag.llm.GenerationRequest;
import com.aikb.rag.llm.GenerationResponse;
import com.aikb.rag.metrics.RagMetrics;
import com.aikb.rag.model.AnswerResult;
import com.aikb.rag.model.ConversationTurn;
import com.aikb.rag.model.IntegrityReport;
import com.aikb.rag.model.QueryRequest;
import com.aikb.rag.model.RetrievedMatch;
import com.aikb.rag.model.SourceCitation;
import com.aikb.rag.model.StructuredAnswer;
import com.aikb.rag.model.TokenUsage;
import com.aikb.rag.redact.PiiRedactor;
import com.aikb.rag.retrieval.SimilarityRetriever;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one question through embedding, retrieval, context assembly and generation under
 * a single request deadline, then audits the redacted outcome.
 * <p>
 * Stage failures are wrapped in {@link RagQueryException} with the kind of the stage that
 * failed. Only audit-write failures are absorbed.
 */
@Service
public class RagOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RagOrchestrator.class);

    static final String EMBEDDING_STAGE = "embedding";
    static final String RETRIEVAL_STAGE = "retrieval";
    static final String GENERATION_STAGE = "generation";

    private final EmbeddingsClient embeddings;
    private final SimilarityRetriever retriever;
    private final AnswerGenerator generator;
    private final AuditSink auditSink;
    private final PiiRedactor redactor;
    private final BudgetController budgetController;
    private final RagMetrics metrics;
    private final Clock clock;

    private final ContextAssembler contextAssembler;
    private final GeneratedAnswerParser answerParser = new GeneratedAnswerParser();
    private final IntegrityVerifier integrityVerifier = new IntegrityVerifier();

    private final RagProperties.TimeoutConfig timeouts;
    private final int topK;
    private final int tokenCeiling;
    private final int maxQueryLength;
    private final double costPerThousandTokens;

    public RagOrchestrator(EmbeddingsClient embeddings,
                           SimilarityRetriever retriever,
                           AnswerGenerator generator,
                           AuditSink auditSink,
                           PiiRedactor redactor,
                           BudgetController budgetController,
                           RagMetrics metrics,
                           RagProperties properties,
                           Clock clock) {
        this.embeddings = embeddings;
        this.retriever = retriever;
        this.generator = generator;
        this.auditSink = auditSink;
        this.redactor = redactor;
        this.budgetController = budgetController;
        this.metrics = metrics;
        this.clock = clock;

        this.timeouts = properties.getTimeouts();
        this.topK = properties.getRetrieval().getTopK();
        this.tokenCeiling = properties.getRetrieval().getTokenCeiling();
        this.maxQueryLength = properties.getQuery().getMaxLength();
        this.costPerThousandTokens = properties.getAudit().getCostPerThousandTokens();
        this.contextAssembler = new ContextAssembler(budgetController, redactor,
                properties.getRetrieval().getMinSimilarity(),
                properties.getRedaction().isRedactContext());

        log.info("[RAG] Initialized with topK={}, minSimilarity={}, tokenCeiling={}, globalTimeout={}ms",
                topK, properties.getRetrieval().getMinSimilarity(), tokenCeiling, timeouts.getGlobalMs());
    }

    /**
     * @throws com.aikb.rag.error.ValidationException when the question is blank or too long
     * @throws RagQueryException                      when any stage fails
     */
    public AnswerResult query(QueryRequest request) {
        request.validate(maxQueryLength);

        long totalStart = System.currentTimeMillis();
        String question = request.queryText();
        String redactedQuery = redactor.redactPii(question);
        RequestBudget budget = budgetController.open(tokenCeiling);
        QueryState state = QueryState.RECEIVED;

        try {
            // Embedding
            state = QueryState.EMBEDDING;
            long embedStart = System.currentTimeMillis();
            List<Double> vector;
            try {
                vector = budgetController.runStage(EMBEDDING_STAGE, budget, timeouts.getEmbeddingMs(),
                        () -> embeddings.embed(question));
            } catch (RuntimeException e) {
                throw failure(RagFailureKind.EMBEDDING_FAILED, state, e);
            }
            if (vector == null || vector.isEmpty()) {
                throw failure(RagFailureKind.EMBEDDING_FAILED, state,
                        new MalformedResponseException("Embedding backend returned an empty vector"));
            }
            long embedTime = System.currentTimeMillis() - embedStart;
            metrics.recordEmbeddingTime(embedTime);

            // Retrieval
            state = QueryState.RETRIEVING;
            long searchStart = System.currentTimeMillis();
            List<RetrievedMatch> matches;
            try {
                matches = budgetController.runStage(RETRIEVAL_STAGE, budget, timeouts.getRetrievalMs(),
                        () -> retriever.search(vector, topK));
            } catch (RuntimeException e) {
                throw failure(RagFailureKind.RETRIEVAL_FAILED, state, e);
            }
            if (matches == null) matches = List.of();
            long searchTime = System.currentTimeMillis() - searchStart;
            metrics.recordRetrievalTime(searchTime);
            log.info("[TIMING] Vector search (topK={}): {}ms, found {} results", topK, searchTime, matches.size());

            // Assembly
            state = QueryState.ASSEMBLING;
            AssembledContext context = contextAssembler.assemble(matches, budget.tokenCeiling());
            if (context.isEmpty()) {
                metrics.recordNoContext();
                log.info("[RAG] Proceeding with empty context");
            }
            if (context.truncated()) {
                metrics.recordTruncatedContext();
            }

            // Generation
            state = QueryState.GENERATING;
            long llmStart = System.currentTimeMillis();
            GenerationRequest generationRequest = new GenerationRequest(
                    question, context.context(), redactHistory(request.historyOrEmpty()), request.profileOrDefault());
            GenerationResponse response;
            StructuredAnswer answer;
            try {
                response = budgetController.runStage(GENERATION_STAGE, budget, timeouts.getGenerationMs(),
                        () -> generator.generate(generationRequest));
                if (response == null) {
                    throw new MalformedResponseException("Generator returned no response");
                }
                answer = answerParser.parse(response.text());
            } catch (StageTimeoutException | UpstreamException | MalformedResponseException e) {
                throw failure(RagFailureKind.GENERATION_FAILED, state, e);
            }
            long llmTime = System.currentTimeMillis() - llmStart;
            metrics.recordGenerationTime(llmTime);

            IntegrityReport integrity = integrityVerifier.verify(answer.citations(), context.context());
            if (!integrity.verified()) {
                log.warn("[RAG] {} of {} cited quotes not found in context",
                        integrity.unverifiedQuoteCount(), answer.citations().size());
            }

            state = QueryState.COMPLETED;
            TokenUsage usage = response.usage() != null ? response.usage() : TokenUsage.NONE;
            AnswerResult result = new AnswerResult(
                    answer.answer(),
                    context.citations(),
                    usage,
                    answer.confidence(),
                    answer.hasMissingInformation() ? answer.missingInformation() : null,
                    answer.citations(),
                    integrity,
                    context.truncated());

            audit(request, redactedQuery, AuditEntry.SUCCESS, costOf(usage), successMetadata(result));

            long totalTime = System.currentTimeMillis() - totalStart;
            metrics.recordQueryTime(totalTime);
            log.info("[TIMING] Total RAG query time: {}ms (embed={}ms, search={}ms, llm={}ms)",
                    totalTime, embedTime, searchTime, llmTime);
            return result;

        } catch (RagQueryException e) {
            onFailure(request, redactedQuery, e);
            throw e;
        } catch (RuntimeException e) {
            RagQueryException wrapped = failure(RagFailureKind.RAG_QUERY_FAILED, state, e);
            onFailure(request, redactedQuery, wrapped);
            throw wrapped;
        }
    }

    private List<ConversationTurn> redactHistory(List<ConversationTurn> history) {
        return history.stream()
                .map(turn -> turn.withContent(redactor.redactPii(turn.content())))
                .toList();
    }

    private RagQueryException failure(RagFailureKind kind, QueryState state, Throwable cause) {
        return new RagQueryException(kind, state, cause);
    }

    private void onFailure(QueryRequest request, String redactedQuery, RagQueryException e) {
        metrics.recordQueryFailure(e.getKind());
        // Cause detail stays in server logs; the query is logged redacted
        log.error("[RAG] Query failed in state {} with {}: {}",
                e.getFailedState(), e.getKind(), e.getCause() != null ? e.getCause().toString() : "-");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("failedState", e.getFailedState().name());
        metadata.put("timeout", e.isTimeout());
        audit(request, redactedQuery, e.getKind().name(), 0.0, metadata);
    }

    private void audit(QueryRequest request, String redactedQuery, String outcome,
                       double cost, Map<String, Object> metadata) {
        try {
            auditSink.log(new AuditEntry(
                    request.userIdOrAnonymous(), redactedQuery, clock.instant(), outcome, cost, metadata));
        } catch (RuntimeException e) {
            metrics.recordAuditFailure();
            log.warn("[AUDIT] Failed to write audit entry (outcome={}): {}", outcome, e.getMessage());
        }
    }

    private double costOf(TokenUsage usage) {
        return usage.totalTokens() / 1000.0 * costPerThousandTokens;
    }

    private static Map<String, Object> successMetadata(AnswerResult result) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sourceCount", result.sources().size());
        metadata.put("citedDocIds", result.sources().stream().map(SourceCitation::docId).distinct().toList());
        metadata.put("truncated", result.truncated());
        metadata.put("totalTokens", result.usage().totalTokens());
        metadata.put("integrityScore", result.integrity().integrityScore());
        return metadata;
    }
}
