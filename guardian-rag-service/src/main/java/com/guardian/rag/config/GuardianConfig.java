package com.guardian.rag.config;

import com.guardian.rag.answer.AnswerGenerator;
import com.guardian.rag.chunk.WordWindowChunker;
import com.guardian.rag.evaluation.SafetyEvaluator;
import com.guardian.rag.evaluation.SafetyPipeline;
import com.guardian.rag.evaluation.backend.EvaluationBackend;
import com.guardian.rag.evaluation.backend.InProcessEvaluationBackend;
import com.guardian.rag.evaluation.backend.SubprocessEvaluationBackend;
import com.guardian.rag.index.Distance;
import com.guardian.rag.index.IndexManager;
import com.guardian.rag.index.VectorIndex;
import com.guardian.rag.ingest.DocumentLoader;
import com.guardian.rag.llm.ChatClient;
import com.guardian.rag.llm.EmbeddingsClient;
import com.guardian.rag.metrics.GuardianMetrics;
import com.guardian.rag.rerank.RerankerService;
import com.guardian.rag.retrieval.Retriever;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Ingestion, retrieval and evaluation pipeline beans.
 */
@Configuration
public class GuardianConfig {

    @Bean
    public WordWindowChunker wordWindowChunker(
            @Value("${guardian.chunking.size:800}") int size,
            @Value("${guardian.chunking.overlap:120}") int overlap
    ) {
        return new WordWindowChunker(size, overlap);
    }

    @Bean
    public DocumentLoader documentLoader(WordWindowChunker chunker) {
        return new DocumentLoader(chunker);
    }

    @Bean
    public IndexManager indexManager(
            VectorIndex index,
            EmbeddingsClient embeddings,
            GuardianMetrics metrics,
            @Value("${guardian.index.batch-size:128}") int batchSize,
            @Value("${guardian.index.distance:cosine}") String distance
    ) {
        return new IndexManager(index, embeddings, batchSize, Distance.fromString(distance), metrics);
    }

    @Bean
    public Retriever retriever(EmbeddingsClient embeddings, VectorIndex index, GuardianMetrics metrics) {
        return new Retriever(embeddings, index, metrics);
    }

    @Bean
    public AnswerGenerator answerGenerator(
            ObjectProvider<ChatClient> chat,
            @Value("${guardian.answer.max-tokens:512}") int maxTokens
    ) {
        return new AnswerGenerator(chat.getIfAvailable(), maxTokens);
    }

    @Bean
    public SafetyEvaluator safetyEvaluator(
            ObjectProvider<ChatClient> chat,
            @Value("${guardian.evaluation.temperature:0.1}") double temperature
    ) {
        return new SafetyEvaluator(chat.getIfAvailable(), temperature);
    }

    @Bean
    public SafetyPipeline safetyPipeline(Retriever retriever, RerankerService reranker,
                                         SafetyEvaluator evaluator, GuardianMetrics metrics) {
        return new SafetyPipeline(retriever, reranker, evaluator, metrics);
    }

    @Bean
    @ConditionalOnProperty(name = "guardian.evaluation.backend", havingValue = "in-process", matchIfMissing = true)
    public EvaluationBackend inProcessEvaluationBackend(SafetyPipeline pipeline) {
        return new InProcessEvaluationBackend(pipeline);
    }

    @Bean
    @ConditionalOnProperty(name = "guardian.evaluation.backend", havingValue = "subprocess")
    public EvaluationBackend subprocessEvaluationBackend(
            @Value("${guardian.evaluation.subprocess.command}") String command,
            @Value("${guardian.evaluation.subprocess.timeout:60s}") Duration timeout
    ) {
        List<String> baseCommand = Arrays.stream(command.trim().split("\\s+")).toList();
        return new SubprocessEvaluationBackend(baseCommand, timeout);
    }
}
