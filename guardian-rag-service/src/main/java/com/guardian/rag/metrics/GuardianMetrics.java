package com.guardian.rag.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Counters and timers for ingestion, retrieval and evaluation.
 */
@Component
public class GuardianMetrics {

    private final MeterRegistry registry;

    private final Timer ingestTimer;
    private final Timer retrievalTimer;
    private final Timer evaluationTimer;

    private final Counter chunksIndexedCounter;
    private final Counter degradedCounter;

    public GuardianMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.ingestTimer = Timer.builder("guardian.ingest.duration")
                .description("Time to embed and upsert one document or directory")
                .tags("operation", "ingest")
                .register(registry);

        this.retrievalTimer = Timer.builder("guardian.retrieval.duration")
                .description("Query embedding plus vector search")
                .tags("component", "retriever")
                .register(registry);

        this.evaluationTimer = Timer.builder("guardian.evaluation.duration")
                .description("End-to-end safety evaluation")
                .tags("operation", "evaluate")
                .register(registry);

        this.chunksIndexedCounter = Counter.builder("guardian.ingest.chunks")
                .description("Chunks written to the vector index")
                .register(registry);

        this.degradedCounter = Counter.builder("guardian.evaluation.degraded")
                .description("Evaluations that found no policy context")
                .register(registry);
    }

    public void recordIngest(int chunks, long timeMs) {
        chunksIndexedCounter.increment(chunks);
        ingestTimer.record(timeMs, TimeUnit.MILLISECONDS);
    }

    public void recordRetrieval(long timeMs) {
        retrievalTimer.record(timeMs, TimeUnit.MILLISECONDS);
    }

    public void recordEvaluationTime(long timeMs) {
        evaluationTimer.record(timeMs, TimeUnit.MILLISECONDS);
    }

    public void recordVerdict(String safetyLevel) {
        registry.counter("guardian.evaluation.verdicts", "level", safetyLevel).increment();
    }

    /**
     * A failed evaluation that was answered with the fail-safe verdict.
     */
    public void recordFailSafe(String failureKind) {
        registry.counter("guardian.evaluation.failsafe", "kind", failureKind).increment();
    }

    public void recordDegraded() {
        degradedCounter.increment();
    }
}
