package com.guardian.rag.evaluation.backend;

import com.guardian.rag.evaluation.EvaluationFailure;
import com.guardian.rag.evaluation.EvaluationOutcome;
import com.guardian.rag.evaluation.EvaluationReport;
import com.guardian.rag.evaluation.EvaluationRequest;
import com.guardian.rag.evaluation.SafetyEvaluator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@code evaluate} CLI command in a child process, so a crash or hang
 * in the models cannot take the serving process down with it.
 *
 * <p>The verdict is read from the child's stdout, starting at the first
 * {@code '{'}. A non-zero exit, a timeout or unparsable output is a failure.
 */
@Slf4j
public class SubprocessEvaluationBackend implements EvaluationBackend {

    private final List<String> baseCommand;
    private final Duration timeout;

    /**
     * @param baseCommand launcher for the CLI, e.g. {@code [java, -jar, guardian-rag-service.jar]}
     */
    public SubprocessEvaluationBackend(List<String> baseCommand, Duration timeout) {
        if (baseCommand == null || baseCommand.isEmpty()) {
            throw new IllegalArgumentException("Subprocess evaluation needs a command");
        }
        this.baseCommand = List.copyOf(baseCommand);
        this.timeout = timeout;
    }

    @Override
    public EvaluationOutcome evaluate(EvaluationRequest request) {
        List<String> command = buildCommand(request);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
        } catch (IOException e) {
            log.warn("GuardianAI evaluation process could not start: {}", e.getMessage());
            return EvaluationOutcome.failure(EvaluationFailure.Kind.BACKEND_PROCESS, "Failed to start: " + e.getMessage());
        }

        // Drain stdout concurrently so a chatty child cannot block on a full pipe
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("GuardianAI evaluation timed out after {}", timeout);
                return EvaluationOutcome.failure(EvaluationFailure.Kind.TIMEOUT, "Evaluation process timed out after " + timeout);
            }
            int exit = process.exitValue();
            String out = stdout.get(5, TimeUnit.SECONDS);
            if (exit != 0) {
                log.warn("GuardianAI evaluation failed with exit code {}", exit);
                return EvaluationOutcome.failure(EvaluationFailure.Kind.BACKEND_PROCESS, "Exit code " + exit);
            }
            return parseOutput(out);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return EvaluationOutcome.failure(EvaluationFailure.Kind.BACKEND_PROCESS, "Interrupted");
        } catch (ExecutionException | java.util.concurrent.TimeoutException e) {
            return EvaluationOutcome.failure(EvaluationFailure.Kind.BACKEND_PROCESS, "Could not read output: " + e.getMessage());
        }
    }

    @Override
    public String name() {
        return "subprocess";
    }

    List<String> buildCommand(EvaluationRequest request) {
        List<String> command = new ArrayList<>(baseCommand);
        command.add("evaluate");
        command.add("--collection");
        command.add(request.collection());
        command.add("--text");
        command.add(request.text());
        command.add("--top_k");
        command.add(String.valueOf(request.topK()));
        command.add("--max_ctx");
        command.add(String.valueOf(request.maxCtx()));
        if (request.rerank()) {
            command.add("--rerank");
        }
        return command;
    }

    static EvaluationOutcome parseOutput(String stdout) {
        int start = stdout == null ? -1 : stdout.indexOf('{');
        if (start < 0) {
            return EvaluationOutcome.failure(EvaluationFailure.Kind.MALFORMED_RESPONSE, "No JSON block in evaluator output");
        }
        boolean degraded = stdout.substring(0, start).contains(EvaluationReport.DEGRADED_WARNING);
        return SafetyEvaluator.parse(stdout.substring(start).trim(), List.of(), degraded);
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read evaluator output", e);
        }
    }
}
