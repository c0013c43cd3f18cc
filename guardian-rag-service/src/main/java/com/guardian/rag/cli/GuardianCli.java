package com.guardian.rag.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.guardian.rag.answer.AnswerGenerator;
import com.guardian.rag.evaluation.EvaluationReport;
import com.guardian.rag.evaluation.EvaluationRequest;
import com.guardian.rag.index.ChunkPayload;
import com.guardian.rag.index.IndexException;
import com.guardian.rag.index.IndexManager;
import com.guardian.rag.index.PolicyMetadata;
import com.guardian.rag.index.ScoredCandidate;
import com.guardian.rag.ingest.DocumentChunk;
import com.guardian.rag.ingest.DocumentLoader;
import com.guardian.rag.ingest.IngestionException;
import com.guardian.rag.json.Json;
import com.guardian.rag.llm.EmbeddingException;
import com.guardian.rag.llm.EmbeddingsClientFactory;
import com.guardian.rag.rerank.RerankerService;
import com.guardian.rag.retrieval.Retriever;
import com.guardian.rag.service.GuardianService;
import com.guardian.rag.service.GuardianVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Command line entry point, active in the {@code cli} profile. Progress goes
 * to stdout without braces so that the evaluation JSON printed last can be
 * located by its first '{'. Logs go to stderr.
 */
@Slf4j
@Component
@Profile("cli")
public class GuardianCli implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_INGESTION = 1;
    static final int EXIT_INDEX = 2;

    private record CommandSpec(Set<String> options, Set<String> flags) {}

    private static final Map<String, CommandSpec> COMMANDS = Map.of(
            "index", new CommandSpec(Set.of("--collection", "--data_dir", "--embedding_model"), Set.of()),
            "add-document", new CommandSpec(Set.of("--collection", "--filepath", "--metadata", "--embedding_model"), Set.of()),
            "delete-document", new CommandSpec(Set.of("--collection", "--doc_id"), Set.of()),
            "query", new CommandSpec(Set.of("--collection", "--query", "--top_k", "--max_ctx"), Set.of("--rerank", "--show_context")),
            "evaluate", new CommandSpec(Set.of("--collection", "--text", "--top_k", "--max_ctx"), Set.of("--rerank"))
    );

    private static final Map<String, String> ALIASES = Map.of("-q", "--query");

    private final DocumentLoader loader;
    private final IndexManager indexManager;
    private final EmbeddingsClientFactory embeddingsFactory;
    private final Retriever retriever;
    private final RerankerService reranker;
    private final AnswerGenerator answerGenerator;
    private final GuardianService guardianService;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    @Autowired
    public GuardianCli(DocumentLoader loader, IndexManager indexManager, EmbeddingsClientFactory embeddingsFactory,
                       Retriever retriever, RerankerService reranker, AnswerGenerator answerGenerator,
                       GuardianService guardianService) {
        this(loader, indexManager, embeddingsFactory, retriever, reranker, answerGenerator, guardianService, System.out);
    }

    GuardianCli(DocumentLoader loader, IndexManager indexManager, EmbeddingsClientFactory embeddingsFactory,
                Retriever retriever, RerankerService reranker, AnswerGenerator answerGenerator,
                GuardianService guardianService, PrintStream out) {
        this.loader = loader;
        this.indexManager = indexManager;
        this.embeddingsFactory = embeddingsFactory;
        this.retriever = retriever;
        this.reranker = reranker;
        this.answerGenerator = answerGenerator;
        this.guardianService = guardianService;
        this.out = out;
    }

    public static boolean isCommand(String arg) {
        return COMMANDS.containsKey(arg);
    }

    static CliArguments parse(String... args) {
        if (args.length == 0 || !isCommand(args[0])) {
            throw new CliUsageException("Usage: <" + String.join("|", COMMANDS.keySet().stream().sorted().toList()) + "> [options]");
        }
        CommandSpec spec = COMMANDS.get(args[0]);
        return CliArguments.parse(args, spec.options(), spec.flags(), ALIASES);
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String... args) {
        try {
            CliArguments cli = parse(args);
            switch (cli.command()) {
                case "index" -> index(cli);
                case "add-document" -> addDocument(cli);
                case "delete-document" -> deleteDocument(cli);
                case "query" -> query(cli);
                case "evaluate" -> evaluate(cli);
                default -> throw new CliUsageException("Unknown command: " + cli.command());
            }
            return EXIT_OK;
        } catch (CliUsageException | IllegalArgumentException | IngestionException e) {
            out.println("Error: " + e.getMessage());
            return EXIT_INGESTION;
        } catch (EmbeddingException | IndexException e) {
            log.error("Command failed", e);
            out.println("Error: " + e.getMessage());
            return EXIT_INDEX;
        }
    }

    private void index(CliArguments cli) {
        String collection = cli.require("--collection");
        Path dataDir = Path.of(cli.require("--data_dir"));

        out.println("-> Discovering files...");
        List<DocumentChunk> chunks = loader.loadDirectory(dataDir);
        out.println("-> Built " + chunks.size() + " chunks from " + dataDir);
        if (chunks.isEmpty()) {
            throw new IngestionException("No supported documents with text found in " + dataDir);
        }

        out.println("-> Indexing into '" + collection + "'");
        int written = managerFor(cli).upsert(collection, chunks, PolicyMetadata.empty());
        out.println("Indexed " + written + " chunks into '" + collection + "'");
    }

    private void addDocument(CliArguments cli) {
        String collection = cli.require("--collection");
        Path file = Path.of(cli.require("--filepath"));
        PolicyMetadata metadata = PolicyMetadata.parseJson(cli.get("--metadata"));
        String docId = metadata.policyId().orElseGet(() -> UUID.randomUUID().toString());

        out.println("-> Processing document: " + file);
        List<DocumentChunk> chunks = loader.loadFile(file, docId);

        IndexManager manager = managerFor(cli);
        int written = manager.upsert(collection, chunks, metadata);
        out.println("Indexed " + written + " chunks into '" + collection + "' as doc_id " + docId
                + ". Total points: " + manager.count(collection));
    }

    private void deleteDocument(CliArguments cli) {
        String collection = cli.require("--collection");
        String docId = cli.require("--doc_id");

        indexManager.deleteByDocId(collection, docId);
        out.println("Deleted doc_id " + docId + " from '" + collection + "'. Total points: " + indexManager.count(collection));
    }

    private void query(CliArguments cli) {
        String collection = cli.require("--collection");
        String query = cli.require("--query");
        int topK = cli.getInt("--top_k", 8);
        int maxCtx = cli.getInt("--max_ctx", 4);

        out.println("-> Searching in collection '" + collection + "'...");
        List<ScoredCandidate> hits = retriever.search(collection, query, topK);
        if (cli.flag("--rerank")) {
            hits = reranker.rerank(query, hits);
        }
        List<String> contexts = hits.stream()
                .limit(Math.max(0, maxCtx))
                .map(GuardianCli::citedContext)
                .toList();

        String answer = answerGenerator.generate(query, contexts);
        out.println();
        out.println("=== Answer ===");
        out.println();
        out.println(answer);

        if (cli.flag("--show_context")) {
            out.println();
            out.println("=== Top Contexts ===");
            out.println();
            for (int i = 0; i < hits.size(); i++) {
                ScoredCandidate hit = hits.get(i);
                ChunkPayload payload = hit.payload();
                out.printf("#%d score=%.4f src=%s#%d%n", i + 1, hit.score(), payload.source(), payload.chunkIndex());
                String text = hit.text();
                out.println(text.length() > 500 ? text.substring(0, 500) : text);
                out.println();
            }
        }
    }

    static String citedContext(ScoredCandidate hit) {
        return hit.text() + "\n[source: " + hit.payload().source() + "#" + hit.payload().chunkIndex() + "]\n";
    }

    private void evaluate(CliArguments cli) {
        String collection = cli.require("--collection");
        String text = cli.require("--text");
        EvaluationRequest request = new EvaluationRequest(
                collection,
                text,
                cli.getInt("--top_k", EvaluationRequest.DEFAULT_TOP_K),
                cli.getInt("--max_ctx", EvaluationRequest.DEFAULT_MAX_CTX),
                cli.flag("--rerank"));

        out.println("-> Evaluating text against collection '" + collection + "'...");
        GuardianVerdict verdict = guardianService.evaluate(request);
        if (verdict.degraded()) {
            out.println();
            out.println(EvaluationReport.DEGRADED_WARNING);
        }

        out.println();
        out.println("=== GuardianAI Evaluation ===");
        out.println();
        try {
            out.println(Json.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(verdict.evaluation()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize evaluation", e);
        }
    }

    private IndexManager managerFor(CliArguments cli) {
        String model = cli.get("--embedding_model");
        return model == null || model.isBlank() ? indexManager : indexManager.withEmbeddings(embeddingsFactory.create(model));
    }
}
