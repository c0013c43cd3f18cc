package com.guardian.rag.answer;

import com.guardian.rag.llm.ChatClient;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Answers a question from retrieved snippets only, citing them by index.
 * Without a chat model, or when the call fails, it returns the top snippets
 * verbatim instead.
 */
@Slf4j
public class AnswerGenerator {

    static final String SYSTEM_PROMPT = """
            You are a helpful RAG assistant. Answer the user using only the provided context snippets. \
            If the answer is not present, say you don't know. \
            Cite the snippets you used as [chunk i] using the indexes given in the context.""";

    public static final String NO_LLM_MARKER = "(LLM not configured - returning top context chunks)";

    private static final int FALLBACK_CONTEXTS = 3;

    private final ChatClient chat;
    private final int maxTokens;

    /**
     * @param chat may be {@code null}; the extractive fallback is then always used
     */
    public AnswerGenerator(ChatClient chat, int maxTokens) {
        this.chat = chat;
        this.maxTokens = maxTokens;
    }

    public String generate(String query, List<String> contexts) {
        if (chat != null) {
            try {
                return chat.chatOnce(SYSTEM_PROMPT, buildPrompt(query, contexts), 0.2, maxTokens);
            } catch (RuntimeException e) {
                log.warn("LLM answer generation failed, using extractive fallback: {}", e.getMessage());
            }
        }
        return extractiveFallback(contexts);
    }

    static String buildPrompt(String query, List<String> contexts) {
        String contextBlock = IntStream.range(0, contexts.size())
                .mapToObj(i -> "[chunk " + i + "] " + contexts.get(i))
                .collect(Collectors.joining("\n\n"));

        return """
                User question: %s

                Context snippets:
                %s

                Answer in the same language as the question.""".formatted(query, contextBlock);
    }

    static String extractiveFallback(List<String> contexts) {
        List<String> top = contexts.subList(0, Math.min(FALLBACK_CONTEXTS, contexts.size()));
        return String.join("\n", top) + "\n\n" + NO_LLM_MARKER;
    }
}
