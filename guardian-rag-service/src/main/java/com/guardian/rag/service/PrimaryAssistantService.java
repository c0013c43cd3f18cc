package com.guardian.rag.service;

import com.guardian.rag.llm.ChatClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Stand-in for the assistant that end users talk to; its answers are what the
 * guardrail checks during prompt testing.
 */
@Slf4j
@Service
public class PrimaryAssistantService {

    static final String SYSTEM_PROMPT = "You are a helpful assistant in a corporate environment.";
    static final String UNAVAILABLE = "I am unable to answer this question at the moment.";

    private final ChatClient chat;

    public PrimaryAssistantService(ObjectProvider<ChatClient> chat) {
        this.chat = chat.getIfAvailable();
    }

    public String respond(String userQuery) {
        log.info("[PRIMARY] Answering question ({} chars)", userQuery.length());
        if (chat == null) {
            log.warn("[PRIMARY] No chat model configured");
            return UNAVAILABLE;
        }
        try {
            return chat.chatOnce(SYSTEM_PROMPT, userQuery, 0.7, 1024);
        } catch (RuntimeException e) {
            log.error("[PRIMARY] Error calling primary LLM: {}", e.getMessage());
            return UNAVAILABLE;
        }
    }
}
