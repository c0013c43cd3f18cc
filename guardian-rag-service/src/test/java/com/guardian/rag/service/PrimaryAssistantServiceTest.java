package com.guardian.rag.service;

import com.guardian.rag.llm.ChatClient;
import com.guardian.rag.llm.ChatException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PrimaryAssistantServiceTest {

    @SuppressWarnings("unchecked")
    private static ObjectProvider<ChatClient> provider(ChatClient chat) {
        ObjectProvider<ChatClient> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(chat);
        return provider;
    }

    @Test
    void testAnswerComesFromChatModel() {
        ChatClient chat = mock(ChatClient.class);
        when(chat.chatOnce(anyString(), anyString(), anyDouble(), anyInt())).thenReturn("Paris.");

        PrimaryAssistantService service = new PrimaryAssistantService(provider(chat));

        assertEquals("Paris.", service.respond("Capital of France?"));
        verify(chat).chatOnce(PrimaryAssistantService.SYSTEM_PROMPT, "Capital of France?", 0.7, 1024);
    }

    @Test
    void testFailureReturnsUnavailableMessage() {
        ChatClient chat = mock(ChatClient.class);
        when(chat.chatOnce(anyString(), anyString(), anyDouble(), anyInt())).thenThrow(new ChatException("HTTP 429"));

        assertEquals(PrimaryAssistantService.UNAVAILABLE, new PrimaryAssistantService(provider(chat)).respond("hi"));
    }

    @Test
    void testNoChatModelReturnsUnavailableMessage() {
        assertEquals(PrimaryAssistantService.UNAVAILABLE, new PrimaryAssistantService(provider(null)).respond("hi"));
    }
}
