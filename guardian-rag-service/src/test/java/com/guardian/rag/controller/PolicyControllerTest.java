package com.guardian.rag.controller;

import com.guardian.rag.entity.PolicyDocument;
import com.guardian.rag.index.IndexException;
import com.guardian.rag.ingest.IngestionException;
import com.guardian.rag.llm.EmbeddingException;
import com.guardian.rag.service.PolicyService;
import com.guardian.rag.service.PolicyService.UploadResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Tests policy upload, deletion and listing endpoints.
 */
@WebMvcTest(PolicyController.class)
class PolicyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PolicyService policyService;

    private static MockMultipartFile policyFile() {
        return new MockMultipartFile("file", "conduct.txt", "text/plain", "Do not share passwords.".getBytes());
    }

    @Nested
    @DisplayName("POST /upload-policy")
    class UploadTests {

        @Test
        @DisplayName("Should upload a policy with form defaults")
        void shouldUploadPolicy() throws Exception {
            when(policyService.upload(any(), eq("Unnamed Policy"), isNull(), isNull(), eq("medium")))
                    .thenReturn(new UploadResult("pol-1", 4));

            mockMvc.perform(multipart("/upload-policy").file(policyFile()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Policy uploaded successfully"))
                    .andExpect(jsonPath("$.id").value("pol-1"))
                    .andExpect(jsonPath("$.chunks").value(4));
        }

        @Test
        @DisplayName("Should pass form fields through")
        void shouldPassFormFields() throws Exception {
            when(policyService.upload(any(), anyString(), any(), any(), anyString()))
                    .thenReturn(new UploadResult("pol-2", 1));

            mockMvc.perform(multipart("/upload-policy").file(policyFile())
                            .param("name", "Conduct")
                            .param("description", "Workplace rules")
                            .param("keywords", "passwords,security")
                            .param("severity", "critical"))
                    .andExpect(status().isOk());

            verify(policyService).upload(any(), eq("Conduct"), eq("Workplace rules"), eq("passwords,security"), eq("critical"));
        }

        @Test
        @DisplayName("Should return 400 for rejected input")
        void shouldRejectBadInput() throws Exception {
            when(policyService.upload(any(), any(), any(), any(), any()))
                    .thenThrow(new IngestionException("Unsupported file type 'exe'"));

            mockMvc.perform(multipart("/upload-policy").file(policyFile()))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Unsupported file type 'exe'"));
        }

        @Test
        @DisplayName("Should return 500 when indexing fails")
        void shouldFailOnIndexError() throws Exception {
            when(policyService.upload(any(), any(), any(), any(), any()))
                    .thenThrow(new EmbeddingException("embed HTTP 503"));

            mockMvc.perform(multipart("/upload-policy").file(policyFile()))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.error").exists());
        }
    }

    @Nested
    @DisplayName("DELETE /delete-policy/{id}")
    class DeleteTests {

        @Test
        @DisplayName("Should delete a policy")
        void shouldDeletePolicy() throws Exception {
            mockMvc.perform(delete("/delete-policy/pol-1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Policy pol-1 deleted successfully"));

            verify(policyService).delete("pol-1");
        }

        @Test
        @DisplayName("Should return 500 when the index is unavailable")
        void shouldFailWhenIndexDown() throws Exception {
            doThrow(new IndexException("Qdrant delete failed")).when(policyService).delete("pol-1");

            mockMvc.perform(delete("/delete-policy/pol-1"))
                    .andExpect(status().isInternalServerError());
        }
    }

    @Nested
    @DisplayName("GET /policies")
    class ListTests {

        @Test
        @DisplayName("Should list policies newest first")
        void shouldListPolicies() throws Exception {
            PolicyDocument newer = PolicyDocument.builder().id("b").name("B").severity("low")
                    .collection("c").createdAt(LocalDateTime.now()).build();
            PolicyDocument older = PolicyDocument.builder().id("a").name("A").severity("high")
                    .collection("c").createdAt(LocalDateTime.now().minusDays(1)).build();
            when(policyService.list()).thenReturn(List.of(newer, older));

            mockMvc.perform(get("/policies"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(2))
                    .andExpect(jsonPath("$[0].id").value("b"))
                    .andExpect(jsonPath("$[1].severity").value("high"));
        }
    }
}
