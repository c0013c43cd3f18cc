package com.guardian.rag.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "policy_documents")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyDocument {

    // Same value as the doc_id stored on every chunk of the policy
    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 500)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(length = 1000)
    private String keywords;

    @Column(nullable = false, length = 16)
    private String severity;

    private String filename;

    @Column(nullable = false)
    private String collection;

    private int chunkCount;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
