package com.guardian.rag.repository;

import com.guardian.rag.entity.PolicyDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PolicyDocumentRepository extends JpaRepository<PolicyDocument, String> {

    List<PolicyDocument> findAllByOrderByCreatedAtDesc();
}
