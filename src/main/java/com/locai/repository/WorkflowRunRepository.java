package com.locai.repository;

import com.locai.entity.WorkflowRunRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Repository interface for managing {@link WorkflowRunRecord} entities.
 */
public interface WorkflowRunRepository extends JpaRepository<WorkflowRunRecord, String> {

    List<WorkflowRunRecord> findAllByOrderByCreatedAtDesc();

    List<WorkflowRunRecord> findByConversationIdOrderByCreatedAtDesc(String conversationId);
}
