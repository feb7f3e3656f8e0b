package com.locai.repository;

import com.locai.entity.WorkflowSnapshotRecord;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository interface for managing {@link WorkflowSnapshotRecord} entities, keyed by conversation id.
 */
public interface WorkflowSnapshotRepository extends JpaRepository<WorkflowSnapshotRecord, String> {
}
