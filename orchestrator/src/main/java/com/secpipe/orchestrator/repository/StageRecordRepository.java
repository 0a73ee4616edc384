package com.secpipe.orchestrator.repository;

import com.secpipe.orchestrator.model.StageRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD operations for the stage_results table.
 */
public interface StageRecordRepository extends JpaRepository<StageRecord, UUID> {

    /** Stage rows of a run in declaration order. */
    List<StageRecord> findByRunIdOrderByPositionAsc(UUID runId);
}
