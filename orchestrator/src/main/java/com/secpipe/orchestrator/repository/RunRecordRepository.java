package com.secpipe.orchestrator.repository;

import com.secpipe.orchestrator.model.RunRecord;
import com.secpipe.orchestrator.model.RunState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the pipeline_runs table.
 */
public interface RunRecordRepository extends JpaRepository<RunRecord, UUID> {

    /** Runs in a given state, oldest first. */
    List<RunRecord> findByStateOrderByCreatedAtAsc(RunState state);
}
