package com.secpipe.orchestrator.api;

import com.secpipe.orchestrator.api.dto.RunResponse;
import com.secpipe.orchestrator.api.dto.StageResponse;
import com.secpipe.orchestrator.api.dto.TriggerRunRequest;
import com.secpipe.orchestrator.model.RunRecord;
import com.secpipe.orchestrator.service.RunDispatcher;
import com.secpipe.orchestrator.service.RunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for pipeline runs.
 *
 * POST /runs               queue a run, optionally overriding stage toggles
 * GET  /runs/{id}          poll the state, version, status and report link of a run
 * GET  /runs/{id}/stages   stage results in declaration order (after the run finished)
 * POST /runs/{id}/cancel   cancel a queued or running run
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunService    runService;
    private final RunDispatcher dispatcher;

    public RunController(RunService runService, RunDispatcher dispatcher) {
        this.runService = runService;
        this.dispatcher = dispatcher;
    }

    /**
     * Queue a new run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"toggles":{"dast-deploy":false,"dast-scan":false}}'
     *
     * Returns 400 if a toggle name is unknown.
     */
    @PostMapping
    public ResponseEntity<RunResponse> trigger(@RequestBody(required = false) TriggerRunRequest req) {
        TriggerRunRequest request = req == null ? new TriggerRunRequest(null) : req;
        RunRecord run;
        try {
            run = runService.create(request.toggles());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        dispatcher.dispatch(run.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
    }

    /** Returns 404 if the run ID is not found. */
    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return runService.findById(id)
                .map(RunResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    /** Returns 404 if the run ID is not found. */
    @GetMapping("/{id}/stages")
    public List<StageResponse> getStages(@PathVariable UUID id) {
        runService.findById(id).orElseThrow(() -> notFound(id));
        return runService.getStages(id).stream()
                .map(StageResponse::from)
                .toList();
    }

    /**
     * Cancel a run.
     *
     * HTTP 202  cancellation requested; poll GET /runs/{id} for the final state
     * HTTP 404  run ID not found
     * HTTP 409  run already finished
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<RunResponse> cancel(@PathVariable UUID id) {
        RunRecord run = runService.findById(id).orElseThrow(() -> notFound(id));
        if (run.getState().isTerminal()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Run " + id + " already finished: " + run.getState());
        }
        if (!dispatcher.cancel(id)) {
            // Left over from a previous process; nothing is executing it.
            runService.markFailed(id, true);
        }
        return ResponseEntity.accepted().body(RunResponse.from(runService.findById(id).orElse(run)));
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id);
    }
}
