package com.researchdesk.orchestrator.api;

import com.researchdesk.orchestrator.api.dto.JobProgressResponse;
import com.researchdesk.orchestrator.api.dto.JobResponse;
import com.researchdesk.orchestrator.api.dto.SubmitResearchRequest;
import com.researchdesk.orchestrator.service.ResearchOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for research jobs.
 *
 * POST   /research                submit a research query
 * GET    /research                list all jobs, oldest first
 * GET    /research/{id}           poll one job
 * GET    /research/{id}/progress  poll one job with its progress log
 * DELETE /research/{id}           delete a job, cancelling it if in flight
 */
@RestController
@RequestMapping("/research")
public class ResearchController {

    private final ResearchOrchestrator orchestrator;

    public ResearchController(ResearchOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Submit a research query. The job starts QUEUED; poll it until it is
     * completed or failed.
     *
     * Example:
     *   curl -X POST http://localhost:8080/research \
     *     -H "Content-Type: application/json" \
     *     -d '{"query":"solid state batteries","sources":"both","num_results":2}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@RequestBody SubmitResearchRequest req) {
        JobResponse job = JobResponse.from(orchestrator.submit(
                req.query(), req.sources(), req.numResults(), req.llmProvider(), req.model()));
        return ResponseEntity.status(HttpStatus.CREATED).body(job);
    }

    @GetMapping
    public List<JobResponse> list() {
        return orchestrator.list().stream()
                .map(JobResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public JobResponse get(@PathVariable UUID id) {
        return JobResponse.from(orchestrator.get(id));
    }

    @GetMapping("/{id}/progress")
    public JobProgressResponse progress(@PathVariable UUID id) {
        return JobProgressResponse.from(orchestrator.get(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        orchestrator.delete(id);
        return ResponseEntity.noContent().build();
    }
}
