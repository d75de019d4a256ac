package com.scorebench.evaluator.api;

import com.scorebench.evaluator.api.dto.SubmissionResponse;
import com.scorebench.evaluator.service.SubmissionAdminService;
import com.scorebench.evaluator.service.SubmissionNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * REST API for submission evaluation.
 *
 * POST /submissions/{id}/evaluate?scoringOnly=false  queue an evaluation
 * GET  /submissions/{id}                              current status and pipeline stage
 * POST /submissions/{id}/cancel                       move to CANCELLED unless already terminal
 */
@RestController
@RequestMapping("/submissions")
public class SubmissionController {

    private final SubmissionAdminService submissions;

    public SubmissionController(SubmissionAdminService submissions) {
        this.submissions = submissions;
    }

    /**
     * Example:
     *   curl -X POST "http://localhost:8080/submissions/42/evaluate?scoringOnly=true"
     */
    @PostMapping("/{id}/evaluate")
    public ResponseEntity<Map<String, Object>> evaluate(@PathVariable Long id,
                                                        @RequestParam(defaultValue = "false") boolean scoringOnly) {
        try {
            submissions.evaluate(id, scoringOnly);
        } catch (SubmissionNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
        return ResponseEntity.accepted()
                .body(Map.of("submissionId", id, "scoringOnly", scoringOnly, "status", "queued"));
    }

    @GetMapping("/{id}")
    public SubmissionResponse get(@PathVariable Long id) {
        try {
            return SubmissionResponse.from(submissions.find(id));
        } catch (SubmissionNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @PostMapping("/{id}/cancel")
    public SubmissionResponse cancel(@PathVariable Long id) {
        try {
            submissions.cancel(id);
            return SubmissionResponse.from(submissions.find(id));
        } catch (SubmissionNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }
}
