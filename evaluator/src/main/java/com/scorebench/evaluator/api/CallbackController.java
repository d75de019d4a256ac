package com.scorebench.evaluator.api;

import com.scorebench.evaluator.api.dto.CallbackRequest;
import com.scorebench.evaluator.api.dto.CallbackResponse;
import com.scorebench.evaluator.model.JobState;
import com.scorebench.evaluator.service.CallbackAuthenticationException;
import com.scorebench.evaluator.service.JobNotFoundException;
import com.scorebench.evaluator.service.ResultReconciler;
import com.scorebench.evaluator.service.SubmissionNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * Inbound worker callbacks.
 *
 * POST /jobs/{jobId}/callback
 *   200  {"job_id": "...", "state": "FINISHED"}
 *   400  job is not an evaluation job, or no status given
 *   403  secret does not match the submission
 *   404  unknown job or submission
 */
@RestController
@RequestMapping("/jobs")
public class CallbackController {

    private final ResultReconciler reconciler;

    public CallbackController(ResultReconciler reconciler) {
        this.reconciler = reconciler;
    }

    @PostMapping("/{jobId}/callback")
    public CallbackResponse callback(@PathVariable UUID jobId, @RequestBody CallbackRequest req) {
        if (req.status() == null || req.status().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "status is required");
        }
        try {
            JobState state = reconciler.handleCallback(jobId, req.toUpdate());
            return new CallbackResponse(jobId, state.name());
        } catch (CallbackAuthenticationException e) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, e.getMessage());
        } catch (JobNotFoundException | SubmissionNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }
}
