package com.scorebench.evaluator.api;

import com.scorebench.evaluator.service.PhaseNotFoundException;
import com.scorebench.evaluator.service.SubmissionAdminService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * POST /phases/{id}/rerun  re-evaluate every distinct submission of a phase
 */
@RestController
@RequestMapping("/phases")
public class PhaseController {

    private final SubmissionAdminService submissions;

    public PhaseController(SubmissionAdminService submissions) {
        this.submissions = submissions;
    }

    @PostMapping("/{id}/rerun")
    public ResponseEntity<Map<String, Object>> rerun(@PathVariable Long id) {
        List<Long> created;
        try {
            created = submissions.rerunPhase(id);
        } catch (PhaseNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
        return ResponseEntity.accepted()
                .body(Map.of("phaseId", id, "queued", created.size(), "submissionIds", created));
    }
}
