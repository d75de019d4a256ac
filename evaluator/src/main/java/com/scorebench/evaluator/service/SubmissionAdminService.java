package com.scorebench.evaluator.service;

import com.scorebench.evaluator.model.Phase;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.model.SubmissionStatus;
import com.scorebench.evaluator.repository.PhaseRepository;
import com.scorebench.evaluator.repository.SubmissionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Submission operations behind the HTTP API: lookup, cancel, re-run a whole phase.
 */
@Service
public class SubmissionAdminService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionAdminService.class);

    private final PhaseRepository        phaseRepo;
    private final SubmissionRepository   submissionRepo;
    private final SubmissionStateMachine stateMachine;
    private final EvaluationOrchestrator orchestrator;
    private final TransactionTemplate    tx;

    public SubmissionAdminService(PhaseRepository phaseRepo,
                                  SubmissionRepository submissionRepo,
                                  SubmissionStateMachine stateMachine,
                                  EvaluationOrchestrator orchestrator,
                                  PlatformTransactionManager transactionManager) {
        this.phaseRepo      = phaseRepo;
        this.submissionRepo = submissionRepo;
        this.stateMachine   = stateMachine;
        this.orchestrator   = orchestrator;
        this.tx             = new TransactionTemplate(transactionManager);
    }

    /**
     * @return the submission with participant, phase and competition loaded
     */
    public Submission find(Long submissionId) {
        return submissionRepo.findWithContextById(submissionId)
                .orElseThrow(() -> new SubmissionNotFoundException(submissionId));
    }

    /** Queue an evaluation of an existing submission. */
    public void evaluate(Long submissionId, boolean scoringOnly) {
        find(submissionId);
        orchestrator.evaluateAsync(submissionId, scoringOnly);
    }

    /**
     * Evaluate every distinct uploaded bundle of a phase again.
     *
     * Each bundle gets a fresh submission (next submission number of its
     * participant, new secret); submissions sharing the same upload are run
     * once. Evaluations are queued after the new rows are committed.
     *
     * @return ids of the new submissions
     */
    public List<Long> rerunPhase(Long phaseId) {
        RerunBatch batch = tx.execute(status -> cloneSubmissions(phaseId));
        for (Long id : batch.submissionIds()) {
            orchestrator.evaluateAsync(id, batch.scoringOnly());
        }
        log.info("Re-running {} submissions of phase {}", batch.submissionIds().size(), phaseId);
        return batch.submissionIds();
    }

    /**
     * Cancel a submission. A running worker is not interrupted; its later
     * callbacks are ignored because CANCELLED is terminal.
     *
     * @return the status after the call
     */
    public SubmissionStatus cancel(Long submissionId) {
        if (stateMachine.transition(submissionId, SubmissionStatus.CANCELLED)) {
            log.info("Submission {} cancelled", submissionId);
            return SubmissionStatus.CANCELLED;
        }
        return find(submissionId).getStatus();
    }

    private RerunBatch cloneSubmissions(Long phaseId) {
        Phase phase = phaseRepo.findById(phaseId)
                .orElseThrow(() -> new PhaseNotFoundException(phaseId));

        Set<String> seen = new HashSet<>();
        List<Long> created = new ArrayList<>();
        for (Submission original : submissionRepo.findByPhaseIdOrderBySubmittedAtAsc(phaseId)) {
            String fileRef = original.getFileRef();
            if (fileRef == null || fileRef.isBlank() || !seen.add(fileRef)) {
                continue;
            }
            int next = submissionRepo.maxSubmissionNumber(phaseId, original.getParticipant().getId()) + 1;
            Submission copy = new Submission(original.getParticipant(), phase, next, fileRef);
            copy.setDockerImage(original.getDockerImage());
            created.add(submissionRepo.save(copy).getId());
        }
        return new RerunBatch(created, phase.isScoringOnly());
    }

    private record RerunBatch(List<Long> submissionIds, boolean scoringOnly) {}
}
