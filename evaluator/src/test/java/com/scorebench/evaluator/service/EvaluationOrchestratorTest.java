package com.scorebench.evaluator.service;

import com.scorebench.evaluator.Fixtures;
import com.scorebench.evaluator.bundle.MissingPreconditionException;
import com.scorebench.evaluator.dispatch.DispatchException;
import com.scorebench.evaluator.model.Job;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.repository.SubmissionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EvaluationOrchestratorTest {

    @Mock SubmissionRepository submissionRepo;
    @Mock JobService           jobService;
    @Mock EvaluationPhases     phases;
    @Mock ResultReconciler     reconciler;

    EvaluationOrchestrator orchestrator;
    Submission submission;
    Job job;

    @BeforeEach
    void setUp() {
        orchestrator = new EvaluationOrchestrator(submissionRepo, jobService, phases, reconciler,
                new TaskWorkers(Runnable::run, Runnable::run));
        submission = Fixtures.submission(42L);
        job = Fixtures.job(EvaluationTask.TASK_TYPE, "{}");
        lenient().when(submissionRepo.findWithContextById(42L)).thenReturn(Optional.of(submission));
    }

    @Test
    void evaluate_withPrediction_startsPredictPhase() {
        when(jobService.createEvaluationJob(42L, true)).thenReturn(job);

        UUID jobId = orchestrator.evaluate(42L, false);

        assertThat(jobId).isEqualTo(job.getId());
        verify(phases).predict(submission, job.getId());
        verify(phases, never()).score(any(), any());
    }

    @Test
    void evaluate_scoringOnly_startsScorePhase() {
        when(jobService.createEvaluationJob(42L, false)).thenReturn(job);

        orchestrator.evaluate(42L, true);

        verify(phases).score(submission, job.getId());
        verify(phases, never()).predict(any(), any());
    }

    @Test
    void dispatchFailure_synthesizesFailedCallbackForSameJob() {
        when(jobService.createEvaluationJob(42L, true)).thenReturn(job);
        doThrow(new DispatchException("broker down")).when(phases).predict(submission, job.getId());

        orchestrator.evaluate(42L, false);

        verify(reconciler).handleCallback(job.getId(), CallbackUpdate.failed(submission.getSecret()));
    }

    @Test
    void missingPrecondition_isHandledLikeDispatchFailure() {
        when(jobService.createEvaluationJob(42L, false)).thenReturn(job);
        doThrow(new MissingPreconditionException("Results are missing.")).when(phases).score(submission, job.getId());

        orchestrator.evaluate(42L, true);

        verify(reconciler).handleCallback(job.getId(), CallbackUpdate.failed(submission.getSecret()));
    }

    @Test
    void unknownSubmission_throws() {
        when(jobService.createEvaluationJob(99L, true)).thenReturn(job);
        when(submissionRepo.findWithContextById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orchestrator.evaluate(99L, false))
                .isInstanceOf(SubmissionNotFoundException.class);
        verifyNoInteractions(phases, reconciler);
    }

    @Test
    void evaluateAsync_runsOnSiteWorkerAndContainsErrors() {
        when(jobService.createEvaluationJob(99L, true)).thenReturn(job);
        when(submissionRepo.findWithContextById(99L)).thenReturn(Optional.empty());

        orchestrator.evaluateAsync(99L, false);

        verify(jobService).createEvaluationJob(99L, true);
    }
}
