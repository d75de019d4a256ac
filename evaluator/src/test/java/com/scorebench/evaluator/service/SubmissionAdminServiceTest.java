package com.scorebench.evaluator.service;

import com.scorebench.evaluator.Fixtures;
import com.scorebench.evaluator.model.Participant;
import com.scorebench.evaluator.model.Phase;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.model.SubmissionStatus;
import com.scorebench.evaluator.repository.PhaseRepository;
import com.scorebench.evaluator.repository.SubmissionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubmissionAdminServiceTest {

    @Mock PhaseRepository            phaseRepo;
    @Mock SubmissionRepository       submissionRepo;
    @Mock EvaluationOrchestrator     orchestrator;
    @Mock PlatformTransactionManager transactionManager;

    SubmissionAdminService admin;
    Submission submission;

    @BeforeEach
    void setUp() {
        admin = new SubmissionAdminService(phaseRepo, submissionRepo, new SubmissionStateMachine(submissionRepo),
                orchestrator, transactionManager);
        submission = Fixtures.submission(42L);
        lenient().when(submissionRepo.findWithContextById(42L)).thenReturn(Optional.of(submission));
        lenient().when(submissionRepo.findByIdForUpdate(42L)).thenReturn(Optional.of(submission));
    }

    // ------------------------------------------------------------------
    // evaluate / cancel
    // ------------------------------------------------------------------

    @Test
    void evaluate_queuesExistingSubmission() {
        admin.evaluate(42L, true);

        verify(orchestrator).evaluateAsync(42L, true);
    }

    @Test
    void evaluate_unknownSubmission_throwsBeforeQueueing() {
        when(submissionRepo.findWithContextById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> admin.evaluate(99L, false))
                .isInstanceOf(SubmissionNotFoundException.class);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void cancel_activeSubmission_isCancelled() {
        assertThat(admin.cancel(42L)).isEqualTo(SubmissionStatus.CANCELLED);
        assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.CANCELLED);
    }

    @Test
    void cancel_finishedSubmission_keepsResult() {
        submission.setStatus(SubmissionStatus.FINISHED);

        assertThat(admin.cancel(42L)).isEqualTo(SubmissionStatus.FINISHED);
    }

    // ------------------------------------------------------------------
    // rerunPhase
    // ------------------------------------------------------------------

    @Test
    void rerunPhase_clonesEachDistinctUploadOnce() {
        Phase phase = submission.getPhase();
        Participant alice = submission.getParticipant();
        Participant bob = Fixtures.participant(4, "bob");
        submission.setDockerImage("team/custom:1");
        Submission bobs = Fixtures.submission(43L, bob, phase);
        Submission aliceAgain = Fixtures.submission(44L, alice, phase);
        Fixtures.setField(aliceAgain, "fileRef", submission.getFileRef());
        Submission noUpload = Fixtures.submission(45L, bob, phase);
        Fixtures.setField(noUpload, "fileRef", "");

        when(phaseRepo.findById(11L)).thenReturn(Optional.of(phase));
        when(submissionRepo.findByPhaseIdOrderBySubmittedAtAsc(11L))
                .thenReturn(List.of(submission, bobs, aliceAgain, noUpload));
        when(submissionRepo.maxSubmissionNumber(11L, 3L)).thenReturn(2);
        when(submissionRepo.maxSubmissionNumber(11L, 4L)).thenReturn(1);
        when(submissionRepo.save(any())).thenAnswer(inv -> {
            Submission s = inv.getArgument(0);
            return Fixtures.withId(s, s.getParticipant() == alice ? 100L : 101L);
        });

        List<Long> created = admin.rerunPhase(11L);

        assertThat(created).containsExactly(100L, 101L);
        ArgumentCaptor<Submission> saved = ArgumentCaptor.forClass(Submission.class);
        verify(submissionRepo, times(2)).save(saved.capture());
        Submission aliceCopy = saved.getAllValues().get(0);
        assertThat(aliceCopy.getSubmissionNumber()).isEqualTo(3);
        assertThat(aliceCopy.getFileRef()).isEqualTo("uploads/42/submission.zip");
        assertThat(aliceCopy.getDockerImage()).isEqualTo("team/custom:1");
        assertThat(aliceCopy.getSecret()).isNotEqualTo(submission.getSecret());
        assertThat(saved.getAllValues().get(1).getSubmissionNumber()).isEqualTo(2);

        verify(transactionManager).commit(any());
        verify(orchestrator).evaluateAsync(100L, false);
        verify(orchestrator).evaluateAsync(101L, false);
    }

    @Test
    void rerunPhase_scoringOnlyPhase_skipsPrediction() {
        Phase phase = submission.getPhase();
        phase.setScoringOnly(true);
        when(phaseRepo.findById(11L)).thenReturn(Optional.of(phase));
        when(submissionRepo.findByPhaseIdOrderBySubmittedAtAsc(11L)).thenReturn(List.of(submission));
        when(submissionRepo.save(any())).thenAnswer(inv -> Fixtures.withId(inv.getArgument(0), 100L));

        admin.rerunPhase(11L);

        verify(orchestrator).evaluateAsync(100L, true);
    }

    @Test
    void rerunPhase_unknownPhase_throws() {
        when(phaseRepo.findById(77L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> admin.rerunPhase(77L))
                .isInstanceOf(PhaseNotFoundException.class);
        verify(orchestrator, never()).evaluateAsync(any(), anyBoolean());
    }
}
