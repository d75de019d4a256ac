package com.scorebench.evaluator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scorebench.evaluator.Fixtures;
import com.scorebench.evaluator.model.Job;
import com.scorebench.evaluator.model.JobState;
import com.scorebench.evaluator.repository.JobRepository;
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
class JobServiceTest {

    @Mock JobRepository jobRepo;

    JobService jobService;

    @BeforeEach
    void setUp() {
        jobService = new JobService(jobRepo, new ObjectMapper());
    }

    @Test
    void createEvaluationJob_storesTypedArguments() {
        when(jobRepo.save(any())).thenAnswer(inv -> Fixtures.withId(inv.getArgument(0), UUID.randomUUID()));

        Job job = jobService.createEvaluationJob(42L, true);

        assertThat(job.getTaskType()).isEqualTo("evaluate_submission");
        assertThat(job.getTaskArgs()).isEqualTo("{\"submission_id\":42,\"predict\":true}");
        assertThat(job.getState()).isEqualTo(JobState.CREATED);
    }

    @Test
    void evaluationTask_readsArgumentsBack() {
        Job job = Fixtures.job("evaluate_submission", "{\"submission_id\": 42, \"predict\": false}");

        assertThat(jobService.evaluationTask(job)).isEqualTo(new EvaluationTask(42L, false));
    }

    @Test
    void evaluationTask_otherTaskType_isRejected() {
        Job job = Fixtures.job("run", "{\"submission_id\": 42}");

        assertThatThrownBy(() -> jobService.evaluationTask(job))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("incorrect task type");
    }

    @Test
    void evaluationTask_withoutSubmissionId_isRejected() {
        Job job = Fixtures.job("evaluate_submission", "{\"predict\": true}");

        assertThatThrownBy(() -> jobService.evaluationTask(job))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getJob_unknownId_throws() {
        UUID id = UUID.randomUUID();
        when(jobRepo.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> jobService.getJob(id))
                .isInstanceOf(JobNotFoundException.class)
                .hasMessageContaining(id.toString());
    }

    @Test
    void markState_savesNewState() {
        Job job = Fixtures.job("evaluate_submission", "{}");
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));

        jobService.markState(job.getId(), JobState.FINISHED);

        assertThat(job.getState()).isEqualTo(JobState.FINISHED);
        verify(jobRepo).save(job);
    }
}
