package com.scorebench.evaluator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scorebench.evaluator.model.Job;
import com.scorebench.evaluator.model.JobState;
import com.scorebench.evaluator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

/**
 * Job records: one per dispatch, used to route a worker callback back to its
 * submission.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRepository jobRepo;
    private final ObjectMapper  objectMapper;

    public JobService(JobRepository jobRepo, ObjectMapper objectMapper) {
        this.jobRepo      = jobRepo;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public Job createJob(String taskType, Map<String, ?> args) {
        String json;
        try {
            json = objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job arguments are not serializable", e);
        }
        Job job = jobRepo.save(new Job(taskType, json));
        log.debug("Created {} job {} with args {}", taskType, job.getId(), json);
        return job;
    }

    /** Mint a job for one evaluation phase of a submission. */
    public Job createEvaluationJob(long submissionId, boolean predict) {
        return createJob(EvaluationTask.TASK_TYPE, new EvaluationTask(submissionId, predict).toArgs());
    }

    @Transactional(readOnly = true)
    public Job getJob(UUID jobId) {
        return jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Parse the arguments of an evaluation job.
     *
     * @throws IllegalArgumentException if the job is of another task type
     */
    public EvaluationTask evaluationTask(Job job) {
        if (!EvaluationTask.TASK_TYPE.equals(job.getTaskType())) {
            throw new IllegalArgumentException("Job " + job.getId() + " has incorrect task type " + job.getTaskType());
        }
        try {
            return EvaluationTask.fromArgs(objectMapper.readTree(job.getTaskArgs()));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job " + job.getId() + " has unreadable arguments", e);
        }
    }

    @Transactional
    public void markState(UUID jobId, JobState state) {
        Job job = getJob(jobId);
        job.setState(state);
        jobRepo.save(job);
    }
}
