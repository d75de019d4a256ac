package com.scorebench.evaluator.service;

import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The two in-process task queues of the evaluation pipeline:
 *
 *   site-worker         evaluations started by the site (upload, re-run)
 *   submission-updates  worker callbacks and synthesized failures
 *
 * Each is a fixed thread pool so a burst of callbacks cannot starve
 * evaluations and the other way round.
 */
@Component
public class TaskWorkers {

    private final Executor siteWorker;
    private final Executor submissionUpdates;

    @Autowired
    public TaskWorkers(@Value("${scorebench.task-workers.site-worker:4}") int siteWorkerThreads,
                       @Value("${scorebench.task-workers.submission-updates:4}") int updateThreads) {
        this(Executors.newFixedThreadPool(siteWorkerThreads),
             Executors.newFixedThreadPool(updateThreads));
    }

    /** Tests pass {@code Runnable::run} to execute tasks inline. */
    public TaskWorkers(Executor siteWorker, Executor submissionUpdates) {
        this.siteWorker        = siteWorker;
        this.submissionUpdates = submissionUpdates;
    }

    public void siteWorker(Runnable task) {
        siteWorker.execute(task);
    }

    public void submissionUpdates(Runnable task) {
        submissionUpdates.execute(task);
    }

    @PreDestroy
    void shutdown() {
        shutdown(siteWorker);
        shutdown(submissionUpdates);
    }

    private static void shutdown(Executor executor) {
        if (executor instanceof ExecutorService) {
            ((ExecutorService) executor).shutdown();
        }
    }
}
