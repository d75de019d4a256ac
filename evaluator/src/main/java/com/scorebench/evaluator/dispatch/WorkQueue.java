package com.scorebench.evaluator.dispatch;

import java.time.Duration;
import java.util.Optional;

/**
 * Broker seam between this service and the compute workers.
 */
public interface WorkQueue {

    /**
     * @throws DispatchException if the run could not be enqueued
     */
    void publish(String queueName, RunEnvelope envelope, Duration softTimeLimit, QueueRoute route);

    /**
     * Take the next run, waiting up to {@code timeout}.
     *
     * @return empty if nothing arrived in time
     */
    Optional<QueuedRun> poll(String queueName, QueueRoute route, Duration timeout);
}
