package com.scorebench.evaluator.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scorebench.evaluator.dispatch.QueueRoute;
import com.scorebench.evaluator.dispatch.WorkQueue;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Runs this process as a compute worker as well. Needs a {@link RunExecutor}
 * bean supplied by the deployment.
 *
 *   scorebench.worker.enabled=true
 *   scorebench.worker.vhost=<competition namespace>   (optional)
 */
@Configuration
@ConditionalOnProperty(name = "scorebench.worker.enabled", havingValue = "true")
public class WorkerConfig {

    @Bean
    public WorkerCallbackClient workerCallbackClient(
            @Value("${scorebench.worker.callback-base-url}") String baseUrl,
            ObjectMapper objectMapper) {
        return new WorkerCallbackClient(baseUrl, objectMapper);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ComputeWorkerRunner computeWorkerRunner(
            WorkQueue queue,
            RunExecutor runExecutor,
            WorkerCallbackClient callbacks,
            @Value("${scorebench.queue.compute-queue:compute-worker}") String queueName,
            @Value("${scorebench.worker.vhost:}") String vhost,
            @Value("${scorebench.worker.poll-timeout:PT5S}") Duration pollTimeout) {
        QueueRoute route = vhost.isBlank() ? QueueRoute.DEFAULT : new QueueRoute(vhost.strip());
        return new ComputeWorkerRunner(queue, runExecutor, callbacks, queueName, route, pollTimeout);
    }
}
