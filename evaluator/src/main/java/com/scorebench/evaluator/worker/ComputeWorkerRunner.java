package com.scorebench.evaluator.worker;

import com.scorebench.evaluator.dispatch.QueueRoute;
import com.scorebench.evaluator.dispatch.QueuedRun;
import com.scorebench.evaluator.dispatch.RunEnvelope;
import com.scorebench.evaluator.dispatch.WorkQueue;
import com.scorebench.evaluator.service.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Consumer side of the compute queue.
 *
 * Takes one run at a time, hands it to the {@link RunExecutor} and enforces
 * the soft time limit that came with it. A run that overruns its budget or
 * dies with an exception is reported as "failed" for its job and secret, so
 * the submission never waits for a callback that will not come.
 */
public class ComputeWorkerRunner {

    private static final Logger log = LoggerFactory.getLogger(ComputeWorkerRunner.class);

    private final WorkQueue            queue;
    private final RunExecutor          executor;
    private final WorkerCallbackClient callbacks;
    private final String               queueName;
    private final QueueRoute           route;
    private final Duration             pollTimeout;

    private final ExecutorService runThread = Executors.newSingleThreadExecutor();

    private volatile boolean running = true;
    private Thread loopThread;

    public ComputeWorkerRunner(WorkQueue queue,
                               RunExecutor executor,
                               WorkerCallbackClient callbacks,
                               String queueName,
                               QueueRoute route,
                               Duration pollTimeout) {
        this.queue       = queue;
        this.executor    = executor;
        this.callbacks   = callbacks;
        this.queueName   = queueName;
        this.route       = route;
        this.pollTimeout = pollTimeout;
    }

    public void start() {
        loopThread = new Thread(this::loop, "compute-worker-" + queueName);
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("Compute worker consuming '{}' (route {})", queueName, route.isolated() ? route.vhost() : "default");
    }

    public void stop() {
        running = false;
        if (loopThread != null) {
            loopThread.interrupt();
        }
        runThread.shutdownNow();
    }

    /**
     * Take and execute at most one run.
     *
     * @return true if a run was taken from the queue
     */
    public boolean pollOnce() {
        Optional<QueuedRun> next = queue.poll(queueName, route, pollTimeout);
        next.ifPresent(this::execute);
        return next.isPresent();
    }

    void execute(QueuedRun run) {
        RunEnvelope envelope = run.envelope();
        Duration budget = Duration.ofSeconds(run.soft_time_limit());

        MDC.put("jobId", envelope.id().toString());
        MDC.put("submissionId", String.valueOf(envelope.task_args().submission_id()));
        Future<?> task = runThread.submit(() -> {
            executor.run(envelope.id(), envelope.task_args());
            return null;
        });
        try {
            task.get(budget.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Run of job {} completed", envelope.id());
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Run of job {} exceeded its {}s soft time limit", envelope.id(), budget.toSeconds());
            reportFailed(envelope, null);
        } catch (ExecutionException e) {
            log.error("Run of job {} failed", envelope.id(), e.getCause());
            reportFailed(envelope, stackTrace(e.getCause()));
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
        } finally {
            MDC.remove("jobId");
            MDC.remove("submissionId");
        }
    }

    private void loop() {
        while (running) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                if (!running) return;
                log.warn("Polling '{}' failed: {}", queueName, e.getMessage());
                sleepQuietly();
            }
        }
    }

    private void reportFailed(RunEnvelope envelope, String traceback) {
        try {
            callbacks.report(envelope.id(), WorkerStatus.FAILED.wireName(), envelope.task_args().secret(), traceback);
        } catch (WorkerException e) {
            log.error("Could not report failure of job {}: {}", envelope.id(), e.getMessage());
        }
    }

    private void sleepQuietly() {
        try {
            Thread.sleep(5_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    private static String stackTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
