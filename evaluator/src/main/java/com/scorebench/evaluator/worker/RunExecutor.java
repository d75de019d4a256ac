package com.scorebench.evaluator.worker;

import com.scorebench.evaluator.dispatch.RunTaskArgs;

import java.util.UUID;

/**
 * The sandboxed execution routine of a compute worker: fetch the bundle,
 * run it, upload stdout/stderr/output to the signed URLs and report status
 * through the callback endpoint.
 *
 * Implementations must stop promptly when their thread is interrupted.
 */
public interface RunExecutor {

    void run(UUID jobId, RunTaskArgs args) throws Exception;
}
