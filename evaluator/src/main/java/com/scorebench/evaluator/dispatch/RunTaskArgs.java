package com.scorebench.evaluator.dispatch;

/**
 * Arguments of a "run" task as the compute worker reads them.
 * Component names are the wire names.
 */
public record RunTaskArgs(
        long    submission_id,
        String  docker_image,
        String  bundle_url,
        String  stdout_url,
        String  stderr_url,
        String  output_url,
        String  detailed_results_url,
        String  private_output_url,
        String  secret,
        Integer execution_time_limit,
        boolean predict
) {}
