package com.scorebench.evaluator.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Arguments of an "evaluate_submission" job:
 * {"submission_id": 42, "predict": true}
 */
public record EvaluationTask(long submissionId, boolean predict) {

    public static final String TASK_TYPE = "evaluate_submission";

    public Map<String, Object> toArgs() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("submission_id", submissionId);
        args.put("predict", predict);
        return args;
    }

    public static EvaluationTask fromArgs(JsonNode args) {
        JsonNode id = args.get("submission_id");
        if (id == null || !id.canConvertToLong()) {
            throw new IllegalArgumentException("Job arguments carry no submission_id: " + args);
        }
        return new EvaluationTask(id.asLong(), args.path("predict").asBoolean(false));
    }
}
