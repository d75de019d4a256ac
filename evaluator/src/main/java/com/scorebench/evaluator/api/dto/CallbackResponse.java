package com.scorebench.evaluator.api.dto;

import java.util.UUID;

/** Response body for POST /jobs/{jobId}/callback. */
public record CallbackResponse(UUID job_id, String state) {}
