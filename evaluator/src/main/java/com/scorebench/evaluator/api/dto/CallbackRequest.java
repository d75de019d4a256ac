package com.scorebench.evaluator.api.dto;

import com.scorebench.evaluator.service.CallbackUpdate;

import java.util.Map;

/**
 * Body of POST /jobs/{jobId}/callback, as sent by compute workers:
 *
 *   {"status": "finished", "secret": "...", "extra": {"traceback": "...", "metadata": {...}}}
 *
 * extra and both of its fields are optional.
 */
public record CallbackRequest(String status, String secret, Extra extra) {

    public record Extra(String traceback, Map<String, Object> metadata) {}

    public CallbackUpdate toUpdate() {
        String traceback = extra == null ? null : extra.traceback();
        Map<String, Object> metadata = extra == null ? null : extra.metadata();
        return new CallbackUpdate(status, secret, traceback, metadata);
    }
}
