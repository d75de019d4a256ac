package com.scorebench.evaluator.dispatch;

/** What actually sits on the queue: the envelope plus its soft budget in seconds. */
public record QueuedRun(RunEnvelope envelope, long soft_time_limit) {}
