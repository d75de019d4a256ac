package com.scorebench.evaluator.dispatch;

import com.scorebench.evaluator.model.Competition;

/**
 * Where on the broker a run goes: the shared default namespace, or a
 * competition's isolated one so its workload cannot starve other competitions.
 *
 * Resolved once per dispatch and passed to {@link WorkQueue#publish}.
 */
public record QueueRoute(String vhost) {

    public static final QueueRoute DEFAULT = new QueueRoute(null);

    public static QueueRoute forCompetition(Competition competition) {
        String vhost = competition.getQueueVhost();
        return vhost == null || vhost.isBlank() ? DEFAULT : new QueueRoute(vhost.strip());
    }

    public boolean isolated() {
        return vhost != null;
    }

    /** Metric tag value. */
    public String tag() {
        return isolated() ? "vhost" : "default";
    }
}
