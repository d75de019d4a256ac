package com.scorebench.evaluator.service;

import com.scorebench.evaluator.model.Submission;

/**
 * Tells a participant that their submission finished successfully.
 * Called once per submission, only for participants who opted in.
 */
public interface CompletionNotifier {

    void submissionFinished(Submission submission, String competitionUrl);
}
