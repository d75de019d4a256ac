package com.scorebench.evaluator.bundle;

import com.scorebench.evaluator.model.Submission;

/**
 * Storage layout of the artifacts generated for one submission:
 *
 *   competition/{competition}/{phase number}/submissions/{submission}/run.txt
 *   competition/{competition}/{phase number}/submissions/{submission}/predict/run.txt
 */
public final class SubmissionPaths {

    private SubmissionPaths() {}

    public static String scoring(Submission submission, String fileName) {
        return base(submission) + fileName;
    }

    public static String prediction(Submission submission, String fileName) {
        return base(submission) + "predict/" + fileName;
    }

    private static String base(Submission submission) {
        return "competition/" + submission.getPhase().getCompetition().getId()
                + "/" + submission.getPhase().getPhaseNumber()
                + "/submissions/" + submission.getId() + "/";
    }
}
