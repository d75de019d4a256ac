package com.scorebench.evaluator.service;

import com.scorebench.evaluator.model.Submission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default notifier: writes the message that would be mailed to the log.
 * Mail delivery is handled by the site, outside this service.
 */
@Component
public class LoggingCompletionNotifier implements CompletionNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingCompletionNotifier.class);

    static final String SUBJECT = "Submission has finished successfully!";

    @Override
    public void submissionFinished(Submission submission, String competitionUrl) {
        String body = "Your submission to the competition \"" + submission.getPhase().getCompetition().getTitle()
                + "\" has finished successfully! View it here: " + competitionUrl;
        log.info("Notify {} <{}>: {} {}", submission.getParticipant().getUsername(),
                submission.getParticipant().getEmail(), SUBJECT, body);
    }
}
