package com.scorebench.evaluator;

import com.scorebench.evaluator.model.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity builders for unit tests. Ids are set reflectively because
 * the entities only get them from the database.
 */
public final class Fixtures {

    private Fixtures() {}

    public static Competition competition(long id) {
        return withId(new Competition("Image Classification"), id);
    }

    public static Phase phase(Competition competition, long id, int number) {
        Phase phase = withId(new Phase(competition, number), id);
        phase.setInputData("bundles/phase-" + number + "/input.zip");
        phase.setReferenceData("bundles/phase-" + number + "/reference.zip");
        phase.setScoringProgram("bundles/phase-" + number + "/scoring.zip");
        return phase;
    }

    public static Participant participant(long id, String username) {
        return withId(new Participant(username, username + "@example.org"), id);
    }

    public static Submission submission(long id, Participant participant, Phase phase) {
        Submission submission = withId(new Submission(participant, phase, 1, "uploads/" + id + "/submission.zip"), id);
        setField(submission, "submittedAt", Instant.parse("2024-03-01T10:15:30.123456Z"));
        return submission;
    }

    /** A submission of "alice" in phase 1 of competition 7. */
    public static Submission submission(long id) {
        Competition competition = competition(7);
        return submission(id, participant(3, "alice"), phase(competition, 11, 1));
    }

    public static Job job(String taskType, String args) {
        return withId(new Job(taskType, args), UUID.randomUUID());
    }

    public static <T> T withId(T entity, Object id) {
        setField(entity, "id", id);
        return entity;
    }

    public static void setField(Object target, String name, Object value) {
        try {
            var f = target.getClass().getDeclaredField(name);
            f.setAccessible(true);
            f.set(target, value);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
