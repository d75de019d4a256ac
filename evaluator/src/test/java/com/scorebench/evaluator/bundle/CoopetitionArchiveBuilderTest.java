package com.scorebench.evaluator.bundle;

import com.scorebench.evaluator.Fixtures;
import com.scorebench.evaluator.model.DownloadRecord;
import com.scorebench.evaluator.model.Participant;
import com.scorebench.evaluator.model.Phase;
import com.scorebench.evaluator.model.ReactionKind;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.model.SubmissionStatus;
import com.scorebench.evaluator.repository.DownloadRecordRepository;
import com.scorebench.evaluator.repository.PhaseRepository;
import com.scorebench.evaluator.repository.SubmissionReactionRepository;
import com.scorebench.evaluator.repository.SubmissionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CoopetitionArchiveBuilderTest {

    @Mock PhaseRepository              phaseRepo;
    @Mock SubmissionRepository         submissionRepo;
    @Mock SubmissionReactionRepository reactionRepo;
    @Mock DownloadRecordRepository     downloadRepo;
    @Mock ResultsCsvExporter           resultsExporter;

    CoopetitionArchiveBuilder builder;
    Submission submission;
    Phase phase1;
    Phase phase2;

    @BeforeEach
    void setUp() {
        builder = new CoopetitionArchiveBuilder(phaseRepo, submissionRepo, reactionRepo, downloadRepo, resultsExporter);
        submission = Fixtures.submission(42L);
        phase1 = submission.getPhase();
        phase2 = Fixtures.phase(phase1.getCompetition(), 12, 2);
        when(phaseRepo.findByCompetitionIdOrderByPhaseNumberAsc(7L)).thenReturn(List.of(phase1, phase2));
        when(resultsExporter.export(phase1, true)).thenReturn("scores-1");
        when(resultsExporter.export(phase2, true)).thenReturn("scores-2");
    }

    @Test
    void build_containsPerPhaseFilesDownloadsAndCurrentUser() {
        ResultBundle archive = ResultBundle.fromZip(builder.build(submission));

        assertThat(archive.entries()).extracting(ResultBundle.Entry::name).containsExactly(
                "coopetition_phase_1.txt",
                "coopetition_phase_2.txt",
                "coopetition_scores_phase_1.txt",
                "coopetition_scores_phase_2.txt",
                "coopetition_downloads.txt",
                "current_user.txt");
        assertThat(archive.find("coopetition_scores_phase_2.txt").get().text()).isEqualTo("scores-2");
        assertThat(archive.find("current_user.txt").get().text()).isEqualTo("alice");
    }

    @Test
    void phaseFile_listsFinishedSubmissionsWithReactions() {
        Submission published = Fixtures.submission(40L);
        published.setWhenMadePublic(Instant.parse("2024-02-01T00:00:00Z"));
        published.setDownloadCount(3);
        when(submissionRepo.findByPhaseIdAndStatusOrderBySubmittedAtAsc(11L, SubmissionStatus.FINISHED))
                .thenReturn(List.of(published));
        when(reactionRepo.countBySubmissionIdAndKind(40L, ReactionKind.LIKE)).thenReturn(5L);
        when(reactionRepo.countBySubmissionIdAndKind(40L, ReactionKind.DISLIKE)).thenReturn(1L);

        ResultBundle archive = ResultBundle.fromZip(builder.build(submission));

        assertThat(archive.find("coopetition_phase_1.txt").get().text()).isEqualTo(
                String.join(",", CoopetitionArchiveBuilder.SUBMISSION_COLUMNS) + "\r\n"
              + "alice,40,2024-02-01T00:00:00Z,,,,3,1,5,1\r\n");
        assertThat(archive.find("coopetition_phase_2.txt").get().text())
                .isEqualTo(String.join(",", CoopetitionArchiveBuilder.SUBMISSION_COLUMNS) + "\r\n");
    }

    @Test
    void downloadsFile_listsEveryDownloadOfCompetition() {
        Participant bob = Fixtures.participant(4, "bob");
        Submission published = Fixtures.submission(40L);
        when(downloadRepo.findBySubmissionPhaseCompetitionIdOrderByTimestampAsc(7L)).thenReturn(List.of(
                new DownloadRecord(published, bob, Instant.parse("2024-02-02T08:30:00Z"))));

        ResultBundle archive = ResultBundle.fromZip(builder.build(submission));

        assertThat(archive.find("coopetition_downloads.txt").get().text()).isEqualTo(
                "submission_pk,submission_owner,downloaded_by,time_of_download\r\n"
              + "40,alice,bob,2024-02-02T08:30:00Z\r\n");
    }
}
