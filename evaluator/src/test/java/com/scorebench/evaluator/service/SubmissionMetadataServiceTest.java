package com.scorebench.evaluator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scorebench.evaluator.Fixtures;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.model.SubmissionMetadata;
import com.scorebench.evaluator.repository.SubmissionMetadataRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubmissionMetadataServiceTest {

    @Mock SubmissionMetadataRepository metadataRepo;

    SubmissionMetadataService service;
    Submission submission;

    @BeforeEach
    void setUp() {
        service = new SubmissionMetadataService(metadataRepo, new ObjectMapper());
        submission = Fixtures.submission(42L);
        when(metadataRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void merge_firstReport_createsRecordForPhase() {
        SubmissionMetadata record = service.merge(submission, false, Map.of("hostname", "worker-3"));

        assertThat(record.isScoring()).isTrue();
        assertThat(record.getAttributes()).isEqualTo("{\"hostname\":\"worker-3\"}");
    }

    @Test
    void merge_laterReport_overridesOnlyGivenFields() {
        SubmissionMetadata existing = new SubmissionMetadata(submission, true);
        existing.setAttributes("{\"hostname\":\"worker-3\",\"elapsed\":10}");
        when(metadataRepo.findBySubmissionIdAndPredict(42L, true)).thenReturn(Optional.of(existing));

        SubmissionMetadata record = service.merge(submission, true, Map.of("elapsed", 42));

        assertThat(record).isSameAs(existing);
        assertThat(record.getAttributes()).isEqualTo("{\"hostname\":\"worker-3\",\"elapsed\":42}");
    }
}
