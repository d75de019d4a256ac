package com.scorebench.evaluator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scorebench.evaluator.model.Submission;
import com.scorebench.evaluator.model.SubmissionMetadata;
import com.scorebench.evaluator.repository.SubmissionMetadataRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Run metadata reported by workers (timings, resource usage, ...), one record
 * per submission and phase. New fields are merged over the stored ones.
 */
@Service
public class SubmissionMetadataService {

    private final SubmissionMetadataRepository metadataRepo;
    private final ObjectMapper                 objectMapper;

    public SubmissionMetadataService(SubmissionMetadataRepository metadataRepo, ObjectMapper objectMapper) {
        this.metadataRepo = metadataRepo;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public SubmissionMetadata merge(Submission submission, boolean predict, Map<String, Object> fields) {
        SubmissionMetadata record = metadataRepo.findBySubmissionIdAndPredict(submission.getId(), predict)
                .orElseGet(() -> new SubmissionMetadata(submission, predict));

        ObjectNode merged = objectMapper.createObjectNode();
        try {
            if (record.getAttributes() != null && !record.getAttributes().isBlank()) {
                JsonNode stored = objectMapper.readTree(record.getAttributes());
                if (stored.isObject()) {
                    merged.setAll((ObjectNode) stored);
                }
            }
            merged.setAll((ObjectNode) objectMapper.valueToTree(fields));
            record.setAttributes(objectMapper.writeValueAsString(merged));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable metadata for submission " + submission.getId(), e);
        }
        return metadataRepo.save(record);
    }
}
