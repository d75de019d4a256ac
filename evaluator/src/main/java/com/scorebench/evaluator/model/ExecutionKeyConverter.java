package com.scorebench.evaluator.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.UUID;

/**
 * Maps {@link ExecutionKey} to the JSON text stored in submissions.execution_key.
 *
 * An empty or null column reads back as {@link ExecutionKey#NOT_STARTED};
 * NOT_STARTED is written as an empty string so freshly uploaded rows and
 * untouched rows look the same.
 */
@Converter
public class ExecutionKeyConverter implements AttributeConverter<ExecutionKey, String> {

    static final String PREDICT = "predict";
    static final String SCORE   = "score";

    private static final ObjectMapper JSON = JsonMapper.builder().build();

    @Override
    public String convertToDatabaseColumn(ExecutionKey key) {
        if (key == null || key.stage() == ExecutionKey.Stage.NOT_STARTED) {
            return "";
        }
        ObjectNode node = JSON.createObjectNode();
        if (key.predictJobId() != null) node.put(PREDICT, key.predictJobId().toString());
        if (key.scoreJobId() != null)   node.put(SCORE, key.scoreJobId().toString());
        return node.toString();
    }

    @Override
    public ExecutionKey convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return ExecutionKey.NOT_STARTED;
        }
        try {
            JsonNode node = JSON.readTree(column);
            return new ExecutionKey(uuid(node, PREDICT), uuid(node, SCORE));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable execution key: " + column, e);
        }
    }

    private static UUID uuid(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return UUID.fromString(value.asText());
    }
}
