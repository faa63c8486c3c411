package com.streamanalytics.core.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streamanalytics.core.error.StorageException;
import com.streamanalytics.core.model.AggregateResult;
import com.streamanalytics.core.model.AnomalyResult;
import com.streamanalytics.core.model.EventPayload;
import com.streamanalytics.core.model.Observation;

import java.util.Map;
import java.util.TreeMap;

/**
 * JSON encoding of record payloads and tag maps for the durable store.
 *
 * @since 1.0.0
 */
final class RecordCodec {

    private static final TypeReference<Map<String, String>> TAGS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    RecordCodec() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    String encodePayload(EventPayload payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to encode payload " + payload + ": " + e.getMessage(), e, false);
        }
    }

    EventPayload decodePayload(RecordKind kind, String json) {
        Class<? extends EventPayload> type = switch (kind) {
            case AGGREGATE -> AggregateResult.class;
            case ANOMALY -> AnomalyResult.class;
            case OBSERVATION -> Observation.class;
        };
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to decode " + kind + " payload: " + e.getMessage(), e, false);
        }
    }

    String encodeTags(Map<String, String> tags) {
        try {
            return mapper.writeValueAsString(new TreeMap<>(tags));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to encode tags: " + e.getMessage(), e, false);
        }
    }

    Map<String, String> decodeTags(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, TAGS_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to decode tags: " + e.getMessage(), e, false);
        }
    }
}
