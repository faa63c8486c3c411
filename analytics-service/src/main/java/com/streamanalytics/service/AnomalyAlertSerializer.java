package com.streamanalytics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streamanalytics.core.model.AnomalyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link AnomalyResult} → JSON for the alert log.
 */
public class AnomalyAlertSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyAlertSerializer.class);

    private final ObjectMapper mapper;

    public AnomalyAlertSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @return the alert as a single-line JSON document, or an empty string if
     *         it could not be serialized
     */
    public String serialize(AnomalyResult alert) {
        try {
            return mapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize alert for {}: {}", alert.seriesKey(), e.getMessage(), e);
            return "";
        }
    }
}
