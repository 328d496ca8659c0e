package com.storefront.backend.service.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Storage format of {@link SessionRecord}: {@code {"subjectId":42}}.
 */
@Component
public class SessionRecordCodec {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public String encode(SessionRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session record", e);
        }
    }

    public SessionRecord decode(String payload) {
        SessionRecord record;
        try {
            record = objectMapper.readValue(payload, SessionRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable session record", e);
        }
        if (record.subjectId() <= 0) {
            throw new IllegalArgumentException("Session record without subject");
        }
        return record;
    }
}
