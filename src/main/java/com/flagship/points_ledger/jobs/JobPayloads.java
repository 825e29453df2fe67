package com.flagship.points_ledger.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Payload decoding shared by handlers. A payload that cannot be read will
 * never become readable, so decoding failures are non-retryable.
 */
public final class JobPayloads {

    private JobPayloads() {
    }

    public static <T> T read(ObjectMapper objectMapper, Job job, Class<T> payloadType) {
        String payload = job.getPayload();
        if (payload == null || payload.isBlank()) {
            throw new NonRetryableJobException(job.getType() + " job has no payload");
        }
        try {
            T value = objectMapper.readValue(payload, payloadType);
            if (value == null) {
                throw new NonRetryableJobException(job.getType() + " job has a null payload");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new NonRetryableJobException(job.getType() + " job has a malformed payload", e);
        }
    }
}
