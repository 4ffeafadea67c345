package com.minicrm.backend.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Publishes segment lifecycle events to Redis Pub/Sub so other services (campaign
 * scheduling, dashboards) can react to audience changes.
 */
@Component
public class SegmentEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SegmentEventPublisher.class);

    public static final String SEGMENT_EVENTS_CHANNEL = "mini-crm:segment-events";

    public enum EventType {
        SEGMENT_CREATED,
        SEGMENT_UPDATED,
        SEGMENT_DELETED,
        AUDIENCE_RECALCULATED
    }

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public SegmentEventPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Publish an event to the segment events channel. Failures are logged, never thrown.
     */
    public void publishEvent(String segmentId, EventType eventType, Map<String, Object> payload) {
        try {
            SegmentEventMessage message = new SegmentEventMessage(segmentId, eventType.name(), payload);
            String json = objectMapper.writeValueAsString(message);

            redisTemplate.convertAndSend(SEGMENT_EVENTS_CHANNEL, json);
            log.debug("[PUB/SUB] Published {} event for segment: {}", eventType, segmentId);
        } catch (Exception e) {
            log.error("[PUB/SUB] Failed to publish {} event for segment: {}", eventType, segmentId, e);
        }
    }

    /**
     * Message wrapper for Redis Pub/Sub.
     */
    public record SegmentEventMessage(String segmentId, String eventType, Map<String, Object> payload) {
    }
}
