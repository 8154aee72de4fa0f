package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.DeliveryRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Map;

/**
 * JDBC access to notification_deliveries.
 * The unique constraint on (notification_id, channel) decides duplicates, not the exists check.
 */
@Repository
@RequiredArgsConstructor
public class NotificationDeliveryRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public boolean exists(String channel, String notificationId) {
        String sql = """
                SELECT EXISTS (
                    SELECT 1 FROM notification_deliveries
                    WHERE channel = :channel AND notification_id = :notificationId
                )
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("channel", channel)
                .addValue("notificationId", notificationId);
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
    }

    /**
     * @return false if the pair was already recorded
     */
    public boolean insertIfAbsent(DeliveryRecord record) {
        String sql = """
                INSERT INTO notification_deliveries (notification_id, event_id, channel, payload, delivered_at)
                VALUES (:notificationId, :eventId, :channel, CAST(:payload AS jsonb), :deliveredAt)
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("notificationId", record.getNotificationId())
                .addValue("eventId", record.getEventId())
                .addValue("channel", record.getChannel())
                .addValue("payload", toJson(record.getPayload()))
                .addValue("deliveredAt", Timestamp.from(record.getDeliveredAt()));
        try {
            return jdbcTemplate.update(sql, params) > 0;
        } catch (DuplicateKeyException ex) {
            return false;
        }
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload != null ? payload : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Delivery payload is not serializable: " + e.getMessage(), e);
        }
    }
}
