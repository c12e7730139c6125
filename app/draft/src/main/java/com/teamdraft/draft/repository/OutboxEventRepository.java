/*
 * どこで: Draft データアクセス
 * 何を: outbox_events の追記、publish 対象の claim、結果の反映を行う
 * なぜ: draft 更新と同じトランザクションでイベントを積み、後段で確実に配信するため
 */
package com.teamdraft.draft.repository;

import static com.teamdraft.common.JdbcTimestampUtils.toTimestamp;

import com.teamdraft.draft.model.OutboxEventRecord;
import com.teamdraft.draft.model.OutboxStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OutboxEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int append(
      UUID eventId, String eventType, String aggregateKey, String payloadJson, Instant createdAt) {
    final String sql =
        """
        INSERT INTO outbox_events (
          event_id, event_type, aggregate_key, payload, status, attempt_count, created_at
        ) VALUES (
          :eventId, :eventType, :aggregateKey, :payload::jsonb, 'PENDING', 0, :createdAt
        )
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("aggregateKey", aggregateKey)
            .addValue("payload", payloadJson)
            .addValue("createdAt", toTimestamp(createdAt)));
  }

  /**
   * 送信待ちとリース切れのイベントを sequence_no 順に claim する。
   *
   * <p>複数インスタンスが同時に呼んでも SKIP LOCKED により同じ行は一方にしか渡らない。
   */
  public List<OutboxEventRecord> claimBatch(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH claimable AS (
          SELECT event_id
          FROM outbox_events
          WHERE (status = 'PENDING' AND (next_retry_at IS NULL OR next_retry_at <= :now))
             OR (status = 'IN_FLIGHT' AND (lease_until IS NULL OR lease_until <= :now))
          ORDER BY sequence_no
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE outbox_events o
        SET status = 'IN_FLIGHT',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM claimable
        WHERE o.event_id = claimable.event_id
        RETURNING o.event_id, o.sequence_no, o.event_type, o.aggregate_key,
                  o.payload::text AS payload_text, o.attempt_count
        """;
    final List<OutboxEventRecord> claimed =
        jdbcTemplate.query(
            sql,
            new MapSqlParameterSource()
                .addValue("now", toTimestamp(now))
                .addValue("leaseUntil", toTimestamp(leaseUntil))
                .addValue("lockedBy", lockedBy)
                .addValue("limit", limit),
            this::mapRow);
    // RETURNING は順序を保証しないため並べ直す
    return claimed.stream()
        .sorted(Comparator.comparingLong(OutboxEventRecord::sequenceNo))
        .toList();
  }

  public int markPublished(UUID eventId, String lockedBy, Instant publishedAt) {
    final String sql =
        """
        UPDATE outbox_events
        SET status = 'PUBLISHED',
            published_at = :publishedAt,
            last_error = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource()
            .addValue("publishedAt", toTimestamp(publishedAt))
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy));
  }

  public int markRetryOrFailed(
      UUID eventId,
      String lockedBy,
      int attemptCount,
      OutboxStatus status,
      Instant nextRetryAt,
      String lastError) {
    final String sql =
        """
        UPDATE outbox_events
        SET status = :status,
            attempt_count = :attemptCount,
            next_retry_at = :nextRetryAt,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("attemptCount", attemptCount)
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy));
  }

  public int deletePublishedBefore(Instant threshold) {
    final String sql =
        "DELETE FROM outbox_events WHERE status = 'PUBLISHED' AND published_at <= :threshold";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  public int countByStatus(OutboxStatus status) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM outbox_events WHERE status = :status",
            new MapSqlParameterSource().addValue("status", status.name()),
            Integer.class);
    return count == null ? 0 : count;
  }

  private OutboxEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OutboxEventRecord(
        UUID.fromString(rs.getString("event_id")),
        rs.getLong("sequence_no"),
        rs.getString("event_type"),
        rs.getString("aggregate_key"),
        rs.getString("payload_text"),
        rs.getInt("attempt_count"));
  }
}
