/*
 * どこで: Draft データアクセス
 * 何を: drafts の登録/行ロック/フェーズ更新/参照を行う
 * なぜ: draft 単位の操作を行ロックで直列化するため
 */
package com.teamdraft.draft.repository;

import static com.teamdraft.common.JdbcTimestampUtils.toInstant;
import static com.teamdraft.common.JdbcTimestampUtils.toTimestamp;

import com.teamdraft.draft.model.DraftRecord;
import com.teamdraft.draft.model.DraftStage;
import com.teamdraft.draft.model.DraftStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DraftRepository {

  private static final String COLUMNS =
      "id, guild_id, channel_id, status, stage, current_pick_index, created_at, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * PENDING/CONFERENCE で draft を作成する。
   *
   * <p>同一 guild に進行中 draft がある場合は部分ユニークインデックス違反となり {@code
   * DuplicateKeyException} が送出される。
   */
  public DraftRecord insert(long guildId, Long channelId, Instant now) {
    final String sql =
        """
        INSERT INTO drafts (
          guild_id,
          channel_id,
          status,
          stage,
          current_pick_index,
          created_at,
          updated_at
        ) VALUES (
          :guildId,
          :channelId,
          'PENDING',
          'CONFERENCE',
          0,
          :now,
          :now
        )
        RETURNING id, guild_id, channel_id, status, stage, current_pick_index, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("guildId", guildId)
            .addValue("channelId", channelId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<DraftRecord> lockById(long draftId) {
    // 同一 draft への操作はこの行ロックで一列に並べる
    final String sql = "SELECT " + COLUMNS + " FROM drafts WHERE id = :id FOR UPDATE";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", draftId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<DraftRecord> findById(long draftId) {
    final String sql = "SELECT " + COLUMNS + " FROM drafts WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", draftId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<DraftRecord> findCurrentByGuild(long guildId) {
    // 進行中があればそれを、なければ最新の draft を返す
    final String sql =
        """
        SELECT id, guild_id, channel_id, status, stage, current_pick_index, created_at, updated_at
        FROM drafts
        WHERE guild_id = :guildId
        ORDER BY CASE WHEN status IN ('PENDING', 'ACTIVE') THEN 0 ELSE 1 END, id DESC
        LIMIT 1
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("guildId", guildId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int updateProgress(
      long draftId, DraftStatus status, DraftStage stage, int currentPickIndex, Instant now) {
    final String sql =
        """
        UPDATE drafts
        SET status = :status,
            stage = :stage,
            current_pick_index = :currentPickIndex,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("stage", stage.name())
            .addValue("currentPickIndex", currentPickIndex)
            .addValue("now", toTimestamp(now))
            .addValue("id", draftId);
    return jdbcTemplate.update(sql, params);
  }

  public int markCancelled(long draftId, Instant now) {
    // stage は取消時点の値を残し、どこで止まったかを参照できるようにする
    final String sql =
        """
        UPDATE drafts
        SET status = 'CANCELLED',
            updated_at = :now
        WHERE id = :id
          AND status IN ('PENDING', 'ACTIVE')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("id", draftId);
    return jdbcTemplate.update(sql, params);
  }

  private DraftRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long rawChannelId = rs.getLong("channel_id");
    final Long channelId = rs.wasNull() ? null : rawChannelId;
    return new DraftRecord(
        rs.getLong("id"),
        rs.getLong("guild_id"),
        channelId,
        DraftStatus.valueOf(rs.getString("status")),
        DraftStage.valueOf(rs.getString("stage")),
        rs.getInt("current_pick_index"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
