/*
 * どこで: Draft データアクセス
 * 何を: picks の追記と参照を行う
 * なぜ: pick 番号の連番を (draft_id, pick_number) の一意制約で守るため
 */
package com.teamdraft.draft.repository;

import static com.teamdraft.common.JdbcTimestampUtils.toInstant;
import static com.teamdraft.common.JdbcTimestampUtils.toTimestamp;

import com.teamdraft.draft.model.PickRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PickRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 次の pick 番号で1件追記し、採番結果を返す。
   *
   * <p>採番と INSERT を1文で行う。draft 行ロック下で呼ばれる前提のため、一意制約違反は不変条件違反を意味する。
   */
  public PickRecord append(long draftId, long userId, String teamName, Instant pickedAt) {
    final String sql =
        """
        INSERT INTO picks (draft_id, pick_number, user_id, team_name, picked_at)
        SELECT :draftId,
               COALESCE(MAX(pick_number), 0) + 1,
               :userId,
               :teamName,
               :pickedAt
        FROM picks
        WHERE draft_id = :draftId
        RETURNING draft_id, pick_number, user_id, team_name, picked_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("draftId", draftId)
            .addValue("userId", userId)
            .addValue("teamName", teamName)
            .addValue("pickedAt", toTimestamp(pickedAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public List<PickRecord> findByDraft(long draftId) {
    final String sql =
        """
        SELECT draft_id, pick_number, user_id, team_name, picked_at
        FROM picks
        WHERE draft_id = :draftId
        ORDER BY pick_number
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("draftId", draftId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** user_id -> pick 数。未 pick の参加者はキーに含まれない。 */
  public Map<Long, Integer> countByUser(long draftId) {
    final String sql =
        """
        SELECT user_id, COUNT(*) AS pick_count
        FROM picks
        WHERE draft_id = :draftId
        GROUP BY user_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("draftId", draftId);
    final Map<Long, Integer> counts = new HashMap<>();
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          counts.put(rs.getLong("user_id"), rs.getInt("pick_count"));
        });
    return counts;
  }

  private PickRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PickRecord(
        rs.getLong("draft_id"),
        rs.getInt("pick_number"),
        rs.getLong("user_id"),
        rs.getString("team_name"),
        toInstant(rs.getTimestamp("picked_at")));
  }
}
