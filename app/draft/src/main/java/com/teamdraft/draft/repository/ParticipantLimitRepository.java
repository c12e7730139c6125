/*
 * どこで: Draft データアクセス
 * 何を: participant_limits の登録と参照を行う
 * なぜ: 行が無い参加者を上限なしとして扱うため
 */
package com.teamdraft.draft.repository;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ParticipantLimitRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insertAll(long draftId, Map<Long, Integer> picksAllowedByUser) {
    if (picksAllowedByUser.isEmpty()) {
      return;
    }
    final String sql =
        """
        INSERT INTO participant_limits (draft_id, user_id, picks_allowed)
        VALUES (:draftId, :userId, :picksAllowed)
        """;
    final List<SqlParameterSource> batch =
        picksAllowedByUser.entrySet().stream()
            .map(
                entry ->
                    (SqlParameterSource)
                        new MapSqlParameterSource()
                            .addValue("draftId", draftId)
                            .addValue("userId", entry.getKey())
                            .addValue("picksAllowed", entry.getValue()))
            .toList();
    jdbcTemplate.batchUpdate(sql, batch.toArray(new SqlParameterSource[0]));
  }

  /** user_id -> picks_allowed。上限なしの参加者はキーに含まれない。 */
  public Map<Long, Integer> findByDraft(long draftId) {
    final String sql =
        """
        SELECT user_id, picks_allowed
        FROM participant_limits
        WHERE draft_id = :draftId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("draftId", draftId);
    final Map<Long, Integer> limits = new HashMap<>();
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          limits.put(rs.getLong("user_id"), rs.getInt("picks_allowed"));
        });
    return limits;
  }
}
