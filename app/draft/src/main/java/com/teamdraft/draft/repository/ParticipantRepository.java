/*
 * どこで: Draft データアクセス
 * 何を: participants の登録と conference/claim の条件付き更新を行う
 * なぜ: 選択済み判定を UPDATE の WHERE 句に寄せ、競合時も二重選択させないため
 */
package com.teamdraft.draft.repository;

import com.teamdraft.draft.model.ParticipantRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ParticipantRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insertAll(long draftId, List<Long> userIds) {
    final String sql =
        """
        INSERT INTO participants (
          draft_id,
          user_id,
          pick_order,
          conference,
          conference_chosen,
          claimed_team,
          claimed
        ) VALUES (
          :draftId,
          :userId,
          :pickOrder,
          NULL,
          FALSE,
          NULL,
          FALSE
        )
        """;
    // pick_order は渡された並び順をそのまま採用する
    final SqlParameterSource[] batch = new SqlParameterSource[userIds.size()];
    for (int i = 0; i < userIds.size(); i++) {
      batch[i] =
          new MapSqlParameterSource()
              .addValue("draftId", draftId)
              .addValue("userId", userIds.get(i))
              .addValue("pickOrder", i);
    }
    jdbcTemplate.batchUpdate(sql, batch);
  }

  public List<ParticipantRecord> findByDraft(long draftId) {
    final String sql =
        """
        SELECT draft_id, user_id, pick_order, conference, conference_chosen, claimed_team, claimed
        FROM participants
        WHERE draft_id = :draftId
        ORDER BY pick_order
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("draftId", draftId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<ParticipantRecord> find(long draftId, long userId) {
    final String sql =
        """
        SELECT draft_id, user_id, pick_order, conference, conference_chosen, claimed_team, claimed
        FROM participants
        WHERE draft_id = :draftId
          AND user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("draftId", draftId).addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int countByConference(long draftId, String conference) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM participants
        WHERE draft_id = :draftId
          AND conference = :conference
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("draftId", draftId).addValue("conference", conference);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int chooseConferenceIfUnset(long draftId, long userId, String conference) {
    final String sql =
        """
        UPDATE participants
        SET conference = :conference,
            conference_chosen = TRUE
        WHERE draft_id = :draftId
          AND user_id = :userId
          AND conference_chosen = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("conference", conference)
            .addValue("draftId", draftId)
            .addValue("userId", userId);
    return jdbcTemplate.update(sql, params);
  }

  public int claimTeamIfUnset(long draftId, long userId, String teamName) {
    final String sql =
        """
        UPDATE participants
        SET claimed_team = :teamName,
            claimed = TRUE
        WHERE draft_id = :draftId
          AND user_id = :userId
          AND claimed = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("teamName", teamName)
            .addValue("draftId", draftId)
            .addValue("userId", userId);
    return jdbcTemplate.update(sql, params);
  }

  private ParticipantRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ParticipantRecord(
        rs.getLong("draft_id"),
        rs.getLong("user_id"),
        rs.getInt("pick_order"),
        rs.getString("conference"),
        rs.getBoolean("conference_chosen"),
        rs.getString("claimed_team"),
        rs.getBoolean("claimed"));
  }
}
