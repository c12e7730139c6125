/*
 * どこで: Draft データアクセス
 * 何を: assigned_teams への条件付き登録と保持者参照、解放を行う
 * なぜ: team_name 主キーへの INSERT を唯一の排他点にし、事前の空き確認を不要にするため
 */
package com.teamdraft.draft.repository;

import static com.teamdraft.common.JdbcTimestampUtils.toTimestamp;

import com.teamdraft.draft.model.TeamHolder;
import com.teamdraft.draft.model.TeamSource;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AssignedTeamRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 未割当なら登録して true。既に誰かが保持していれば何もせず false。 */
  public boolean insertIfAbsent(
      String teamName, long draftId, long userId, TeamSource source, Instant assignedAt) {
    final String sql =
        """
        INSERT INTO assigned_teams (team_name, draft_id, user_id, source, assigned_at)
        VALUES (:teamName, :draftId, :userId, :source, :assignedAt)
        ON CONFLICT (team_name) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("teamName", teamName)
            .addValue("draftId", draftId)
            .addValue("userId", userId)
            .addValue("source", source.name())
            .addValue("assignedAt", toTimestamp(assignedAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  /** 保持者と、pick で得たものならその pick 番号を返す。 */
  public Optional<TeamHolder> findHolder(String teamName) {
    final String sql =
        """
        SELECT a.team_name, a.draft_id, a.user_id, a.source, p.pick_number
        FROM assigned_teams a
        LEFT JOIN picks p
          ON p.draft_id = a.draft_id
         AND p.team_name = a.team_name
        WHERE a.team_name = :teamName
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("teamName", teamName);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) -> {
              final int pickNumber = rs.getInt("pick_number");
              return new TeamHolder(
                  rs.getString("team_name"),
                  rs.getLong("draft_id"),
                  rs.getLong("user_id"),
                  TeamSource.valueOf(rs.getString("source")),
                  rs.wasNull() ? null : pickNumber);
            })
        .stream()
        .findFirst();
  }

  public Set<String> findAllTeamNames() {
    final String sql = "SELECT team_name FROM assigned_teams";
    return new TreeSet<>(
        jdbcTemplate.queryForList(sql, new MapSqlParameterSource(), String.class));
  }

  public int deleteByDraft(long draftId) {
    final String sql = "DELETE FROM assigned_teams WHERE draft_id = :draftId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("draftId", draftId);
    return jdbcTemplate.update(sql, params);
  }
}
