/*
 * どこで: Draft サービス層
 * 何を: drafting 中の pick を検証し、チーム確保と pick 追記を行う
 * なぜ: 手番・上限・排他をすべて満たした場合だけ1件の pick を確定させるため
 */
package com.teamdraft.draft.service;

import com.teamdraft.draft.api.DraftActionException;
import com.teamdraft.draft.api.DraftErrorCode;
import com.teamdraft.draft.config.DraftRulesProperties;
import com.teamdraft.draft.model.DraftRecord;
import com.teamdraft.draft.model.ParticipantRecord;
import com.teamdraft.draft.model.PickRecord;
import com.teamdraft.draft.model.TeamSource;
import com.teamdraft.draft.repository.AssignedTeamRepository;
import com.teamdraft.draft.repository.PickRepository;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PickResolver {

  private final AssignedTeamRepository assignedTeamRepository;
  private final PickRepository pickRepository;
  private final TeamCatalog teamCatalog;
  private final TurnTracker turnTracker;
  private final DraftRulesProperties rules;

  public PickRecord makePick(
      DraftRecord draft, TurnState state, long userId, String requestedTeam, Instant now) {
    final ParticipantRecord picker =
        state
            .participant(userId)
            .orElseThrow(
                () ->
                    new DraftActionException(
                        DraftErrorCode.NOT_A_PARTICIPANT,
                        "you are not a participant in draft " + draft.id()));
    final ParticipantRecord expected = turnTracker.whoseTurn(state, draft.currentPickIndex());
    if (expected.userId() != userId) {
      throw new DraftActionException(
          DraftErrorCode.NOT_YOUR_TURN,
          "it is not your turn; waiting for user " + expected.userId(),
          Map.of("expected_user_id", expected.userId()));
    }
    if (state.reachedLimit(userId)) {
      final int allowed = state.picksAllowed(userId).orElseThrow();
      throw new DraftActionException(
          DraftErrorCode.LIMIT_REACHED,
          String.format(
              "you have already made %d picks and reached your limit (%d)",
              state.pickCount(userId), allowed),
          Map.of("picks_made", state.pickCount(userId), "picks_allowed", allowed));
    }
    final String teamName = resolveEligibleTeam(picker, requestedTeam);
    // 空き確認は行わず、主キー付き INSERT の成否だけで判定する
    if (!assignedTeamRepository.insertIfAbsent(
        teamName, draft.id(), userId, TeamSource.PICK, now)) {
      throw assignedTeamRepository
          .findHolder(teamName)
          .map(holder -> DraftActionException.teamTaken(DraftErrorCode.TEAM_UNAVAILABLE, holder))
          .orElseGet(
              () ->
                  new DraftActionException(
                      DraftErrorCode.TEAM_UNAVAILABLE, teamName + " is already taken"));
    }
    try {
      return pickRepository.append(draft.id(), userId, teamName, now);
    } catch (DuplicateKeyException ex) {
      throw new IllegalStateException(
          "pick number collided under draft lock draftId=" + draft.id(), ex);
    }
  }

  private String resolveEligibleTeam(ParticipantRecord picker, String requestedTeam) {
    final String teamName =
        teamCatalog
            .resolveTeam(requestedTeam)
            .orElseThrow(
                () ->
                    new DraftActionException(
                        DraftErrorCode.TEAM_UNAVAILABLE, "unknown team: " + requestedTeam));
    if (rules.restrictPicksToConference()) {
      final String teamConference = teamCatalog.conferenceOf(teamName).orElseThrow();
      if (!teamConference.equals(picker.conference())) {
        throw new DraftActionException(
            DraftErrorCode.TEAM_UNAVAILABLE,
            String.format(
                "%s is in %s; picks are limited to %s",
                teamName, teamConference, picker.conference()),
            Map.of("team_name", teamName, "conference", teamConference));
      }
    }
    return teamName;
  }
}
