/*
 * どこで: Draft サービス層
 * 何を: drafting 前の conference 選択とチーム claim を検証して確定する
 * なぜ: 定員と排他の判定を DB 制約付きの更新に寄せ、競合時も二重確保させないため
 */
package com.teamdraft.draft.service;

import com.teamdraft.draft.api.DraftActionException;
import com.teamdraft.draft.api.DraftErrorCode;
import com.teamdraft.draft.config.DraftRulesProperties;
import com.teamdraft.draft.model.DraftRecord;
import com.teamdraft.draft.model.ParticipantRecord;
import com.teamdraft.draft.model.TeamSource;
import com.teamdraft.draft.repository.AssignedTeamRepository;
import com.teamdraft.draft.repository.ParticipantRepository;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ClaimResolver {

  private final ParticipantRepository participantRepository;
  private final AssignedTeamRepository assignedTeamRepository;
  private final TeamCatalog teamCatalog;
  private final DraftRulesProperties rules;

  /**
   * conference を選択する。
   *
   * @return カタログ上の正規 conference 名
   */
  public String chooseConference(DraftRecord draft, long userId, String requestedConference) {
    final ParticipantRecord participant = requireParticipant(draft, userId);
    if (participant.conferenceChosen()) {
      throw alreadyChosenConference(participant);
    }
    final String conference =
        teamCatalog
            .resolveConference(requestedConference)
            .orElseThrow(
                () ->
                    new DraftActionException(
                        DraftErrorCode.UNKNOWN_CONFERENCE,
                        "unknown conference: " + requestedConference,
                        Map.of("available_conferences", teamCatalog.conferences())));
    // draft 行ロック下のため、件数確認から更新までの間に他の参加者は割り込まない
    final int taken = participantRepository.countByConference(draft.id(), conference);
    if (taken >= rules.maxConferenceParticipants()) {
      throw new DraftActionException(
          DraftErrorCode.CONFERENCE_FULL,
          String.format(
              "%s already has %d/%d participants",
              conference, taken, rules.maxConferenceParticipants()),
          Map.of("conference", conference, "max_participants", rules.maxConferenceParticipants()));
    }
    if (participantRepository.chooseConferenceIfUnset(draft.id(), userId, conference) == 0) {
      throw new DraftActionException(
          DraftErrorCode.ALREADY_CHOSEN, "conference has already been chosen");
    }
    return conference;
  }

  /**
   * 自分の conference に属するチームを1つ claim する。
   *
   * @return カタログ上の正規チーム名
   */
  public String claimTeam(DraftRecord draft, long userId, String requestedTeam, Instant now) {
    final ParticipantRecord participant = requireParticipant(draft, userId);
    if (participant.claimed()) {
      throw new DraftActionException(
          DraftErrorCode.ALREADY_CHOSEN,
          "you have already claimed " + participant.claimedTeam(),
          Map.of("claimed_team", participant.claimedTeam()));
    }
    final String teamName =
        teamCatalog
            .resolveTeam(requestedTeam)
            .orElseThrow(
                () ->
                    new DraftActionException(
                        DraftErrorCode.TEAM_UNAVAILABLE, "unknown team: " + requestedTeam));
    final String teamConference = teamCatalog.conferenceOf(teamName).orElseThrow();
    if (!teamConference.equals(participant.conference())) {
      throw new DraftActionException(
          DraftErrorCode.TEAM_UNAVAILABLE,
          String.format(
              "%s is in %s; you can only claim a team from %s",
              teamName, teamConference, participant.conference()),
          Map.of("team_name", teamName, "conference", teamConference));
    }
    if (!assignedTeamRepository.insertIfAbsent(
        teamName, draft.id(), userId, TeamSource.CLAIM, now)) {
      throw teamTaken(DraftErrorCode.TEAM_ALREADY_CLAIMED, teamName);
    }
    if (participantRepository.claimTeamIfUnset(draft.id(), userId, teamName) == 0) {
      // 行ロック下で claimed=false を確認済みのため、ここに来るのは不整合のみ
      throw new IllegalStateException(
          "participant claim state changed under lock draftId=" + draft.id() + " userId=" + userId);
    }
    return teamName;
  }

  private ParticipantRecord requireParticipant(DraftRecord draft, long userId) {
    return participantRepository
        .find(draft.id(), userId)
        .orElseThrow(
            () ->
                new DraftActionException(
                    DraftErrorCode.NOT_A_PARTICIPANT,
                    "you are not a participant in draft " + draft.id()));
  }

  private DraftActionException alreadyChosenConference(ParticipantRecord participant) {
    return new DraftActionException(
        DraftErrorCode.ALREADY_CHOSEN,
        "you have already chosen " + participant.conference(),
        Map.of("conference", participant.conference()));
  }

  private DraftActionException teamTaken(DraftErrorCode code, String teamName) {
    return assignedTeamRepository
        .findHolder(teamName)
        .map(holder -> DraftActionException.teamTaken(code, holder))
        .orElseGet(() -> new DraftActionException(code, teamName + " is already taken"));
  }
}
