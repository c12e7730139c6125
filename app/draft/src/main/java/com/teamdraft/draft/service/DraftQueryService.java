/*
 * どこで: Draft サービス層
 * 何を: draft 状態、空きチーム、conference 枠、conference ごとの保持チームを組み立てる
 * なぜ: チャット連携側の参照系コマンドに、ロックを取らない読み取り専用で応えるため
 */
package com.teamdraft.draft.service;

import com.teamdraft.draft.api.DraftActionException;
import com.teamdraft.draft.api.DraftErrorCode;
import com.teamdraft.draft.api.response.AvailableTeamsResponse;
import com.teamdraft.draft.api.response.ConferenceRostersResponse;
import com.teamdraft.draft.api.response.ConferenceSlotsResponse;
import com.teamdraft.draft.api.response.DraftResponse;
import com.teamdraft.draft.api.response.ParticipantResponse;
import com.teamdraft.draft.api.response.PickResponse;
import com.teamdraft.draft.config.DraftRulesProperties;
import com.teamdraft.draft.model.DraftRecord;
import com.teamdraft.draft.model.DraftStatus;
import com.teamdraft.draft.model.ParticipantRecord;
import com.teamdraft.draft.model.PickRecord;
import com.teamdraft.draft.repository.AssignedTeamRepository;
import com.teamdraft.draft.repository.DraftRepository;
import com.teamdraft.draft.repository.PickRepository;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DraftQueryService {

  static final String UNASSIGNED = "(unassigned)";

  private final DraftRepository draftRepository;
  private final PickRepository pickRepository;
  private final AssignedTeamRepository assignedTeamRepository;
  private final TurnStateLoader turnStateLoader;
  private final TurnTracker turnTracker;
  private final TeamCatalog teamCatalog;
  private final DraftRulesProperties rules;

  public DraftResponse getDraft(long draftId) {
    return toResponse(requireDraft(draftId));
  }

  public DraftResponse currentDraft(long guildId) {
    final DraftRecord draft =
        draftRepository
            .findCurrentByGuild(guildId)
            .orElseThrow(
                () ->
                    new DraftActionException(
                        DraftErrorCode.DRAFT_NOT_FOUND, "guild " + guildId + " has no drafts"));
    return toResponse(draft);
  }

  public AvailableTeamsResponse availableTeams(long draftId, String conferenceFilter) {
    requireDraft(draftId);
    final Set<String> assigned = assignedTeamRepository.findAllTeamNames();
    final List<AvailableTeamsResponse.ConferenceTeams> conferences = new ArrayList<>();
    int total = 0;
    for (String conference : selectConferences(conferenceFilter)) {
      final List<String> teams =
          teamCatalog.teamsOf(conference).stream().filter(t -> !assigned.contains(t)).toList();
      total += teams.size();
      conferences.add(new AvailableTeamsResponse.ConferenceTeams(conference, teams));
    }
    return new AvailableTeamsResponse(draftId, total, conferences);
  }

  public ConferenceSlotsResponse conferenceSlots(long draftId) {
    requireDraft(draftId);
    final TurnState state = turnStateLoader.load(draftId);
    final int max = rules.maxConferenceParticipants();
    final List<ConferenceSlotsResponse.ConferenceSlot> slots = new ArrayList<>();
    for (String conference : teamCatalog.conferences()) {
      final List<Long> userIds =
          state.participants().stream()
              .filter(p -> conference.equals(p.conference()))
              .map(ParticipantRecord::userId)
              .toList();
      slots.add(new ConferenceSlotsResponse.ConferenceSlot(conference, userIds, userIds.size(), max));
    }
    final List<Long> unassigned =
        state.participants().stream()
            .filter(p -> !p.conferenceChosen())
            .map(ParticipantRecord::userId)
            .toList();
    return new ConferenceSlotsResponse(draftId, max, slots, unassigned);
  }

  public ConferenceRostersResponse conferenceRosters(long draftId, String conferenceFilter) {
    requireDraft(draftId);
    final TurnState state = turnStateLoader.load(draftId);
    // conference -> user_id -> 保持チーム(claim が先頭)
    final Map<String, Map<Long, List<String>>> rosters = new LinkedHashMap<>();
    for (ParticipantRecord participant : state.participants()) {
      final List<String> teams =
          rosters
              .computeIfAbsent(keyOf(participant), ignored -> new LinkedHashMap<>())
              .computeIfAbsent(participant.userId(), ignored -> new ArrayList<>());
      if (participant.claimedTeam() != null) {
        teams.add(participant.claimedTeam());
      }
    }
    for (PickRecord pick : pickRepository.findByDraft(draftId)) {
      state
          .participant(pick.userId())
          .ifPresent(
              participant ->
                  rosters.get(keyOf(participant)).get(pick.userId()).add(pick.teamName()));
    }
    final List<String> conferences =
        conferenceFilter == null || conferenceFilter.isBlank()
            ? orderedRosterKeys(rosters)
            : selectConferences(conferenceFilter);
    final List<ConferenceRostersResponse.ConferenceRoster> result = new ArrayList<>();
    for (String conference : conferences) {
      final List<ConferenceRostersResponse.UserRoster> users =
          rosters.getOrDefault(conference, Map.of()).entrySet().stream()
              .map(e -> new ConferenceRostersResponse.UserRoster(e.getKey(), List.copyOf(e.getValue())))
              .toList();
      result.add(new ConferenceRostersResponse.ConferenceRoster(conference, users));
    }
    return new ConferenceRostersResponse(draftId, result);
  }

  private List<String> orderedRosterKeys(Map<String, Map<Long, List<String>>> rosters) {
    // カタログ順に並べ、未選択の参加者は末尾にまとめる
    final List<String> keys = new ArrayList<>();
    for (String conference : teamCatalog.conferences()) {
      if (rosters.containsKey(conference)) {
        keys.add(conference);
      }
    }
    if (rosters.containsKey(UNASSIGNED)) {
      keys.add(UNASSIGNED);
    }
    return keys;
  }

  private List<String> selectConferences(String conferenceFilter) {
    if (conferenceFilter == null || conferenceFilter.isBlank()) {
      return teamCatalog.conferences();
    }
    return List.of(
        teamCatalog
            .resolveConference(conferenceFilter)
            .orElseThrow(
                () ->
                    new DraftActionException(
                        DraftErrorCode.UNKNOWN_CONFERENCE,
                        "unknown conference: " + conferenceFilter,
                        Map.of("available_conferences", teamCatalog.conferences()))));
  }

  private static String keyOf(ParticipantRecord participant) {
    return participant.conference() == null ? UNASSIGNED : participant.conference();
  }

  private DraftRecord requireDraft(long draftId) {
    return draftRepository
        .findById(draftId)
        .orElseThrow(() -> DraftOrchestrator.draftNotFound(draftId));
  }

  private DraftResponse toResponse(DraftRecord draft) {
    final TurnState state = turnStateLoader.load(draft.id());
    Long currentTurnUserId = null;
    if (draft.status() == DraftStatus.ACTIVE && state.size() > 0) {
      // 次の pick 時に飛ばされる参加者ではなく、実際に pick できる参加者を返す
      final int index =
          turnTracker
              .firstEligible(state, draft.currentPickIndex())
              .orElse(draft.currentPickIndex());
      currentTurnUserId = turnTracker.whoseTurn(state, index).userId();
    }
    final List<ParticipantResponse> participants =
        state.participants().stream()
            .map(
                p ->
                    new ParticipantResponse(
                        p.userId(),
                        p.pickOrder(),
                        p.conference(),
                        p.claimedTeam(),
                        state.pickCount(p.userId()),
                        state.picksAllowed(p.userId()).orElse(null)))
            .toList();
    final List<PickResponse> picks =
        pickRepository.findByDraft(draft.id()).stream()
            .map(p -> new PickResponse(p.pickNumber(), p.userId(), p.teamName(), p.pickedAt()))
            .toList();
    return new DraftResponse(
        draft.id(),
        draft.guildId(),
        draft.channelId(),
        draft.status().name(),
        draft.stage().name(),
        draft.currentPickIndex(),
        currentTurnUserId,
        draft.createdAt(),
        draft.updatedAt(),
        participants,
        picks);
  }
}
