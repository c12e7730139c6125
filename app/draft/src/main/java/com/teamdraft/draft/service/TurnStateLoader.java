/*
 * どこで: Draft サービス層
 * 何を: DB の現在値から TurnState を組み立てる
 * なぜ: pick 数や残りチームをプロセス内に保持せず、毎回トランザクション内で読み直すため
 */
package com.teamdraft.draft.service;

import com.teamdraft.draft.config.DraftRulesProperties;
import com.teamdraft.draft.model.ParticipantRecord;
import com.teamdraft.draft.repository.AssignedTeamRepository;
import com.teamdraft.draft.repository.ParticipantLimitRepository;
import com.teamdraft.draft.repository.ParticipantRepository;
import com.teamdraft.draft.repository.PickRepository;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TurnStateLoader {

  private final ParticipantRepository participantRepository;
  private final ParticipantLimitRepository limitRepository;
  private final PickRepository pickRepository;
  private final AssignedTeamRepository assignedTeamRepository;
  private final TeamCatalog teamCatalog;
  private final DraftRulesProperties rules;

  public TurnState load(long draftId) {
    final List<ParticipantRecord> participants = participantRepository.findByDraft(draftId);
    return new TurnState(
        participants,
        pickRepository.countByUser(draftId),
        limitRepository.findByDraft(draftId),
        usersWithoutEligibleTeam(participants),
        rules.turnOrderPolicy());
  }

  private Set<Long> usersWithoutEligibleTeam(List<ParticipantRecord> participants) {
    final Set<String> assigned = assignedTeamRepository.findAllTeamNames();
    final Set<Long> blocked = new HashSet<>();
    for (ParticipantRecord participant : participants) {
      final List<String> pool =
          rules.restrictPicksToConference()
              ? teamCatalog.teamsOf(participant.conference())
              : teamCatalog.allTeams();
      if (pool.stream().allMatch(assigned::contains)) {
        blocked.add(participant.userId());
      }
    }
    return blocked;
  }
}
