/*
 * どこで: PickResolver のユニットテスト
 * 何を: 手番・上限・conference 制限・チーム競合の判定順を検証する
 * なぜ: 条件を満たさない pick が assigned_teams や picks に書き込まれないことを保証するため
 */
package com.teamdraft.draft.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.teamdraft.draft.api.DraftActionException;
import com.teamdraft.draft.api.DraftErrorCode;
import com.teamdraft.draft.config.DraftRulesProperties;
import com.teamdraft.draft.model.ConferenceDefinition;
import com.teamdraft.draft.model.DraftRecord;
import com.teamdraft.draft.model.DraftStage;
import com.teamdraft.draft.model.DraftStatus;
import com.teamdraft.draft.model.ParticipantRecord;
import com.teamdraft.draft.model.PickRecord;
import com.teamdraft.draft.model.TeamCatalogDocument;
import com.teamdraft.draft.model.TeamHolder;
import com.teamdraft.draft.model.TeamSource;
import com.teamdraft.draft.model.TurnOrderPolicy;
import com.teamdraft.draft.repository.AssignedTeamRepository;
import com.teamdraft.draft.repository.PickRepository;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

@ExtendWith(MockitoExtension.class)
class PickResolverTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final long DRAFT_ID = 9L;
  private static final long ALICE = 1L;
  private static final long BOB = 2L;
  private static final TeamCatalog CATALOG =
      TeamCatalog.from(
          new TeamCatalogDocument(
              List.of(
                  new ConferenceDefinition("SEC", List.of("Alabama", "Georgia")),
                  new ConferenceDefinition("ACC", List.of("Clemson", "Miami")))));

  @Mock private AssignedTeamRepository assignedTeamRepository;
  @Mock private PickRepository pickRepository;

  @Test
  void pickOnTurnAppendsPick() {
    final PickResolver resolver = resolver(false);
    when(assignedTeamRepository.insertIfAbsent("Clemson", DRAFT_ID, ALICE, TeamSource.PICK, NOW))
        .thenReturn(true);
    final PickRecord appended = new PickRecord(DRAFT_ID, 1, ALICE, "Clemson", NOW);
    when(pickRepository.append(DRAFT_ID, ALICE, "Clemson", NOW)).thenReturn(appended);

    assertThat(resolver.makePick(drafting(0), state(Map.of(), Map.of()), ALICE, "clemson", NOW))
        .isEqualTo(appended);
  }

  @Test
  void rejectsNonParticipant() {
    final PickResolver resolver = resolver(false);

    assertThatThrownBy(
            () -> resolver.makePick(drafting(0), state(Map.of(), Map.of()), 99L, "Georgia", NOW))
        .isInstanceOf(DraftActionException.class)
        .extracting("code")
        .isEqualTo(DraftErrorCode.NOT_A_PARTICIPANT);
    verifyNoInteractions(assignedTeamRepository, pickRepository);
  }

  @Test
  void rejectsPickOutOfTurnWithExpectedUser() {
    final PickResolver resolver = resolver(false);

    assertThatThrownBy(
            () -> resolver.makePick(drafting(0), state(Map.of(), Map.of()), BOB, "Georgia", NOW))
        .isInstanceOfSatisfying(
            DraftActionException.class,
            ex -> {
              assertThat(ex.getCode()).isEqualTo(DraftErrorCode.NOT_YOUR_TURN);
              assertThat(ex.getDetails()).containsEntry("expected_user_id", ALICE);
            });
    verifyNoInteractions(assignedTeamRepository, pickRepository);
  }

  @Test
  void rejectsPickBeyondLimit() {
    final PickResolver resolver = resolver(false);
    // index 1 は BOB の手番だが既に上限
    final TurnState state = state(Map.of(BOB, 1), Map.of(BOB, 1));

    assertThatThrownBy(() -> resolver.makePick(drafting(1), state, BOB, "Georgia", NOW))
        .isInstanceOf(DraftActionException.class)
        .hasMessageContaining("(1)")
        .extracting("code")
        .isEqualTo(DraftErrorCode.LIMIT_REACHED);
  }

  @Test
  void rejectsUnknownTeam() {
    final PickResolver resolver = resolver(false);

    assertThatThrownBy(
            () -> resolver.makePick(drafting(0), state(Map.of(), Map.of()), ALICE, "Yale", NOW))
        .isInstanceOf(DraftActionException.class)
        .extracting("code")
        .isEqualTo(DraftErrorCode.TEAM_UNAVAILABLE);
  }

  @Test
  void restrictedPicksMustStayInOwnConference() {
    final PickResolver resolver = resolver(true);

    assertThatThrownBy(
            () ->
                resolver.makePick(drafting(0), state(Map.of(), Map.of()), ALICE, "Georgia", NOW))
        .isInstanceOf(DraftActionException.class)
        .hasMessageContaining("picks are limited to ACC")
        .extracting("code")
        .isEqualTo(DraftErrorCode.TEAM_UNAVAILABLE);
    verify(assignedTeamRepository, never())
        .insertIfAbsent(
            anyString(), anyLong(), anyLong(), any(TeamSource.class), any(Instant.class));
  }

  @Test
  void takenTeamIsReportedWithHolder() {
    final PickResolver resolver = resolver(false);
    when(assignedTeamRepository.insertIfAbsent("Alabama", DRAFT_ID, ALICE, TeamSource.PICK, NOW))
        .thenReturn(false);
    when(assignedTeamRepository.findHolder("Alabama"))
        .thenReturn(Optional.of(new TeamHolder("Alabama", DRAFT_ID, BOB, TeamSource.CLAIM, null)));

    assertThatThrownBy(
            () ->
                resolver.makePick(drafting(0), state(Map.of(), Map.of()), ALICE, "Alabama", NOW))
        .isInstanceOfSatisfying(
            DraftActionException.class,
            ex -> {
              assertThat(ex.getCode()).isEqualTo(DraftErrorCode.TEAM_UNAVAILABLE);
              assertThat(ex.getMessage())
                  .isEqualTo("Alabama was already claimed by user 2 in draft 9");
              assertThat(ex.getDetails()).doesNotContainKey("pick_number");
            });
    verify(pickRepository, never()).append(anyLong(), anyLong(), anyString(), any(Instant.class));
  }

  @Test
  void pickNumberCollisionIsInternalError() {
    final PickResolver resolver = resolver(false);
    when(assignedTeamRepository.insertIfAbsent("Clemson", DRAFT_ID, ALICE, TeamSource.PICK, NOW))
        .thenReturn(true);
    when(pickRepository.append(DRAFT_ID, ALICE, "Clemson", NOW))
        .thenThrow(new DuplicateKeyException("picks_pkey"));

    assertThatThrownBy(
            () ->
                resolver.makePick(drafting(0), state(Map.of(), Map.of()), ALICE, "Clemson", NOW))
        .isInstanceOf(IllegalStateException.class)
        .hasCauseInstanceOf(DuplicateKeyException.class);
  }

  private PickResolver resolver(boolean restrictToConference) {
    final DraftRulesProperties rules =
        new DraftRulesProperties(
            2, null, restrictToConference, TurnOrderPolicy.ROUND_ROBIN, true);
    return new PickResolver(
        assignedTeamRepository, pickRepository, CATALOG, new TurnTracker(), rules);
  }

  private static DraftRecord drafting(int pickIndex) {
    return new DraftRecord(
        DRAFT_ID, 1L, null, DraftStatus.ACTIVE, DraftStage.DRAFTING, pickIndex, NOW, NOW);
  }

  private static TurnState state(Map<Long, Integer> pickCounts, Map<Long, Integer> allowed) {
    return new TurnState(
        List.of(
            new ParticipantRecord(DRAFT_ID, ALICE, 0, "ACC", true, "Miami", true),
            new ParticipantRecord(DRAFT_ID, BOB, 1, "SEC", true, "Alabama", true)),
        pickCounts,
        allowed,
        Set.of(),
        TurnOrderPolicy.ROUND_ROBIN);
  }
}
