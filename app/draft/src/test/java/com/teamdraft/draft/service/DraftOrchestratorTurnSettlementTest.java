/*
 * どこで: Draft サービス層のテスト
 * 何を: 手番の参加者が pick できなくなった時の手番送りと自動完了を検証する
 * なぜ: 他の draft に残りチームを取られても draft が停止しないことを保証するため
 */
package com.teamdraft.draft.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.teamdraft.draft.api.response.DraftActionResponse;
import com.teamdraft.draft.model.DraftAction;
import com.teamdraft.draft.model.DraftRecord;
import com.teamdraft.draft.model.DraftStage;
import com.teamdraft.draft.model.DraftStatus;
import com.teamdraft.draft.model.ParticipantRecord;
import com.teamdraft.draft.model.PickRecord;
import com.teamdraft.draft.model.TurnOrderPolicy;
import com.teamdraft.draft.repository.DraftRepository;
import com.teamdraft.draft.repository.ParticipantRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DraftOrchestratorTurnSettlementTest {

  private static final long DRAFT_ID = 9L;
  private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");
  private static final List<ParticipantRecord> PARTICIPANTS =
      List.of(
          new ParticipantRecord(DRAFT_ID, 1L, 0, "Pac-12", true, "Utah", true),
          new ParticipantRecord(DRAFT_ID, 2L, 1, "ACC", true, "Clemson", true));

  @Mock private DraftRepository draftRepository;
  @Mock private ParticipantRepository participantRepository;
  @Mock private ClaimResolver claimResolver;
  @Mock private PickResolver pickResolver;
  @Mock private TurnStateLoader turnStateLoader;
  @Mock private DraftEventRecorder eventRecorder;

  private DraftOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    orchestrator =
        new DraftOrchestrator(
            draftRepository,
            participantRepository,
            claimResolver,
            pickResolver,
            new TurnTracker(),
            turnStateLoader,
            eventRecorder,
            new DraftMetrics(new SimpleMeterRegistry()),
            Clock.fixed(NOW, ZoneOffset.UTC));
    final DraftRecord active =
        new DraftRecord(
            DRAFT_ID, 100L, null, DraftStatus.ACTIVE, DraftStage.DRAFTING, 0, NOW, NOW);
    when(draftRepository.lockById(DRAFT_ID)).thenReturn(Optional.of(active));
  }

  @Test
  void draftCompletesWhenNobodyHasAnEligibleTeamLeft() {
    when(turnStateLoader.load(DRAFT_ID)).thenReturn(stateWithoutEligibleTeams(Set.of(1L, 2L)));

    final DraftActionResponse response =
        orchestrator.submitAction(DRAFT_ID, 1L, new DraftAction.MakePick("Oregon"), "trace-1");

    assertThat(response.stage()).isEqualTo("DONE");
    assertThat(response.status()).isEqualTo("COMPLETED");
    assertThat(response.pickNumber()).isNull();
    assertThat(response.nextUserId()).isNull();
    assertThat(response.stageChanged()).isTrue();
    verify(draftRepository)
        .updateProgress(DRAFT_ID, DraftStatus.COMPLETED, DraftStage.DONE, 0, NOW);
    verify(eventRecorder).completed(any(DraftRecord.class), eq("trace-1"), eq(NOW));
    verifyNoInteractions(pickResolver);
  }

  @Test
  void blockedPickerIsSkippedBeforeThePickIsValidated() {
    final TurnState state = stateWithoutEligibleTeams(Set.of(1L));
    when(turnStateLoader.load(DRAFT_ID)).thenReturn(state);
    when(pickResolver.makePick(any(DraftRecord.class), eq(state), eq(2L), eq("Oregon"), eq(NOW)))
        .thenReturn(new PickRecord(DRAFT_ID, 1, 2L, "Oregon", NOW));

    final DraftActionResponse response =
        orchestrator.submitAction(DRAFT_ID, 2L, new DraftAction.MakePick("Oregon"), "trace-2");

    final ArgumentCaptor<DraftRecord> draftCaptor = ArgumentCaptor.forClass(DraftRecord.class);
    verify(pickResolver)
        .makePick(draftCaptor.capture(), eq(state), eq(2L), eq("Oregon"), eq(NOW));
    assertThat(draftCaptor.getValue().currentPickIndex()).isEqualTo(1);
    // index 1 へ送ったあと、user 1 を飛ばして index 3 (user 2) に進む
    verify(draftRepository)
        .updateProgress(DRAFT_ID, DraftStatus.ACTIVE, DraftStage.DRAFTING, 1, NOW);
    verify(draftRepository)
        .updateProgress(DRAFT_ID, DraftStatus.ACTIVE, DraftStage.DRAFTING, 3, NOW);
    assertThat(response.stage()).isEqualTo("DRAFTING");
    assertThat(response.pickNumber()).isEqualTo(1);
    assertThat(response.nextUserId()).isEqualTo(2L);
  }

  private static TurnState stateWithoutEligibleTeams(Set<Long> blockedUsers) {
    return new TurnState(
        PARTICIPANTS, Map.of(), Map.of(), blockedUsers, TurnOrderPolicy.ROUND_ROBIN);
  }
}
