/*
 * どこで: TurnTracker のユニットテスト
 * 何を: round-robin/snake の手番計算と、上限到達者の読み飛ばしを検証する
 * なぜ: 手番の決定が participant の並びと pick 数だけで一意に決まることを保証するため
 */
package com.teamdraft.draft.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.teamdraft.draft.model.ParticipantRecord;
import com.teamdraft.draft.model.TurnOrderPolicy;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class TurnTrackerTest {

  private final TurnTracker tracker = new TurnTracker();

  @Test
  void roundRobinCyclesInPickOrder() {
    final TurnState state = state(TurnOrderPolicy.ROUND_ROBIN, Map.of(), Map.of(), Set.of());

    assertThat(usersAt(state, 0, 6)).containsExactly(10L, 20L, 30L, 10L, 20L, 30L);
  }

  @Test
  void snakeReversesEveryOtherRound() {
    final TurnState state = state(TurnOrderPolicy.SNAKE, Map.of(), Map.of(), Set.of());

    assertThat(usersAt(state, 0, 9))
        .containsExactly(10L, 20L, 30L, 30L, 20L, 10L, 10L, 20L, 30L);
  }

  @Test
  void participantsAreOrderedByPickOrderNotByInputOrder() {
    final TurnState state =
        new TurnState(
            List.of(participant(30L, 2), participant(10L, 0), participant(20L, 1)),
            Map.of(),
            Map.of(),
            Set.of(),
            TurnOrderPolicy.ROUND_ROBIN);

    assertThat(tracker.whoseTurn(state, 0).userId()).isEqualTo(10L);
  }

  @Test
  void advanceSkipsParticipantsAtTheirLimit() {
    // 20 は上限到達済み
    final TurnState state =
        state(TurnOrderPolicy.ROUND_ROBIN, Map.of(20L, 2), Map.of(20L, 2), Set.of());

    final OptionalInt next = tracker.advance(state, 0);

    assertThat(next).hasValue(2);
    assertThat(tracker.whoseTurn(state, next.getAsInt()).userId()).isEqualTo(30L);
  }

  @Test
  void advanceSkipsParticipantsWithoutEligibleTeams() {
    final TurnState state =
        state(TurnOrderPolicy.ROUND_ROBIN, Map.of(), Map.of(), Set.of(20L, 30L));

    assertThat(tracker.advance(state, 0)).hasValue(3);
  }

  @Test
  void advanceReturnsEmptyWhenEveryoneIsExhausted() {
    final TurnState state =
        state(
            TurnOrderPolicy.SNAKE,
            Map.of(10L, 1, 20L, 1, 30L, 1),
            Map.of(10L, 1, 20L, 1, 30L, 1),
            Set.of());

    assertThat(tracker.advance(state, 4)).isEmpty();
    assertThat(tracker.firstEligible(state, 0)).isEmpty();
  }

  @Test
  void unlimitedParticipantIsNeverExhausted() {
    // 10 だけ上限なし
    final TurnState state =
        state(TurnOrderPolicy.ROUND_ROBIN, Map.of(10L, 50, 20L, 1, 30L, 1), Map.of(20L, 1, 30L, 1),
            Set.of());

    assertThat(tracker.advance(state, 0)).hasValue(3);
  }

  @Test
  void snakeAdvanceFindsParticipantInNextRound() {
    // 10 のみ残っている。index 1(20) の次は round 1 の末尾(index 5) で 10 に戻る
    final TurnState state =
        state(TurnOrderPolicy.SNAKE, Map.of(20L, 1, 30L, 1), Map.of(20L, 1, 30L, 1), Set.of());

    assertThat(tracker.advance(state, 1)).hasValue(5);
  }

  @Test
  void negativeIndexIsRejected() {
    assertThatThrownBy(() -> TurnTracker.position(3, -1, TurnOrderPolicy.ROUND_ROBIN))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private List<Long> usersAt(TurnState state, int from, int count) {
    return IntStream.range(from, from + count)
        .mapToObj(i -> tracker.whoseTurn(state, i).userId())
        .toList();
  }

  private static TurnState state(
      TurnOrderPolicy policy,
      Map<Long, Integer> pickCounts,
      Map<Long, Integer> picksAllowed,
      Set<Long> blocked) {
    return new TurnState(
        List.of(participant(10L, 0), participant(20L, 1), participant(30L, 2)),
        pickCounts,
        picksAllowed,
        blocked,
        policy);
  }

  private static ParticipantRecord participant(long userId, int pickOrder) {
    return new ParticipantRecord(1L, userId, pickOrder, "SEC", true, null, false);
  }
}
