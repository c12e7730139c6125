/*
 * どこで: Draft サービス層
 * 何を: current_pick_index から手番の参加者を求め、次の有効な手番へ進める
 * なぜ: round-robin と snake の両方式で、上限到達者を飛ばした手番を一意に決めるため
 */
package com.teamdraft.draft.service;

import com.teamdraft.draft.model.ParticipantRecord;
import com.teamdraft.draft.model.TurnOrderPolicy;
import java.util.OptionalInt;
import org.springframework.stereotype.Component;

@Component
public class TurnTracker {

  /** index 番目の手番を持つ参加者。 */
  public ParticipantRecord whoseTurn(TurnState state, int index) {
    if (state.size() == 0) {
      throw new IllegalStateException("draft has no participants");
    }
    return state.participants().get(position(state.size(), index, state.policy()));
  }

  static int position(int participantCount, int index, TurnOrderPolicy policy) {
    if (index < 0) {
      throw new IllegalArgumentException("index must not be negative: " + index);
    }
    final int offset = index % participantCount;
    if (policy == TurnOrderPolicy.SNAKE && (index / participantCount) % 2 == 1) {
      return participantCount - 1 - offset;
    }
    return offset;
  }

  /** 現在の手番の次から探索し、pick できる参加者の index を返す。全員不可なら空。 */
  public OptionalInt advance(TurnState state, int currentIndex) {
    return firstEligible(state, currentIndex + 1);
  }

  /** fromIndex 自身を含めて探索する。 */
  public OptionalInt firstEligible(TurnState state, int fromIndex) {
    final int n = state.size();
    if (n == 0) {
      return OptionalInt.empty();
    }
    // snake は1往復で全員が2回ずつ現れるため 2n で打ち切る
    final int bound = state.policy() == TurnOrderPolicy.SNAKE ? 2 * n : n;
    for (int step = 0; step < bound; step++) {
      final int candidate = fromIndex + step;
      if (state.canPick(whoseTurn(state, candidate).userId())) {
        return OptionalInt.of(candidate);
      }
    }
    return OptionalInt.empty();
  }
}
