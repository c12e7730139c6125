/*
 * どこで: Draft サービス層
 * 何を: 手番計算に必要な参加者順・pick 数・上限・pick 不能者をまとめる
 * なぜ: TurnTracker を DB に依存しない純粋な計算にするため
 */
package com.teamdraft.draft.service;

import com.teamdraft.draft.model.ParticipantRecord;
import com.teamdraft.draft.model.TurnOrderPolicy;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 手番計算の入力。
 *
 * @param participants pick_order 昇順に並べ直して保持する
 * @param pickCounts user_id ごとの pick 済み数。キーが無ければ 0
 * @param picksAllowed user_id ごとの上限。キーが無ければ上限なし
 * @param usersWithoutEligibleTeam 残りチームに選べるものが無い参加者
 */
public record TurnState(
    List<ParticipantRecord> participants,
    Map<Long, Integer> pickCounts,
    Map<Long, Integer> picksAllowed,
    Set<Long> usersWithoutEligibleTeam,
    TurnOrderPolicy policy) {

  public TurnState {
    participants =
        participants.stream()
            .sorted(Comparator.comparingInt(ParticipantRecord::pickOrder))
            .toList();
    pickCounts = Map.copyOf(pickCounts);
    picksAllowed = Map.copyOf(picksAllowed);
    usersWithoutEligibleTeam = Set.copyOf(usersWithoutEligibleTeam);
  }

  public int size() {
    return participants.size();
  }

  public Optional<ParticipantRecord> participant(long userId) {
    return participants.stream().filter(p -> p.userId() == userId).findFirst();
  }

  public int pickCount(long userId) {
    return pickCounts.getOrDefault(userId, 0);
  }

  public Optional<Integer> picksAllowed(long userId) {
    return Optional.ofNullable(picksAllowed.get(userId));
  }

  public boolean reachedLimit(long userId) {
    return picksAllowed(userId).map(allowed -> pickCount(userId) >= allowed).orElse(false);
  }

  /** 上限に達しておらず、選べるチームが残っている。 */
  public boolean canPick(long userId) {
    return !reachedLimit(userId) && !usersWithoutEligibleTeam.contains(userId);
  }
}
