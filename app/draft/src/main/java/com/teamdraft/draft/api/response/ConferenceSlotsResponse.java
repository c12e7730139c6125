/*
 * どこで: Draft API
 * 何を: conference ごとの参加者と枠の使用数を返す
 * なぜ: conference 選択前に空き枠を確認できるようにするため
 */
package com.teamdraft.draft.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConferenceSlotsResponse(
    long draftId, int maxParticipants, List<ConferenceSlot> conferences, List<Long> unassignedUserIds) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ConferenceSlot(String conference, List<Long> userIds, int used, int max) {}
}
