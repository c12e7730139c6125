/*
 * どこで: Draft API
 * 何を: conference -> 参加者 -> 保持チームの対応を返す
 * なぜ: claim したチームと pick したチームを conference 単位で一覧できるようにするため
 */
package com.teamdraft.draft.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConferenceRostersResponse(long draftId, List<ConferenceRoster> conferences) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ConferenceRoster(String conference, List<UserRoster> users) {}

  // teams は claim したチームが先頭、その後に pick 番号順
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record UserRoster(long userId, List<String> teams) {}
}
