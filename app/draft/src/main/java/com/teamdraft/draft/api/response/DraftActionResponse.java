/*
 * どこで: Draft API
 * 何を: conference 選択/claim/pick の結果を表す
 * なぜ: チャット連携側が次の手番とフェーズ遷移をそのまま告知できるようにするため
 */
package com.teamdraft.draft.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DraftActionResponse(
    long draftId,
    String action,
    long userId,
    String stage,
    String status,
    String conference,
    String teamName,
    Integer pickNumber,
    Long nextUserId,
    boolean stageChanged) {}
