/*
 * どこで: Draft API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: クライアントがエラー原因と再送可否を識別しやすくするため
 */
package com.teamdraft.draft.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiErrorResponse(
    DraftErrorCode code, String message, boolean retryable, Map<String, Object> details) {

  public ApiErrorResponse(DraftErrorCode code, String message) {
    this(code, message, false, Map.of());
  }
}
