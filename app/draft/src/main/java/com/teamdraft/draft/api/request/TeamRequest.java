/*
 * どこで: Draft API
 * 何を: claim/pick で共通のチーム指定入力を保持する
 * なぜ: 表記揺れを含む入力をそのままサービス層の正規化へ渡すため
 */
package com.teamdraft.draft.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TeamRequest(@NotBlank(message = "team_name is required") String teamName) {}
