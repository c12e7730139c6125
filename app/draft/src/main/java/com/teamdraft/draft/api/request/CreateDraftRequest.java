/*
 * どこで: Draft API
 * 何を: draft 作成リクエストの入力を保持する
 * なぜ: 参加者の手番順と pick 上限を JSON から受け取り検証するため
 */
package com.teamdraft.draft.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;

/**
 * draft 作成入力。
 *
 * @param participantUserIds 手番順。先頭が pick_order 0
 * @param picksAllowed 全員共通の上限。未指定なら設定値を使う
 * @param unlimitedPicks true なら共通上限を設けない
 * @param picksAllowedOverrides user_id ごとの上限。共通設定より優先する
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateDraftRequest(
    @NotNull(message = "guild_id is required") Long guildId,
    Long channelId,
    @NotEmpty(message = "participant_user_ids is required")
        @Size(min = 2, message = "at least two participants are required")
        List<@NotNull(message = "participant_user_ids must not contain null") Long>
            participantUserIds,
    @PositiveOrZero(message = "picks_allowed must be zero or positive") Integer picksAllowed,
    boolean unlimitedPicks,
    Map<Long, @PositiveOrZero(message = "picks_allowed_overrides must be zero or positive") Integer>
        picksAllowedOverrides) {

  public CreateDraftRequest {
    picksAllowedOverrides = picksAllowedOverrides == null ? Map.of() : Map.copyOf(picksAllowedOverrides);
  }
}
