/*
 * どこで: Draft API
 * 何を: 利用者起因で回復可能な draft 操作エラーを表す
 * なぜ: エラー種別と補足情報をまとめてハンドラへ渡すため
 */
package com.teamdraft.draft.api;

import com.teamdraft.draft.model.TeamHolder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class DraftActionException extends RuntimeException {

  private final DraftErrorCode code;
  private final Map<String, Object> details;

  public DraftActionException(DraftErrorCode code, String message) {
    this(code, message, Map.of());
  }

  public DraftActionException(DraftErrorCode code, String message, Map<String, Object> details) {
    super(message);
    this.code = code;
    this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public static DraftActionException teamTaken(DraftErrorCode code, TeamHolder holder) {
    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("team_name", holder.teamName());
    details.put("holder_user_id", holder.userId());
    details.put("holder_draft_id", holder.draftId());
    details.put("source", holder.source().name());
    if (holder.pickNumber() != null) {
      details.put("pick_number", holder.pickNumber());
    }
    return new DraftActionException(code, describeHolder(holder), details);
  }

  private static String describeHolder(TeamHolder holder) {
    if (holder.pickNumber() != null) {
      return String.format(
          "%s was already picked by user %d (pick #%d) in draft %d",
          holder.teamName(), holder.userId(), holder.pickNumber(), holder.draftId());
    }
    return String.format(
        "%s was already claimed by user %d in draft %d",
        holder.teamName(), holder.userId(), holder.draftId());
  }

  public DraftErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getDetails() {
    return details;
  }
}
