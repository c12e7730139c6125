package com.teamdraft.draft.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

// picks_allowed が null の参加者は上限なし
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ParticipantResponse(
    long userId,
    int pickOrder,
    String conference,
    String claimedTeam,
    int picksMade,
    Integer picksAllowed) {}
