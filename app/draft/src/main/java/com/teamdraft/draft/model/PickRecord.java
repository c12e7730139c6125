package com.teamdraft.draft.model;

import java.time.Instant;

public record PickRecord(
    long draftId, int pickNumber, long userId, String teamName, Instant pickedAt) {}
