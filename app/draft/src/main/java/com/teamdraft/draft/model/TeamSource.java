package com.teamdraft.draft.model;

// assigned_teams.source の値。claim による事前確保か、drafting 中の pick か。
public enum TeamSource {
  CLAIM,
  PICK
}
