package com.teamdraft.draft.model;

import java.util.List;

public record ConferenceDefinition(String name, List<String> teams) {

  public ConferenceDefinition {
    teams = teams == null ? List.of() : List.copyOf(teams);
  }
}
