/*
 * どこで: Draft サービス層
 * 何を: conference とチームの固定カタログを保持し、入力名を正規名へ解決する
 * なぜ: 大文字小文字や空白の揺れを吸収し、チームを conference ごとに区分するため
 */
package com.teamdraft.draft.service;

import com.teamdraft.draft.model.ConferenceDefinition;
import com.teamdraft.draft.model.TeamCatalogDocument;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class TeamCatalog {

  // 正規化キー -> 正規名
  private final Map<String, String> conferencesByKey;
  private final Map<String, String> teamsByKey;
  // 正規チーム名 -> 所属 conference
  private final Map<String, String> conferenceByTeam;
  // 正規 conference 名 -> チーム一覧(定義順)
  private final Map<String, List<String>> teamsByConference;

  private TeamCatalog(
      Map<String, String> conferencesByKey,
      Map<String, String> teamsByKey,
      Map<String, String> conferenceByTeam,
      Map<String, List<String>> teamsByConference) {
    this.conferencesByKey = conferencesByKey;
    this.teamsByKey = teamsByKey;
    this.conferenceByTeam = conferenceByTeam;
    this.teamsByConference = teamsByConference;
  }

  public static TeamCatalog from(TeamCatalogDocument document) {
    final Map<String, String> conferencesByKey = new LinkedHashMap<>();
    final Map<String, String> teamsByKey = new LinkedHashMap<>();
    final Map<String, String> conferenceByTeam = new LinkedHashMap<>();
    final Map<String, List<String>> teamsByConference = new LinkedHashMap<>();
    for (ConferenceDefinition conference : document.conferences()) {
      final String conferenceName = collapseWhitespace(conference.name());
      if (conferenceName.isEmpty()) {
        throw new IllegalStateException("conference name must not be blank");
      }
      if (conferencesByKey.putIfAbsent(normalize(conferenceName), conferenceName) != null) {
        throw new IllegalStateException("duplicate conference: " + conferenceName);
      }
      final List<String> teams = new ArrayList<>();
      for (String rawTeam : conference.teams()) {
        final String teamName = collapseWhitespace(rawTeam);
        if (teamName.isEmpty()) {
          throw new IllegalStateException("team name must not be blank in " + conferenceName);
        }
        // assigned_teams は team_name 単位で排他するため、conference をまたぐ重複も禁止する
        if (teamsByKey.putIfAbsent(normalize(teamName), teamName) != null) {
          throw new IllegalStateException("duplicate team: " + teamName);
        }
        conferenceByTeam.put(teamName, conferenceName);
        teams.add(teamName);
      }
      teamsByConference.put(conferenceName, Collections.unmodifiableList(teams));
    }
    if (teamsByKey.isEmpty()) {
      throw new IllegalStateException("team catalog must contain at least one team");
    }
    return new TeamCatalog(
        Collections.unmodifiableMap(conferencesByKey),
        Collections.unmodifiableMap(teamsByKey),
        Collections.unmodifiableMap(conferenceByTeam),
        Collections.unmodifiableMap(teamsByConference));
  }

  public static String normalize(String name) {
    return collapseWhitespace(name).toLowerCase(Locale.ROOT);
  }

  private static String collapseWhitespace(String name) {
    if (name == null) {
      return "";
    }
    return String.join(" ", name.trim().split("\\s+"));
  }

  public Optional<String> resolveConference(String input) {
    return Optional.ofNullable(conferencesByKey.get(normalize(input)));
  }

  public Optional<String> resolveTeam(String input) {
    return Optional.ofNullable(teamsByKey.get(normalize(input)));
  }

  public Optional<String> conferenceOf(String teamName) {
    return Optional.ofNullable(conferenceByTeam.get(teamName));
  }

  public List<String> conferences() {
    return List.copyOf(teamsByConference.keySet());
  }

  public List<String> teamsOf(String conference) {
    return teamsByConference.getOrDefault(conference, List.of());
  }

  public List<String> allTeams() {
    return List.copyOf(conferenceByTeam.keySet());
  }
}
