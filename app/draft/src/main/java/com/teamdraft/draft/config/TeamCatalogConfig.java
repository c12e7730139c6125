/*
 * どこで: Draft アプリの設定
 * 何を: 起動時に teams.json を読み込み TeamCatalog を Bean 化する
 * なぜ: カタログ不備を起動時点で検出し、リクエスト処理中の読み込みを避けるため
 */
package com.teamdraft.draft.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamdraft.draft.model.TeamCatalogDocument;
import com.teamdraft.draft.service.TeamCatalog;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class TeamCatalogConfig {

  private static final Logger logger = LoggerFactory.getLogger(TeamCatalogConfig.class);

  @Bean
  public TeamCatalog teamCatalog(
      DraftCatalogProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    final Resource resource = resourceLoader.getResource(properties.location());
    if (!resource.exists()) {
      throw new IllegalStateException("team catalog not found: " + properties.location());
    }
    try (InputStream input = resource.getInputStream()) {
      final TeamCatalog catalog =
          TeamCatalog.from(objectMapper.readValue(input, TeamCatalogDocument.class));
      logger.info(
          "team catalog loaded location={} conferences={} teams={}",
          properties.location(),
          catalog.conferences().size(),
          catalog.allTeams().size());
      return catalog;
    } catch (IOException ex) {
      throw new IllegalStateException("failed to read team catalog: " + properties.location(), ex);
    }
  }
}
