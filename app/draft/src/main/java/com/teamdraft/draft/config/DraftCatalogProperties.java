/*
 * どこで: Draft アプリの設定バインド
 * 何を: conference/チーム一覧 JSON の配置場所を保持する
 * なぜ: リーグ構成の差し替えをビルドなしで行えるようにするため
 */
package com.teamdraft.draft.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "draft.catalog")
public record DraftCatalogProperties(@NotBlank String location) {}
