/*
 * どこで: Draft アプリのセキュリティ設定
 * 何を: 内部トークン認証と管理系 API のロール制御を構成する
 * なぜ: チャット連携(bot)以外からの draft 操作と、管理者以外の作成/取消を防ぐため
 */
package com.teamdraft.draft.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
@EnableConfigurationProperties(DraftInternalApiProperties.class)
public class DraftSecurityConfig {

  private static final String[] PUBLIC_PATHS = {
    "/error", "/actuator/health", "/actuator/health/**", "/actuator/info", "/actuator/prometheus"
  };

  @Bean
  InternalApiAuthenticationFilter internalApiAuthenticationFilter(
      DraftInternalApiProperties properties) {
    return new InternalApiAuthenticationFilter(properties);
  }

  @Bean
  SecurityFilterChain draftSecurityFilterChain(
      HttpSecurity http, InternalApiAuthenticationFilter authenticationFilter) throws Exception {
    // bot 以外のクライアントは想定しないので CSRF/セッション/フォームログインは使わない
    http.csrf(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        .httpBasic(AbstractHttpConfigurer::disable)
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(authenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(PUBLIC_PATHS)
                    .permitAll()
                    .requestMatchers("/v1/admin/**")
                    .hasRole("ADMIN")
                    .requestMatchers("/v1/drafts/**", "/v1/guilds/**")
                    .hasRole("INTERNAL")
                    .anyRequest()
                    .denyAll());
    return http.build();
  }
}
