/*
 * どこで: Draft アプリの認証フィルタ
 * 何を: bot から転送された内部トークンと Discord ユーザー/ロールを Authentication に変換する
 * なぜ: draft 操作を bot 経由のリクエストに限定し、作成/取消をギルド管理者に絞るため
 */
package com.teamdraft.draft.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);

  static final String ROLE_BOT = "ROLE_INTERNAL";
  static final String ROLE_GUILD_ADMIN = "ROLE_ADMIN";
  private static final String BOT_PRINCIPAL = "draft-bot";
  // Discord 側の権限名もそのまま受け付ける
  private static final Set<String> GUILD_ADMIN_ROLE_NAMES =
      Set.of("ADMIN", "ROLE_ADMIN", "ADMINISTRATOR", "MANAGE_GUILD");

  private final DraftInternalApiProperties properties;
  private final byte[] expectedToken;

  public InternalApiAuthenticationFilter(DraftInternalApiProperties properties) {
    this.properties = properties;
    this.expectedToken = properties.token().getBytes(StandardCharsets.UTF_8);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !uri.startsWith("/v1/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (!tokenMatches(request.getHeader(properties.headerName()))) {
      logger.debug("draft bot token rejected path={}", request.getRequestURI());
      filterChain.doFilter(request, response);
      return;
    }
    final String principal = resolvePrincipal(request.getHeader(properties.userIdHeaderName()));
    final Set<SimpleGrantedAuthority> authorities =
        resolveAuthorities(request.getHeader(properties.userRolesHeaderName()));
    SecurityContextHolder.getContext()
        .setAuthentication(new UsernamePasswordAuthenticationToken(principal, "N/A", authorities));
    logger.debug(
        "draft bot request authenticated path={} principal={} authorities={}",
        request.getRequestURI(),
        principal,
        authorities);
    filterChain.doFilter(request, response);
  }

  private boolean tokenMatches(String actualToken) {
    if (actualToken == null || expectedToken.length == 0) {
      return false;
    }
    return MessageDigest.isEqual(expectedToken, actualToken.getBytes(StandardCharsets.UTF_8));
  }

  // 数値でない user id はコントローラ側で 400 になるため、ここでは bot 自身として扱う
  private String resolvePrincipal(String forwardedUserId) {
    if (forwardedUserId == null) {
      return BOT_PRINCIPAL;
    }
    final String trimmed = forwardedUserId.trim();
    if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)) {
      return BOT_PRINCIPAL;
    }
    return trimmed;
  }

  private Set<SimpleGrantedAuthority> resolveAuthorities(String forwardedRoles) {
    final Set<SimpleGrantedAuthority> authorities = new LinkedHashSet<>();
    authorities.add(new SimpleGrantedAuthority(ROLE_BOT));
    if (forwardedRoles == null || forwardedRoles.isBlank()) {
      return authorities;
    }
    for (String role : forwardedRoles.split(",")) {
      if (GUILD_ADMIN_ROLE_NAMES.contains(role.trim().toUpperCase(Locale.ROOT))) {
        authorities.add(new SimpleGrantedAuthority(ROLE_GUILD_ADMIN));
        break;
      }
    }
    return authorities;
  }
}
