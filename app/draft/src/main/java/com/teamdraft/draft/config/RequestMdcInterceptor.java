/*
 * どこで: Draft Web 層
 * 何を: リクエスト単位で draft/guild/user などの MDC キーを設定し、完了時に外す
 * なぜ: 同じドラフトへの並行操作をログ上で追跡できるようにするため
 */
package com.teamdraft.draft.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final String APPLIED_KEYS_ATTRIBUTE =
      RequestMdcInterceptor.class.getName() + ".appliedKeys";
  private static final String[] PATH_VARIABLES = {"draft_id", "guild_id"};

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> context = new LinkedHashMap<>();
    final String requestId = trimToNull(request.getHeader(REQUEST_ID_HEADER));
    context.put("request_id", requestId == null ? UUID.randomUUID().toString() : requestId);
    context.put("trace_id", request.getHeader("X-Trace-Id"));
    context.put("user_id", request.getHeader("X-User-Id"));
    context.put("http_method", request.getMethod());
    context.put("http_path", request.getRequestURI());
    context.put("client_ip", clientIp(request));
    final Map<?, ?> pathVariables = pathVariables(request);
    for (String name : PATH_VARIABLES) {
      final Object value = pathVariables.get(name);
      context.put(name, value instanceof String text ? text : null);
    }

    context.values().removeIf(value -> value == null || value.isBlank());
    context.forEach(MDC::put);
    request.setAttribute(APPLIED_KEYS_ATTRIBUTE, context.keySet().toArray(String[]::new));
    response.setHeader(REQUEST_ID_HEADER, context.get("request_id"));
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(APPLIED_KEYS_ATTRIBUTE) instanceof String[] keys) {
      for (String key : keys) {
        MDC.remove(key);
      }
    }
  }

  private static Map<?, ?> pathVariables(HttpServletRequest request) {
    final Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    return attribute instanceof Map<?, ?> variables ? variables : Map.of();
  }

  // プロキシ経由なら X-Forwarded-For の先頭が元のクライアント
  private static String clientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }

  private static String trimToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
