/*
 * どこで: Social Notify Web 設定
 * 何を: 受付 ID / trace_id / 経路上のユーザ・イベント・通知 ID を MDC に積み、完了時に取り除く
 * なぜ: 受付 API のログとキュー消費側のログを event_id / trace_id で突き合わせるため
 */
package com.example.socialnotify.config;

import com.example.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
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

  // URI テンプレート変数名をそのまま MDC キーに使う
  private static final List<String> PATH_KEYS = List.of("user_id", "event_id", "notification_id");
  private static final List<String> REQUEST_KEYS =
      List.of("request_id", TraceIds.MDC_KEY, "http_method", "http_path");

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String header = request.getHeader(REQUEST_ID_HEADER);
    final String requestId =
        header == null || header.isBlank() ? UUID.randomUUID().toString() : header;
    MDC.put("request_id", requestId);
    MDC.put(TraceIds.MDC_KEY, TraceIds.newTraceId());
    MDC.put("http_method", request.getMethod());
    MDC.put("http_path", request.getRequestURI());
    final Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    if (variables instanceof Map<?, ?> pathVariables) {
      for (String key : PATH_KEYS) {
        if (pathVariables.get(key) instanceof String value && !value.isBlank()) {
          MDC.put(key, value);
        }
      }
    }
    response.setHeader(REQUEST_ID_HEADER, requestId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    REQUEST_KEYS.forEach(MDC::remove);
    PATH_KEYS.forEach(MDC::remove);
  }
}
