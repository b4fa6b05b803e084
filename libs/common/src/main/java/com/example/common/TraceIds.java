/*
 * どこで: 共通ユーティリティ
 * 何を: trace_id の採番と MDC キーを提供する
 * なぜ: HTTP 以外 (キュー消費スレッド) のログにも同じキーで相関 ID を載せるため
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}
