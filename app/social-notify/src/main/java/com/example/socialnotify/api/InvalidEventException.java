/*
 * どこで: Social Notify API
 * 何を: 受付時の検証エラー(400)を表す例外を定義する
 * なぜ: 不正なイベントをキューに積まずに同期的に呼び出し元へ返すため
 */
package com.example.socialnotify.api;

public class InvalidEventException extends RuntimeException {

  public InvalidEventException(String message) {
    super(message);
  }
}
