/*
 * どこで: ジョブキュー基盤
 * 何を: リトライしても結果が変わらない失敗を示す例外
 * なぜ: 送信の二重実行や無駄なバックオフを避けて即時 FAILED にするため
 */
package com.example.dispatcher.queue;

public class NonRetryableJobException extends RuntimeException {

  public NonRetryableJobException(String message) {
    super(message);
  }

  public NonRetryableJobException(String message, Throwable cause) {
    super(message, cause);
  }
}
