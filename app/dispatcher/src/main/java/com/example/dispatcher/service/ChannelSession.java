/*
 * どこで: Dispatcher の外部連携境界
 * 何を: 接続済み送信チャネル 1 本に対する操作
 * なぜ: 実トランスポートをパイプラインから切り離すため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.model.ResolvedContact;
import java.nio.file.Path;

public interface ChannelSession {

  long channelId();

  /** 番号をチャネル上の宛先として検証し、CRM 連絡先に結び付ける。 */
  ResolvedContact resolveContact(long companyId, String name, String number, String email);

  void sendText(String chatId, String text);

  void sendMedia(String chatId, Path file, String fileName, String caption);
}
