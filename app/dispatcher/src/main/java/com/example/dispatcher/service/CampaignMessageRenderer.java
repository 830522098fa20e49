/*
 * どこで: Dispatcher サービス層
 * 何を: メッセージテンプレートを 1 つ選び、受信者の値で置換して自動送信マーカーを付ける
 * なぜ: 受信者ごとに文面を変え、自動送信分を後段で判別できるようにするため
 */
package com.example.dispatcher.service;

import java.util.List;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Component;

@Component
public class CampaignMessageRenderer {

  /** 自動送信を示すゼロ幅非接合子。 */
  public static final String AUTOMATED_MARKER = "\u200c";

  /** テンプレートが無ければ null。 */
  public String render(
      List<String> templates, String name, String email, String number, RandomGenerator random) {
    if (templates.isEmpty()) {
      return null;
    }
    String template = templates.get(random.nextInt(templates.size()));
    return AUTOMATED_MARKER + substitute(template, name, email, number);
  }

  String substitute(String template, String name, String email, String number) {
    return template
        .replace("{nome}", nullToEmpty(name))
        .replace("{email}", nullToEmpty(email))
        .replace("{numero}", nullToEmpty(number));
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
