/*
 * どこで: キャンペーンのドメインモデル
 * 何を: campaigns.status の取りうる値
 * なぜ: 終端状態からの遷移を型で判定できるようにするため
 */
package com.example.dispatcher.model;

public enum CampaignStatus {
  PROGRAMADA,
  EM_ANDAMENTO,
  CANCELADA,
  FINALIZADA,
  FINALIZADA_COM_ERROS;

  public boolean isTerminal() {
    return this == CANCELADA || this == FINALIZADA || this == FINALIZADA_COM_ERROS;
  }
}
