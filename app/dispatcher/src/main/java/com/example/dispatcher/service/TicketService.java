/*
 * どこで: Dispatcher の外部連携境界
 * 何を: 受信者ごとの追跡チケットの取得/作成/更新
 * なぜ: キャンペーン送信を CRM のチケット運用に載せるため
 */
package com.example.dispatcher.service;

public interface TicketService {

  TicketResult findOrCreate(TicketRequest request);

  void update(long ticketId, TicketRequest request);
}
