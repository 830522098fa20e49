package com.example.dispatcher.service;

/** キャンペーン送信に紐づくチケットの希望状態。 */
public record TicketRequest(
    long companyId, long contactId, Long whatsappId, Long queueId, Long userId, String status) {

  public static final String STATUS_CAMPAIGN = "campaign";
  public static final String STATUS_CLOSED = "closed";

  public TicketRequest closing() {
    return new TicketRequest(companyId, contactId, whatsappId, queueId, userId, STATUS_CLOSED);
  }
}
