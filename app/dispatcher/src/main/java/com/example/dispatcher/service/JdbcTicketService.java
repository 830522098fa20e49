/*
 * どこで: Dispatcher の外部連携境界
 * 何を: tickets テーブルでチケットを find-or-create/更新する
 * なぜ: 未クローズチケットを連絡先ごとに 1 件へ保つため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.repository.TicketRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JdbcTicketService implements TicketService {

  private static final Logger logger = LoggerFactory.getLogger(JdbcTicketService.class);

  private final TicketRepository ticketRepository;
  private final Clock clock;

  @Override
  public TicketResult findOrCreate(TicketRequest request) {
    Instant now = Instant.now(clock);
    Optional<Long> existing =
        ticketRepository.findOpenId(request.companyId(), request.contactId(), request.whatsappId());
    if (existing.isPresent()) {
      return new TicketResult(existing.get(), false);
    }
    Optional<Long> created =
        ticketRepository.insertIfAbsent(
            request.companyId(),
            request.contactId(),
            request.whatsappId(),
            request.queueId(),
            request.userId(),
            request.status(),
            now);
    if (created.isPresent()) {
      logger.info(
          "ticket created ticketId={} companyId={} contactId={}",
          created.get(),
          request.companyId(),
          request.contactId());
      return new TicketResult(created.get(), true);
    }
    // 並行作成に負けた場合は勝った側の行を使う
    return ticketRepository
        .findOpenId(request.companyId(), request.contactId(), request.whatsappId())
        .map(id -> new TicketResult(id, false))
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "ticket could not be created contactId=" + request.contactId()));
  }

  @Override
  public void update(long ticketId, TicketRequest request) {
    int updated =
        ticketRepository.update(
            ticketId, request.queueId(), request.userId(), request.status(), Instant.now(clock));
    if (updated == 0) {
      throw new IllegalStateException("ticket not found ticketId=" + ticketId);
    }
  }
}
