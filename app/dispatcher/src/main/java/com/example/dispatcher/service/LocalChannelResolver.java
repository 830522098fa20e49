/*
 * どこで: Dispatcher の外部連携境界
 * 何を: whatsapps テーブルからチャネルを解決し、送信をログへ出すセッションを返す
 * なぜ: トランスポート実装が無くてもパイプライン全体を動かせるようにするため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.model.ChannelRecord;
import com.example.dispatcher.model.ResolvedContact;
import com.example.dispatcher.queue.JobNotFoundException;
import com.example.dispatcher.repository.ChannelRepository;
import com.example.dispatcher.repository.ContactRepository;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LocalChannelResolver implements ChannelResolver {

  private static final Logger logger = LoggerFactory.getLogger(LocalChannelResolver.class);

  private final ChannelRepository channelRepository;
  private final ContactRepository contactRepository;
  private final Clock clock;

  @Override
  public ChannelSession defaultSession(long companyId) {
    ChannelRecord channel =
        channelRepository
            .findDefaultByCompanyId(companyId)
            .orElseThrow(
                () -> new IllegalStateException("no default channel companyId=" + companyId));
    return new LoggingSession(channel);
  }

  @Override
  public ChannelSession session(long channelId) {
    ChannelRecord channel =
        channelRepository
            .findById(channelId)
            .orElseThrow(() -> new JobNotFoundException("channel", channelId));
    return new LoggingSession(channel);
  }

  private final class LoggingSession implements ChannelSession {

    private final ChannelRecord channel;

    private LoggingSession(ChannelRecord channel) {
      this.channel = channel;
    }

    @Override
    public long channelId() {
      return channel.id();
    }

    @Override
    public ResolvedContact resolveContact(
        long companyId, String name, String number, String email) {
      String normalized = number.replaceAll("\\D", "");
      if (normalized.isEmpty()) {
        throw new IllegalArgumentException("invalid number: " + number);
      }
      long contactId =
          contactRepository.findOrCreate(companyId, name, normalized, email, Instant.now(clock));
      return new ResolvedContact(contactId, name, normalized, ChatIds.forNumber(normalized));
    }

    @Override
    public void sendText(String chatId, String text) {
      logger.info(
          "channel send text channelId={} chatId={} length={}", channel.id(), chatId, text.length());
    }

    @Override
    public void sendMedia(String chatId, Path file, String fileName, String caption) {
      logger.info(
          "channel send media channelId={} chatId={} file={} name={}",
          channel.id(),
          chatId,
          file,
          fileName);
    }
  }
}
