/*
 * どこで: Dispatcher サービス層 (MessageQueue/SendMessage)
 * 何を: CRM から投入された単発メッセージを指定チャネルで送信する
 * なぜ: 送信をレート制限付きキュー経由にしてプロバイダ制約を守るため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.queue.JobContext;
import com.example.dispatcher.queue.JobHandler;
import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.SendMessagePayload;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SendMessageHandler implements JobHandler<SendMessagePayload> {

  private static final Logger logger = LoggerFactory.getLogger(SendMessageHandler.class);

  private final ChannelResolver channelResolver;

  @Override
  public JobType jobType() {
    return JobType.SEND_MESSAGE;
  }

  @Override
  public Class<SendMessagePayload> payloadType() {
    return SendMessagePayload.class;
  }

  // 送信失敗はそのまま投げ、キューのリトライに任せる
  @Override
  public void handle(SendMessagePayload payload, JobContext context) {
    ChannelSession session = channelResolver.session(payload.whatsappId());
    session.sendText(ChatIds.forNumber(payload.number()), payload.body());
    logger.info(
        "message sent whatsappId={} attempt={}/{}",
        payload.whatsappId(),
        context.attempt(),
        context.maxAttempts());
  }
}
