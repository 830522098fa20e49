package com.example.dispatcher.queue;

public record SendMessagePayload(long whatsappId, String number, String body)
    implements JobPayload {

  @Override
  public JobType jobType() {
    return JobType.SEND_MESSAGE;
  }
}
