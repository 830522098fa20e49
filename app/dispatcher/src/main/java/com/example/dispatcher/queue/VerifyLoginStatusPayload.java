package com.example.dispatcher.queue;

public record VerifyLoginStatusPayload() implements JobPayload {

  @Override
  public JobType jobType() {
    return JobType.VERIFY_LOGIN_STATUS;
  }
}
