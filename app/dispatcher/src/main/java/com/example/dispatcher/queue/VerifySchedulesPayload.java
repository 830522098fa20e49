package com.example.dispatcher.queue;

public record VerifySchedulesPayload() implements JobPayload {

  @Override
  public JobType jobType() {
    return JobType.VERIFY_SCHEDULES;
  }
}
