package com.example.dispatcher.model;

public enum QueueJobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED
}
