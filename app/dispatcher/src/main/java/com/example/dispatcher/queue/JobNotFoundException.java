package com.example.dispatcher.queue;

/** ジョブが参照するレコードが存在しない。 */
public class JobNotFoundException extends NonRetryableJobException {

  public JobNotFoundException(String entity, long id) {
    super(entity + " not found id=" + id);
  }
}
