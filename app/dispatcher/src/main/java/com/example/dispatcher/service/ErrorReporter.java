package com.example.dispatcher.service;

/** 失敗を外部の観測先へ通知する。呼び出し側の処理は止めない。 */
public interface ErrorReporter {

  void report(String context, Throwable error);
}
