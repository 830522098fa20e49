package com.example.dispatcher.service;

public final class ChatIds {

  private static final String USER_SUFFIX = "@s.whatsapp.net";

  private ChatIds() {}

  public static String forNumber(String number) {
    if (number.endsWith(USER_SUFFIX)) {
      return number;
    }
    return number + USER_SUFFIX;
  }
}
