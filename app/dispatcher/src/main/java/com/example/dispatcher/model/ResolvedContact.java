package com.example.dispatcher.model;

/** チャネルで検証済みの宛先。chatId はプロバイダ形式の宛先 ID。 */
public record ResolvedContact(long contactId, String name, String number, String chatId) {}
