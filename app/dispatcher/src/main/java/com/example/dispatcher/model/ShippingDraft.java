package com.example.dispatcher.model;

/** Contact Preparer が組み立てた送信内容。campaign_shipping への挿入/更新に使う。 */
public record ShippingDraft(
    long campaignId,
    long contactId,
    String number,
    String message,
    String confirmationMessage) {}
