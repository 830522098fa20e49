package com.example.dispatcher.model;

/** whatsapps テーブルの 1 行。1 会社につき isDefault は高々 1 件。 */
public record ChannelRecord(
    long id, long companyId, String name, String status, boolean isDefault) {}
