package com.example.dispatcher.model;

/** contact_list_items の 1 行。isWhatsappValid が false の行は受信者に含めない。 */
public record ContactListItemRecord(
    long id,
    long contactListId,
    long companyId,
    String name,
    String number,
    String email,
    boolean isWhatsappValid) {}
