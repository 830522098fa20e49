package com.example.dispatcher.model;

// contactId は返信してきた CRM 連絡先 (contacts.id)
public record ConfirmedShipping(long shippingId, long campaignId, long contactId) {}
