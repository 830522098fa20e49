package com.example.dispatcher.service;

public record TicketResult(long ticketId, boolean created) {}
