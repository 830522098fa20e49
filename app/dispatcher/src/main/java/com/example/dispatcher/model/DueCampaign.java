package com.example.dispatcher.model;

import java.time.Instant;

/** 検証ウィンドウに入った PROGRAMADA キャンペーン。 */
public record DueCampaign(long id, long companyId, Instant scheduledAt) {}
