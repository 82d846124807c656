package com.aiinpocket.rewards.model.dto;

public record ExpiryRunSummary(int expired, long refunded, int errors) {}
