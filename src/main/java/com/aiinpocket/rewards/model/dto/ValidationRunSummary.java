package com.aiinpocket.rewards.model.dto;

public record ValidationRunSummary(int processed, int completed, int errors) {}
