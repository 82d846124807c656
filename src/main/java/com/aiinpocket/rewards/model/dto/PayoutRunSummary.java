package com.aiinpocket.rewards.model.dto;

import java.time.LocalDate;

public record PayoutRunSummary(LocalDate weekStart, int created, int paid, int failed, long totalAmount) {}
