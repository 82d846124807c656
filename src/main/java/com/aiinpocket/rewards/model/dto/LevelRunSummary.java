package com.aiinpocket.rewards.model.dto;

public record LevelRunSummary(int usersProcessed, int tierChanges, int errors) {}
