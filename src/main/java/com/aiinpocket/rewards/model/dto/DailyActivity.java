package com.aiinpocket.rewards.model.dto;

import java.time.LocalDate;

/** 單日活動量（依設定時區切日） */
public record DailyActivity(LocalDate date, int sessions, double minutes, int questions) {}
