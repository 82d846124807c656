package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.RewardEventLog;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RewardEventLogRepository extends JpaRepository<RewardEventLog, Long> {
}
