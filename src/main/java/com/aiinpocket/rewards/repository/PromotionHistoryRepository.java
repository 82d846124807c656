package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.PromotionHistory;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PromotionHistoryRepository extends JpaRepository<PromotionHistory, Long> {
}
