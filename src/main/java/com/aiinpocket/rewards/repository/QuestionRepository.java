package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.Question;
import org.springframework.data.jpa.repository.JpaRepository;

public interface QuestionRepository extends JpaRepository<Question, Long> {

    long countByBlockId(Long blockId);
}
