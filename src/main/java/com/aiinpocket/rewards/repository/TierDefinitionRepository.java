package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.TierDefinition;
import com.aiinpocket.rewards.model.enums.TierKind;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TierDefinitionRepository extends JpaRepository<TierDefinition, Long> {

    List<TierDefinition> findByKindOrderByLevelOrderAsc(TierKind kind);

    long countByKind(TierKind kind);
}
