package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.Block;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface BlockRepository extends JpaRepository<Block, Long> {

    /** 近期有人遊玩的題組的建立者 */
    @Query("""
        SELECT DISTINCT b.creatorId FROM GameSession s, Block b
        WHERE b.id = s.blockId AND s.startedAt >= :since
    """)
    List<Long> findCreatorIdsOfBlocksPlayedSince(@Param("since") Instant since);
}
