package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.LedgerTransfer;
import com.aiinpocket.rewards.model.enums.TransferKind;
import com.aiinpocket.rewards.model.enums.TransferStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface LedgerTransferRepository extends JpaRepository<LedgerTransfer, Long> {

    Optional<LedgerTransfer> findByIdempotencyKey(String idempotencyKey);

    long countByChallengeIdAndKind(Long challengeId, TransferKind kind);

    @Query("""
        SELECT COALESCE(SUM(t.amount), 0) FROM LedgerTransfer t
        WHERE t.destinationUser.id = :userId AND t.status = :status
    """)
    long sumIncoming(@Param("userId") Long userId, @Param("status") TransferStatus status);

    @Query("""
        SELECT COALESCE(SUM(t.amount), 0) FROM LedgerTransfer t
        WHERE t.sourceUser.id = :userId AND t.status = :status
    """)
    long sumOutgoing(@Param("userId") Long userId, @Param("status") TransferStatus status);

    /** 某挑戰特定種類轉帳的總額（例如已發出的獎金） */
    @Query("""
        SELECT COALESCE(SUM(t.amount), 0) FROM LedgerTransfer t
        WHERE t.challenge.id = :challengeId AND t.kind = :kind AND t.status = :status
    """)
    long sumByChallengeAndKind(@Param("challengeId") Long challengeId,
                               @Param("kind") TransferKind kind,
                               @Param("status") TransferStatus status);
}
