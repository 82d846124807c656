package com.aiinpocket.rewards.service.settlement;

import com.aiinpocket.rewards.exception.InsufficientBalanceException;
import com.aiinpocket.rewards.model.dto.ReconciliationResult;
import com.aiinpocket.rewards.model.dto.TransferRequest;
import com.aiinpocket.rewards.model.entity.AppUser;
import com.aiinpocket.rewards.model.entity.LedgerTransfer;
import com.aiinpocket.rewards.model.enums.TransferKind;
import com.aiinpocket.rewards.model.enums.TransferStatus;
import com.aiinpocket.rewards.repository.AppUserRepository;
import com.aiinpocket.rewards.repository.LedgerTransferRepository;
import com.aiinpocket.rewards.service.validation.ChallengeJsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

/**
 * 點數帳本。
 * 所有餘額異動都經過這裡：鎖定相關使用者列（依 ID 遞增順序避免死結），
 * 檢查透支，寫入一筆 COMPLETED 轉帳。同一個 idempotencyKey 只會入帳一次。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final AppUserRepository userRepo;
    private final LedgerTransferRepository transferRepo;
    private final ChallengeJsonCodec codec;

    /**
     * 在呼叫端的交易中執行轉帳。鎖會持有到交易提交。
     *
     * @return 新建立的轉帳；idempotencyKey 已存在時回傳既有的轉帳，不重複入帳
     * @throws InsufficientBalanceException 來源使用者餘額不足
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerTransfer transfer(TransferRequest request) {
        if (request.amount() <= 0) {
            throw new IllegalArgumentException("轉帳金額必須大於 0: " + request.amount());
        }
        if (request.sourceUserId() == null && request.destinationUserId() == null) {
            throw new IllegalArgumentException("轉帳來源與目的不可同時為系統帳戶");
        }
        Optional<LedgerTransfer> existing = transferRepo.findByIdempotencyKey(request.idempotencyKey());
        if (existing.isPresent()) {
            log.debug("[帳本] 轉帳已存在，略過: key={}", request.idempotencyKey());
            return existing.get();
        }

        Map<Long, AppUser> locked = lockUsers(request.sourceUserId(), request.destinationUserId());
        AppUser source = request.sourceUserId() != null ? locked.get(request.sourceUserId()) : null;
        AppUser destination = request.destinationUserId() != null ? locked.get(request.destinationUserId()) : null;

        if (source != null) {
            if (source.getBalance() < request.amount()) {
                throw new InsufficientBalanceException(source.getId(), source.getBalance(), request.amount());
            }
            source.setBalance(source.getBalance() - request.amount());
        }
        if (destination != null) {
            destination.setBalance(destination.getBalance() + request.amount());
        }

        LedgerTransfer transfer = transferRepo.save(LedgerTransfer.builder()
                .challenge(request.challenge())
                .sourceUser(source)
                .destinationUser(destination)
                .amount(request.amount())
                .kind(request.kind())
                .status(TransferStatus.COMPLETED)
                .idempotencyKey(request.idempotencyKey())
                .referenceJson(request.reference() != null ? codec.writeMap(request.reference()) : null)
                .build());

        log.info("[帳本] {} {} 點: {} → {} (key={})", request.kind(), request.amount(),
                source != null ? source.getId() : "系統", destination != null ? destination.getId() : "系統",
                request.idempotencyKey());
        return transfer;
    }

    /**
     * 管理員發放點數（BONUS）。
     */
    @Transactional
    public LedgerTransfer grant(Long userId, long amount, String reason, String idempotencyKey) {
        String key = idempotencyKey != null ? idempotencyKey : "grant:" + UUID.randomUUID();
        return transfer(TransferRequest.credit(userId, amount, TransferKind.BONUS, null, key, reasonOf(reason)));
    }

    /**
     * 管理員扣除點數（PENALTY），不允許扣成負數。
     */
    @Transactional
    public LedgerTransfer penalize(Long userId, long amount, String reason, String idempotencyKey) {
        String key = idempotencyKey != null ? idempotencyKey : "penalty:" + UUID.randomUUID();
        return transfer(TransferRequest.debit(userId, amount, TransferKind.PENALTY, null, key, reasonOf(reason)));
    }

    /** 比對使用者餘額與帳本淨額 */
    @Transactional(readOnly = true)
    public ReconciliationResult reconcile(Long userId) {
        AppUser user = userRepo.findById(userId)
                .orElseThrow(() -> new IllegalArgumentException("使用者不存在: " + userId));
        long ledgerBalance = transferRepo.sumIncoming(userId, TransferStatus.COMPLETED)
                - transferRepo.sumOutgoing(userId, TransferStatus.COMPLETED);
        return new ReconciliationResult(userId, user.getBalance(), ledgerBalance);
    }

    /**
     * 對所有使用者對帳。
     *
     * @return 不一致的結果（空表示全部一致）
     */
    @Transactional(readOnly = true)
    public List<ReconciliationResult> reconcileAll() {
        List<ReconciliationResult> mismatches = new ArrayList<>();
        for (Long userId : userRepo.findAllIds()) {
            ReconciliationResult result = reconcile(userId);
            if (!result.consistent()) {
                log.warn("[帳本] 餘額與帳本不一致: userId={}, balance={}, ledger={}",
                        userId, result.balance(), result.ledgerBalance());
                mismatches.add(result);
            }
        }
        log.info("[帳本] 對帳完成，不一致 {} 筆", mismatches.size());
        return mismatches;
    }

    private Map<Long, AppUser> lockUsers(Long... userIds) {
        TreeSet<Long> ordered = new TreeSet<>();
        for (Long id : userIds) {
            if (id != null) {
                ordered.add(id);
            }
        }
        Map<Long, AppUser> locked = new HashMap<>();
        for (Long id : ordered) {
            locked.put(id, userRepo.findByIdForUpdate(id)
                    .orElseThrow(() -> new IllegalArgumentException("使用者不存在: " + id)));
        }
        return locked;
    }

    private static Map<String, Object> reasonOf(String reason) {
        Map<String, Object> reference = new HashMap<>();
        reference.put("reason", reason != null ? reason : "");
        return reference;
    }
}
