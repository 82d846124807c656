package com.aiinpocket.rewards.service.orchestration;

import com.aiinpocket.rewards.config.RewardEngineProperties;
import com.aiinpocket.rewards.exception.ValidationTimeoutException;
import com.aiinpocket.rewards.model.dto.ValidationRunSummary;
import com.aiinpocket.rewards.model.enums.ChallengeStatus;
import com.aiinpocket.rewards.model.enums.ParticipantStatus;
import com.aiinpocket.rewards.repository.ChallengeParticipantRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 挑戰驗證批次：找出所有進行中挑戰的 ACTIVE 參加者，在 validationExecutor 上並行驗證。
 * 每位參加者的時限從工作執行緒開始處理時起算，排隊等待的時間不計入。
 * 單一參加者失敗或逾時只計入錯誤數，不影響其他人。
 */
@Service
@Slf4j
public class ValidationOrchestrator {

    private final ChallengeParticipantRepository participantRepo;
    private final ParticipantValidationProcessor processor;
    private final TaskExecutor validationExecutor;
    private final RewardEngineProperties properties;

    public ValidationOrchestrator(ChallengeParticipantRepository participantRepo,
                                  ParticipantValidationProcessor processor,
                                  @Qualifier("validationExecutor") TaskExecutor validationExecutor,
                                  RewardEngineProperties properties) {
        this.participantRepo = participantRepo;
        this.processor = processor;
        this.validationExecutor = validationExecutor;
        this.properties = properties;
    }

    public ValidationRunSummary runValidation() {
        long start = System.currentTimeMillis();
        Instant now = Instant.now();
        List<Long> participantIds = participantRepo.findEligibleIds(
                ParticipantStatus.ACTIVE, ChallengeStatus.ACTIVE, now);
        log.info("[挑戰驗證] 開始驗證 {} 位參加者", participantIds.size());

        long timeout = properties.validation().participantTimeoutSeconds();
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger errors = new AtomicInteger();

        List<CompletableFuture<Void>> futures = participantIds.stream()
                .map(id -> CompletableFuture
                        .supplyAsync(() -> processor.process(id, now, Instant.now().plusSeconds(timeout)),
                                validationExecutor)
                        .handle((settled, ex) -> {
                            Throwable cause = ex instanceof CompletionException && ex.getCause() != null
                                    ? ex.getCause() : ex;
                            if (cause instanceof ValidationTimeoutException) {
                                errors.incrementAndGet();
                                log.warn("[挑戰驗證] {}", cause.getMessage());
                            } else if (cause != null) {
                                errors.incrementAndGet();
                                log.error("[挑戰驗證] 參加者 {} 驗證失敗: {}", id, cause.getMessage(), cause);
                            } else if (Boolean.TRUE.equals(settled)) {
                                completed.incrementAndGet();
                            }
                            return (Void) null;
                        }))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        ValidationRunSummary summary = new ValidationRunSummary(participantIds.size(), completed.get(), errors.get());
        log.info("[挑戰驗證] 完成: 處理 {} 位，完成 {} 位，錯誤 {} 位，耗時 {}ms",
                summary.processed(), summary.completed(), summary.errors(), System.currentTimeMillis() - start);
        return summary;
    }
}
