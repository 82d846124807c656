package com.aiinpocket.rewards.job;

import com.aiinpocket.rewards.service.DistributedLockService;
import com.aiinpocket.rewards.service.orchestration.ValidationOrchestrator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChallengeValidationJobTest {

    @Mock private ValidationOrchestrator validationOrchestrator;
    @Mock private DistributedLockService lockService;

    @InjectMocks
    private ChallengeValidationJob job;

    private void lockAcquired() {
        when(lockService.executeWithLock(anyLong(), eq("ChallengeValidationJob"), any())).thenAnswer(inv -> {
            inv.<Runnable>getArgument(2).run();
            return true;
        });
    }

    @Test
    void runsValidationUnderTheLock() {
        lockAcquired();

        job.executeInternal(null);

        verify(validationOrchestrator).runValidation();
    }

    @Test
    void failuresAreLoggedNotThrown() {
        lockAcquired();
        when(validationOrchestrator.runValidation()).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> job.executeInternal(null)).doesNotThrowAnyException();
    }

    @Test
    void skipsWhenAnotherPodHoldsTheLock() {
        when(lockService.executeWithLock(anyLong(), any(), any())).thenReturn(false);

        job.executeInternal(null);

        verifyNoInteractions(validationOrchestrator);
    }
}
