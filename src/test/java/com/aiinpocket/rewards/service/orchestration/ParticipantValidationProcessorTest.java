package com.aiinpocket.rewards.service.orchestration;

import com.aiinpocket.rewards.exception.ValidationTimeoutException;
import com.aiinpocket.rewards.model.dto.SettlementOutcome;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.entity.ChallengeParticipant;
import com.aiinpocket.rewards.model.enums.ParticipantStatus;
import com.aiinpocket.rewards.model.progress.CompetitionProgress;
import com.aiinpocket.rewards.repository.ChallengeParticipantRepository;
import com.aiinpocket.rewards.service.settlement.SettlementService;
import com.aiinpocket.rewards.service.validation.ChallengeValidationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ParticipantValidationProcessorTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final Instant FAR_DEADLINE = Instant.now().plusSeconds(3600);

    @Mock private ChallengeParticipantRepository participantRepo;
    @Mock private ChallengeValidationService validationService;
    @Mock private SettlementService settlementService;

    @InjectMocks
    private ParticipantValidationProcessor processor;

    private ChallengeParticipant participant(ParticipantStatus status) {
        ChallengeParticipant participant = ChallengeParticipant.builder().id(1L).status(status).build();
        when(participantRepo.findWithChallengeById(1L)).thenReturn(Optional.of(participant));
        return participant;
    }

    @Test
    void progressIsRecordedEvenWhenNotCompleted() {
        ChallengeParticipant participant = participant(ParticipantStatus.ACTIVE);
        CompetitionProgress progress = new CompetitionProgress(2, 5, 3, 0.66, 0.8, 40.0);
        doReturn(new ValidationResult<>(false, progress)).when(validationService).validate(participant, NOW);

        assertThat(processor.process(1L, NOW, FAR_DEADLINE)).isFalse();

        verify(settlementService).recordProgress(1L, progress, NOW);
        verify(settlementService, never()).settleParticipant(any());
    }

    @Test
    void completedParticipantIsSettled() {
        ChallengeParticipant participant = participant(ParticipantStatus.ACTIVE);
        CompetitionProgress progress = new CompetitionProgress(5, 5, 6, 0.83, 0.9, 100.0);
        doReturn(new ValidationResult<>(true, progress)).when(validationService).validate(participant, NOW);
        when(settlementService.settleParticipant(1L)).thenReturn(SettlementOutcome.settled(1L, 120));

        assertThat(processor.process(1L, NOW, FAR_DEADLINE)).isTrue();
    }

    @Test
    void participantNoLongerActiveIsSkipped() {
        participant(ParticipantStatus.COMPLETED);

        assertThat(processor.process(1L, NOW, FAR_DEADLINE)).isFalse();
        verifyNoInteractions(validationService, settlementService);
    }

    @Test
    void validationPastDeadlineWritesNothing() {
        ChallengeParticipant participant = participant(ParticipantStatus.ACTIVE);
        CompetitionProgress progress = new CompetitionProgress(5, 5, 6, 0.83, 0.9, 100.0);
        doReturn(new ValidationResult<>(true, progress)).when(validationService).validate(participant, NOW);

        assertThatThrownBy(() -> processor.process(1L, NOW, Instant.now().minusSeconds(1)))
                .isInstanceOf(ValidationTimeoutException.class);

        verify(settlementService, never()).recordProgress(any(), any(), any());
        verify(settlementService, never()).settleParticipant(any());
    }
}
