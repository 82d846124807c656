package com.aiinpocket.rewards.service.level;

import com.aiinpocket.rewards.config.JacksonConfig;
import com.aiinpocket.rewards.config.RewardEngineProperties;
import com.aiinpocket.rewards.model.dto.TierChangeResult;
import com.aiinpocket.rewards.model.entity.AppUser;
import com.aiinpocket.rewards.model.entity.PromotionHistory;
import com.aiinpocket.rewards.model.entity.TierDefinition;
import com.aiinpocket.rewards.model.entity.TierRecord;
import com.aiinpocket.rewards.model.enums.TierChangeDirection;
import com.aiinpocket.rewards.model.enums.TierKind;
import com.aiinpocket.rewards.model.event.TierChanged;
import com.aiinpocket.rewards.repository.AppUserRepository;
import com.aiinpocket.rewards.repository.PromotionHistoryRepository;
import com.aiinpocket.rewards.repository.TierDefinitionRepository;
import com.aiinpocket.rewards.repository.TierRecordRepository;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import com.aiinpocket.rewards.service.validation.ChallengeJsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LevelCalculatorServiceTest {

    private static final Long USER_ID = 7L;
    private static final Long BLOCK_ID = 3L;

    @Mock private TierLadderService ladderService;
    @Mock private TierRecordRepository recordRepo;
    @Mock private TierDefinitionRepository definitionRepo;
    @Mock private PromotionHistoryRepository historyRepo;
    @Mock private AppUserRepository userRepo;
    @Mock private ActivityReadModel readModel;
    @Mock private ApplicationEventPublisher eventPublisher;

    private LevelCalculatorService calculator;
    private AppUser user;
    private TierLadder userLadder;

    @BeforeEach
    void setUp() {
        calculator = new LevelCalculatorService(ladderService, recordRepo, definitionRepo, historyRepo, userRepo,
                readModel, new ChallengeJsonCodec(new JacksonConfig().jsonMapper()), eventPublisher,
                new RewardEngineProperties(null, null, null, null, null, null));
        user = AppUser.builder().id(USER_ID).displayName("ana").build();
        userLadder = TierLadderTest.userLadder();
    }

    private TierRecord existingRecord(TierDefinition tier) {
        return TierRecord.builder().id(40L).user(user).kind(TierKind.USER_TOPIC).blockId(BLOCK_ID)
                .currentTier(tier).build();
    }

    @Test
    void firstAssignmentIsRecordedAsInitial() {
        when(ladderService.ladder(TierKind.USER_TOPIC)).thenReturn(userLadder);
        when(readModel.blockConsolidation(USER_ID, BLOCK_ID)).thenReturn(55.0);
        when(recordRepo.findByUserIdAndKindAndBlockId(USER_ID, TierKind.USER_TOPIC, BLOCK_ID))
                .thenReturn(Optional.empty());
        when(userRepo.findById(USER_ID)).thenReturn(Optional.of(user));
        TierDefinition estratega = userLadder.byOrder(3);
        when(definitionRepo.getReferenceById(estratega.getId())).thenReturn(estratega);

        TierChangeResult result = calculator.recalculate(USER_ID, TierKind.USER_TOPIC, BLOCK_ID, false);

        assertThat(result.changed()).isTrue();
        assertThat(result.direction()).isEqualTo(TierChangeDirection.INITIAL);
        assertThat(result.currentTier().getName()).isEqualTo("Estratega");

        ArgumentCaptor<PromotionHistory> history = ArgumentCaptor.forClass(PromotionHistory.class);
        verify(historyRepo).save(history.capture());
        assertThat(history.getValue().getPreviousTier()).isNull();
        assertThat(history.getValue().getDirection()).isEqualTo(TierChangeDirection.INITIAL);

        ArgumentCaptor<TierChanged> event = ArgumentCaptor.forClass(TierChanged.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().newTierName()).isEqualTo("Estratega");
        assertThat(event.getValue().metrics()).containsEntry("block_id", BLOCK_ID);
    }

    @Test
    void sameTierIsANoOp() {
        when(ladderService.ladder(TierKind.USER_TOPIC)).thenReturn(userLadder);
        when(readModel.blockConsolidation(USER_ID, BLOCK_ID)).thenReturn(60.4);
        when(recordRepo.findByUserIdAndKindAndBlockId(USER_ID, TierKind.USER_TOPIC, BLOCK_ID))
                .thenReturn(Optional.of(existingRecord(userLadder.byOrder(3))));

        TierChangeResult result = calculator.recalculate(USER_ID, TierKind.USER_TOPIC, BLOCK_ID, false);

        assertThat(result.changed()).isFalse();
        verify(recordRepo, never()).save(any());
        verifyNoInteractions(historyRepo, eventPublisher);
    }

    @Test
    void lowerMetricDemotes() {
        TierDefinition sabio = userLadder.byOrder(4);
        TierDefinition explorador = userLadder.byOrder(2);
        TierRecord record = existingRecord(sabio);
        when(ladderService.ladder(TierKind.USER_TOPIC)).thenReturn(userLadder);
        when(readModel.blockConsolidation(USER_ID, BLOCK_ID)).thenReturn(30.0);
        when(recordRepo.findByUserIdAndKindAndBlockId(USER_ID, TierKind.USER_TOPIC, BLOCK_ID))
                .thenReturn(Optional.of(record));
        when(definitionRepo.getReferenceById(explorador.getId())).thenReturn(explorador);
        when(definitionRepo.getReferenceById(sabio.getId())).thenReturn(sabio);

        TierChangeResult result = calculator.recalculate(USER_ID, TierKind.USER_TOPIC, BLOCK_ID, false);

        assertThat(result.direction()).isEqualTo(TierChangeDirection.DEMOTION);
        assertThat(record.getCurrentTier()).isSameAs(explorador);
        assertThat(record.getMetricValue()).isEqualTo(30.0);
        verify(recordRepo).save(record);
    }

    @Test
    void unscopedKindRejectsBlockId() {
        assertThatThrownBy(() -> calculator.recalculate(USER_ID, TierKind.CREATOR, BLOCK_ID, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> calculator.recalculate(USER_ID, TierKind.USER_TOPIC, null, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recalculateAllCoversCreatorTier() {
        user.setContentCreator(true);
        TierLadder creatorLadder = TierLadderTest.creatorLadder();
        when(userRepo.findById(USER_ID)).thenReturn(Optional.of(user));
        when(readModel.answeredBlockIds(USER_ID)).thenReturn(List.of());
        when(ladderService.ladder(TierKind.CREATOR)).thenReturn(creatorLadder);
        when(readModel.activePlayers(eq(USER_ID), any())).thenReturn(60L);
        when(recordRepo.findByUserIdAndKindAndBlockIdIsNull(USER_ID, TierKind.CREATOR)).thenReturn(Optional.empty());

        int changes = calculator.recalculateAll(USER_ID);

        assertThat(changes).isEqualTo(1);
        ArgumentCaptor<TierChanged> event = ArgumentCaptor.forClass(TierChanged.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().newTierName()).isEqualTo("Chispa");
        assertThat(event.getValue().metrics()).containsEntry("active_users", 60L);
    }
}
