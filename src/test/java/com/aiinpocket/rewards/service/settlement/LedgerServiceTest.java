package com.aiinpocket.rewards.service.settlement;

import com.aiinpocket.rewards.config.JacksonConfig;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerServiceTest {

    @Mock private AppUserRepository userRepo;
    @Mock private LedgerTransferRepository transferRepo;

    private LedgerService ledgerService;

    @BeforeEach
    void setUp() {
        ledgerService = new LedgerService(userRepo, transferRepo, new ChallengeJsonCodec(new JacksonConfig().jsonMapper()));
    }

    private static AppUser user(long id, long balance) {
        return AppUser.builder().id(id).displayName("u" + id).balance(balance).build();
    }

    @Test
    void creditIncreasesBalanceAndWritesTransfer() {
        AppUser user = user(5, 100);
        when(transferRepo.findByIdempotencyKey("award:participant:1")).thenReturn(Optional.empty());
        when(userRepo.findByIdForUpdate(5L)).thenReturn(Optional.of(user));
        when(transferRepo.save(any(LedgerTransfer.class))).thenAnswer(inv -> inv.getArgument(0));

        LedgerTransfer transfer = ledgerService.transfer(TransferRequest.credit(5L, 50, TransferKind.AWARD, null,
                "award:participant:1", Map.of("participant_id", 1)));

        assertThat(user.getBalance()).isEqualTo(150L);
        assertThat(transfer.getSourceUser()).isNull();
        assertThat(transfer.getDestinationUser()).isSameAs(user);
        assertThat(transfer.getStatus()).isEqualTo(TransferStatus.COMPLETED);
        assertThat(transfer.getReferenceJson()).contains("participant_id");
    }

    @Test
    void overdraftIsRejectedWithoutWriting() {
        AppUser user = user(5, 100);
        when(transferRepo.findByIdempotencyKey("reserve:challenge:9")).thenReturn(Optional.empty());
        when(userRepo.findByIdForUpdate(5L)).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> ledgerService.transfer(TransferRequest.debit(5L, 200, TransferKind.RESERVE, null,
                "reserve:challenge:9", null)))
                .isInstanceOf(InsufficientBalanceException.class)
                .satisfies(e -> assertThat(((InsufficientBalanceException) e).getRequested()).isEqualTo(200));

        assertThat(user.getBalance()).isEqualTo(100L);
        verify(transferRepo, never()).save(any());
    }

    @Test
    void repeatedKeyReturnsExistingTransfer() {
        LedgerTransfer existing = LedgerTransfer.builder().id(77L).amount(50L).kind(TransferKind.AWARD)
                .idempotencyKey("award:participant:1").build();
        when(transferRepo.findByIdempotencyKey("award:participant:1")).thenReturn(Optional.of(existing));

        LedgerTransfer transfer = ledgerService.transfer(TransferRequest.credit(5L, 50, TransferKind.AWARD, null,
                "award:participant:1", null));

        assertThat(transfer).isSameAs(existing);
        verifyNoInteractions(userRepo);
        verify(transferRepo, never()).save(any());
    }

    @Test
    void usersAreLockedInAscendingIdOrder() {
        when(transferRepo.findByIdempotencyKey("move")).thenReturn(Optional.empty());
        when(userRepo.findByIdForUpdate(4L)).thenReturn(Optional.of(user(4, 0)));
        when(userRepo.findByIdForUpdate(9L)).thenReturn(Optional.of(user(9, 500)));
        when(transferRepo.save(any(LedgerTransfer.class))).thenAnswer(inv -> inv.getArgument(0));

        ledgerService.transfer(new TransferRequest(9L, 4L, 30, TransferKind.BONUS, null, "move", null));

        InOrder order = inOrder(userRepo);
        order.verify(userRepo).findByIdForUpdate(4L);
        order.verify(userRepo).findByIdForUpdate(9L);
    }

    @Test
    void nonPositiveAmountsAndSystemToSystemAreRejected() {
        assertThatThrownBy(() -> ledgerService.transfer(TransferRequest.credit(5L, 0, TransferKind.BONUS, null,
                "zero", null))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledgerService.transfer(new TransferRequest(null, null, 10, TransferKind.BONUS, null,
                "nowhere", null))).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(userRepo, transferRepo);
    }

    @Test
    void reconcileComparesBalanceWithLedgerSum() {
        when(userRepo.findById(5L)).thenReturn(Optional.of(user(5, 120)));
        when(transferRepo.sumIncoming(5L, TransferStatus.COMPLETED)).thenReturn(200L);
        when(transferRepo.sumOutgoing(5L, TransferStatus.COMPLETED)).thenReturn(100L);

        ReconciliationResult result = ledgerService.reconcile(5L);

        assertThat(result.consistent()).isFalse();
        assertThat(result.difference()).isEqualTo(20);
    }
}
