package com.flagship.payout_settlement.funding;

import com.flagship.payout_settlement.payment.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FundingAccountServiceTest {

    @Mock
    private FundingAccountRepository repository;

    @InjectMocks
    private FundingAccountService service;

    private FundingAccountEntity activeAccount(UUID id) {
        return FundingAccountEntity.fromDomain(FundingAccount.builder()
            .id(id)
            .name("Operating")
            .type(FundingAccountType.BANK)
            .last4("4321")
            .status(FundingAccountStatus.ACTIVE)
            .primary(false)
            .build());
    }

    @Test
    @DisplayName("Promotion that matches no ACTIVE row fails so the demotion rolls back")
    void promotionMissFails() {
        UUID id = UUID.randomUUID();
        when(repository.findById(id)).thenReturn(Optional.of(activeAccount(id)));
        when(repository.promotePrimary(id, FundingAccountStatus.ACTIVE)).thenReturn(0);

        ValidationException e = assertThrows(ValidationException.class, () -> service.setPrimary(id));

        assertTrue(e.getMessage().contains("no longer ACTIVE"));
        verify(repository).clearPrimary();
    }

    @Test
    @DisplayName("A pending account is rejected before any primary is cleared")
    void pendingAccountNeverClearsPrimary() {
        UUID id = UUID.randomUUID();
        FundingAccountEntity pending = FundingAccountEntity.fromDomain(FundingAccount.builder()
            .id(id)
            .name("New wallet")
            .type(FundingAccountType.WALLET)
            .last4("abcd")
            .status(FundingAccountStatus.PENDING)
            .primary(false)
            .build());
        when(repository.findById(id)).thenReturn(Optional.of(pending));

        assertThrows(ValidationException.class, () -> service.setPrimary(id));

        verify(repository, never()).clearPrimary();
        verify(repository, never()).promotePrimary(any(), any());
    }
}
