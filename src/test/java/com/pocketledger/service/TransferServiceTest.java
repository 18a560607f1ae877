package com.pocketledger.service;

import com.pocketledger.domain.Account;
import com.pocketledger.domain.Category;
import com.pocketledger.domain.Transaction;
import com.pocketledger.domain.Transaction.TransactionType;
import com.pocketledger.domain.User;
import com.pocketledger.exception.AtomicityFailureException;
import com.pocketledger.exception.InvalidReferenceException;
import com.pocketledger.exception.InvalidTransferException;
import com.pocketledger.repository.AccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TransferServiceTest {

    @Mock AccountRepository accountRepository;
    @Mock CategoryService   categoryService;
    @Mock BalanceEngine     balanceEngine;

    @InjectMocks TransferService service;

    @Captor ArgumentCaptor<List<TransactionDraft>> legsCaptor;

    private User     owner;
    private Account  checking;
    private Account  savings;
    private Category transferCategory;

    private static final Instant WHEN = Instant.parse("2024-05-10T12:00:00Z");

    @BeforeEach
    void setUp() throws Exception {
        owner = new User("Ana", "ana@test.com", "hash");
        setId(owner, 1L);
        checking = new Account(owner, "Checking", Account.AccountType.CHECKING, new BigDecimal("500"), null, null);
        setId(checking, 10L);
        savings = new Account(owner, "Savings", Account.AccountType.SAVINGS, BigDecimal.ZERO, null, null);
        setId(savings, 20L);
        transferCategory = new Category(owner, Category.TRANSFER);
        setId(transferCategory, 7L);
    }

    private void setId(Object entity, Long id) throws Exception {
        var f = entity.getClass().getDeclaredField("id");
        f.setAccessible(true);
        f.set(entity, id);
    }

    private List<Transaction> postedLegs(BigDecimal amount, String outDescription, String inDescription) {
        return List.of(
                new Transaction(owner, checking, transferCategory, TransactionType.TRANSFER_OUT, amount, WHEN, outDescription),
                new Transaction(owner, savings, transferCategory, TransactionType.TRANSFER_IN, amount, WHEN, inDescription));
    }

    private void stubAccounts() {
        when(accountRepository.findByIdAndUserId(10L, 1L)).thenReturn(Optional.of(checking));
        when(accountRepository.findByIdAndUserId(20L, 1L)).thenReturn(Optional.of(savings));
    }

    @Test @DisplayName("transfer → one engine call with an OUT leg on source and an IN leg on destination")
    void postsBothLegsTogether() {
        stubAccounts();
        when(categoryService.resolveTransferCategory(1L)).thenReturn(transferCategory);
        when(balanceEngine.applyCreateAll(eq(1L), anyList()))
            .thenReturn(postedLegs(new BigDecimal("75.00"), "Transfer to Savings", "Transfer from Checking"));

        TransferService.TransferResult result = service.transfer(1L, 10L, 20L, new BigDecimal("75.00"), WHEN, null);

        verify(balanceEngine, times(1)).applyCreateAll(eq(1L), legsCaptor.capture());
        List<TransactionDraft> legs = legsCaptor.getValue();
        assertThat(legs).hasSize(2);
        assertThat(legs.get(0).type()).isEqualTo(TransactionType.TRANSFER_OUT);
        assertThat(legs.get(0).accountId()).isEqualTo(10L);
        assertThat(legs.get(0).description()).isEqualTo("Transfer to Savings");
        assertThat(legs.get(1).type()).isEqualTo(TransactionType.TRANSFER_IN);
        assertThat(legs.get(1).accountId()).isEqualTo(20L);
        assertThat(legs.get(1).description()).isEqualTo("Transfer from Checking");
        assertThat(legs).allSatisfy(leg -> {
            assertThat(leg.categoryId()).isEqualTo(7L);
            assertThat(leg.amount()).isEqualByComparingTo("75.00");
            assertThat(leg.transactionDate()).isEqualTo(WHEN);
        });

        assertThat(result.debit().getType()).isEqualTo(TransactionType.TRANSFER_OUT);
        assertThat(result.credit().getType()).isEqualTo(TransactionType.TRANSFER_IN);
    }

    @Test @DisplayName("explicit description → used for both legs")
    void explicitDescription() {
        stubAccounts();
        when(categoryService.resolveTransferCategory(1L)).thenReturn(transferCategory);
        when(balanceEngine.applyCreateAll(eq(1L), anyList()))
            .thenReturn(postedLegs(BigDecimal.TEN, "Rent share", "Rent share"));

        service.transfer(1L, 10L, 20L, BigDecimal.TEN, WHEN, "Rent share");

        verify(balanceEngine).applyCreateAll(eq(1L), legsCaptor.capture());
        assertThat(legsCaptor.getValue()).extracting(TransactionDraft::description)
            .containsOnly("Rent share");
    }

    @Test @DisplayName("same source and destination → InvalidTransfer, nothing posted")
    void sameAccount() {
        assertThatThrownBy(() -> service.transfer(1L, 10L, 10L, BigDecimal.TEN, WHEN, null))
            .isInstanceOf(InvalidTransferException.class)
            .hasMessageContaining("differ");

        verifyNoInteractions(balanceEngine, categoryService);
    }

    @Test @DisplayName("zero amount → InvalidTransfer")
    void zeroAmount() {
        assertThatThrownBy(() -> service.transfer(1L, 10L, 20L, BigDecimal.ZERO, WHEN, null))
            .isInstanceOf(InvalidTransferException.class);

        verifyNoInteractions(balanceEngine);
    }

    @Test @DisplayName("negative amount → InvalidTransfer")
    void negativeAmount() {
        assertThatThrownBy(() -> service.transfer(1L, 10L, 20L, new BigDecimal("-5"), WHEN, null))
            .isInstanceOf(InvalidTransferException.class);
    }

    @Test @DisplayName("amount finer than 4 decimals → InvalidTransfer, nothing posted")
    void subUnitAmount() {
        assertThatThrownBy(() -> service.transfer(1L, 10L, 20L, new BigDecimal("0.00001"), WHEN, null))
            .isInstanceOf(InvalidTransferException.class)
            .hasMessageContaining("4 decimals");

        verifyNoInteractions(balanceEngine, categoryService);
    }

    @Test @DisplayName("amount beyond 15 integer digits → InvalidTransfer, not a store failure")
    void oversizedAmount() {
        assertThatThrownBy(() -> service.transfer(1L, 10L, 20L, new BigDecimal("1E+16"), WHEN, null))
            .isInstanceOf(InvalidTransferException.class)
            .hasMessageContaining("15 integer digits");

        verifyNoInteractions(balanceEngine, categoryService);
    }

    @Test @DisplayName("destination owned by someone else → InvalidReference, nothing posted")
    void foreignDestination() {
        when(accountRepository.findByIdAndUserId(10L, 1L)).thenReturn(Optional.of(checking));
        when(accountRepository.findByIdAndUserId(30L, 1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.transfer(1L, 10L, 30L, BigDecimal.TEN, WHEN, null))
            .isInstanceOf(InvalidReferenceException.class)
            .hasMessageContaining("30");

        verifyNoInteractions(balanceEngine, categoryService);
    }

    @Test @DisplayName("missing source id → InvalidReference")
    void missingSource() {
        assertThatThrownBy(() -> service.transfer(1L, null, 20L, BigDecimal.TEN, WHEN, null))
            .isInstanceOf(InvalidReferenceException.class);
    }

    @Test @DisplayName("store aborts the unit → AtomicityFailure")
    void storeFailure() {
        stubAccounts();
        when(categoryService.resolveTransferCategory(1L)).thenReturn(transferCategory);
        when(balanceEngine.applyCreateAll(eq(1L), anyList()))
            .thenThrow(new DataIntegrityViolationException("account deleted concurrently"));

        assertThatThrownBy(() -> service.transfer(1L, 10L, 20L, BigDecimal.TEN, WHEN, null))
            .isInstanceOf(AtomicityFailureException.class)
            .hasMessageContaining("rolled back");
    }

    @Test @DisplayName("no date → both legs share one timestamp")
    void defaultDateShared() {
        stubAccounts();
        when(categoryService.resolveTransferCategory(1L)).thenReturn(transferCategory);
        when(balanceEngine.applyCreateAll(eq(1L), anyList()))
            .thenReturn(postedLegs(BigDecimal.ONE, "out", "in"));

        service.transfer(1L, 10L, 20L, BigDecimal.ONE, null, null);

        verify(balanceEngine).applyCreateAll(eq(1L), legsCaptor.capture());
        List<TransactionDraft> legs = legsCaptor.getValue();
        assertThat(legs.get(0).transactionDate()).isNotNull();
        assertThat(legs.get(0).transactionDate()).isEqualTo(legs.get(1).transactionDate());
    }
}
