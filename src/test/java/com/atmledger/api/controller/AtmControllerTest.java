package com.atmledger.api.controller;

import com.atmledger.api.dto.BalanceResponse;
import com.atmledger.api.dto.CardCredentialsRequest;
import com.atmledger.api.dto.CashRequest;
import com.atmledger.atm.Account;
import com.atmledger.atm.AtmService;
import com.atmledger.common.Money;
import com.atmledger.common.exception.InsufficientFundsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.Writer;
import java.math.BigDecimal;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AtmController.
 *
 * The teller service is mocked; these tests check request mapping and
 * that the ledger endpoint writes both the response and the export file.
 */
@ExtendWith(MockitoExtension.class)
class AtmControllerTest {

    private static final long CARD = 12345678L;
    private static final long PIN = 1234L;

    @Mock
    private AtmService atmService;

    @TempDir
    Path exportDir;

    private AtmController controller;

    @BeforeEach
    void setUp() {
        controller = new AtmController(atmService, exportDir.resolve("ledgers").toString());
    }

    @Test
    void testDepositConvertsAmountAndReturnsBalance() {
        when(atmService.depositCash(CARD, PIN, Money.of("40000.00"))).thenReturn(Money.of("40099.90"));

        ResponseEntity<BalanceResponse> response = controller.deposit(cashRequest("40000.00"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(CARD, response.getBody().getCardNumber());
        assertEquals(0, new BigDecimal("40099.90").compareTo(response.getBody().getBalance()));
        assertEquals("$40099.90", response.getBody().getFormattedBalance());
    }

    @Test
    void testWithdrawPropagatesServiceFailure() {
        when(atmService.withdrawCash(CARD, PIN, Money.of("10.01")))
            .thenThrow(new InsufficientFundsException(CARD, Money.of("10.01"), Money.of("10.00")));

        assertThrows(InsufficientFundsException.class, () ->
            controller.withdraw(cashRequest("10.01"))
        );
    }

    @Test
    void testLedgerIsReturnedAndExported() {
        Account account = mock(Account.class);
        when(account.getAccountNumber()).thenReturn(2L);
        when(atmService.getAccount(CARD, PIN)).thenReturn(account);
        doAnswer(invocation -> {
            Writer out = invocation.getArgument(0);
            out.write("Name: Sam Sepiol\n");
            return null;
        }).when(atmService).printLedger(any(Writer.class), eq(CARD), eq(PIN));

        CardCredentialsRequest request = new CardCredentialsRequest();
        request.setCardNumber(CARD);
        request.setPin(PIN);

        ResponseEntity<String> response = controller.printLedger(request);

        assertEquals("Name: Sam Sepiol\n", response.getBody());
        verify(atmService).printLedger(
            exportDir.resolve("ledgers").resolve("ledger-12345678-2.txt"), CARD, PIN);
    }

    private static CashRequest cashRequest(String amount) {
        CashRequest request = new CashRequest();
        request.setCardNumber(CARD);
        request.setPin(PIN);
        request.setAmount(new BigDecimal(amount));
        return request;
    }
}
