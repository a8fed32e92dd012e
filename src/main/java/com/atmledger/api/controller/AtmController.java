package com.atmledger.api.controller;

import com.atmledger.api.dto.AccountResponse;
import com.atmledger.api.dto.BalanceResponse;
import com.atmledger.api.dto.CardCredentialsRequest;
import com.atmledger.api.dto.CashRequest;
import com.atmledger.api.dto.RegisterAccountRequest;
import com.atmledger.atm.Account;
import com.atmledger.atm.AtmService;
import com.atmledger.common.Money;
import com.atmledger.common.exception.LedgerWriteException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * REST API for the teller. Card number and PIN travel in request bodies only.
 *
 * Exported ledgers are named {@code ledger-<card>-<accountNumber>.txt} so that accounts
 * sharing a card number get separate files.
 */
@RestController
@RequestMapping("/api/v1/atm")
@Tag(name = "ATM", description = "Account registration, cash movements and ledgers")
public class AtmController {

    private final AtmService atmService;
    private final Path exportDir;

    public AtmController(AtmService atmService,
                         @Value("${atm.ledger.export-dir:ledgers}") String exportDir) {
        this.atmService = atmService;
        this.exportDir = Paths.get(exportDir);
    }

    @PostMapping("/accounts")
    @Operation(summary = "Register a new account")
    public ResponseEntity<AccountResponse> registerAccount(@Valid @RequestBody RegisterAccountRequest request) {
        Account account = atmService.registerAccount(
            request.getCardNumber(),
            request.getPin(),
            request.getOwnerName(),
            Money.of(request.getInitialBalance())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @PostMapping("/balance")
    @Operation(summary = "Check the balance of an account")
    public ResponseEntity<BalanceResponse> checkBalance(@Valid @RequestBody CardCredentialsRequest request) {
        Money balance = atmService.checkBalance(request.getCardNumber(), request.getPin());
        return ResponseEntity.ok(BalanceResponse.of(request.getCardNumber(), balance));
    }

    @PostMapping("/deposit")
    @Operation(summary = "Deposit cash into an account")
    public ResponseEntity<BalanceResponse> deposit(@Valid @RequestBody CashRequest request) {
        Money balance = atmService.depositCash(
            request.getCardNumber(), request.getPin(), Money.of(request.getAmount()));
        return ResponseEntity.ok(BalanceResponse.of(request.getCardNumber(), balance));
    }

    @PostMapping("/withdraw")
    @Operation(summary = "Withdraw cash from an account")
    public ResponseEntity<BalanceResponse> withdraw(@Valid @RequestBody CashRequest request) {
        Money balance = atmService.withdrawCash(
            request.getCardNumber(), request.getPin(), Money.of(request.getAmount()));
        return ResponseEntity.ok(BalanceResponse.of(request.getCardNumber(), balance));
    }

    @PostMapping(value = "/ledger", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Print the transaction ledger of an account")
    public ResponseEntity<String> printLedger(@Valid @RequestBody CardCredentialsRequest request) {
        long cardNumber = request.getCardNumber();
        long pin = request.getPin();

        StringWriter document = new StringWriter();
        atmService.printLedger(document, cardNumber, pin);

        try {
            Files.createDirectories(exportDir);
        } catch (IOException e) {
            throw new LedgerWriteException(exportDir.toString(), e);
        }
        Account account = atmService.getAccount(cardNumber, pin);
        Path exportFile = exportDir.resolve("ledger-" + cardNumber + "-" + account.getAccountNumber() + ".txt");
        atmService.printLedger(exportFile, cardNumber, pin);

        return ResponseEntity.ok(document.toString());
    }
}
