package com.atmledger.atm;

import com.atmledger.common.AccountKey;
import com.atmledger.common.Money;
import com.atmledger.common.exception.AccountNotFoundException;
import com.atmledger.common.exception.DuplicateAccountException;
import com.atmledger.common.exception.LedgerWriteException;
import com.atmledger.ledger.LedgerWriter;
import com.atmledger.ledger.TransactionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Teller service that owns the account store and the per-account transaction histories.
 *
 * Both stores are keyed by {@link AccountKey} and live only as long as this instance.
 * Every registered key has a history entry from the moment it is registered, and a
 * failed operation leaves both stores untouched.
 *
 * Every public method runs under this instance's monitor, so concurrent callers see
 * each operation as a whole. The views returned by the readers are snapshots.
 */
@Service
@Slf4j
public class AtmService {

    private final Map<AccountKey, Account> accounts = new LinkedHashMap<>();

    private final Map<AccountKey, List<TransactionRecord>> transactions = new LinkedHashMap<>();

    private long nextAccountNumber = 1;

    /**
     * Register a new account with an empty transaction history.
     *
     * The initial balance is taken as given.
     *
     * @throws DuplicateAccountException if the card number and PIN are already registered
     */
    public synchronized Account registerAccount(long cardNumber, long pin, String ownerName, Money initialBalance) {
        if (initialBalance == null) {
            throw new IllegalArgumentException("Initial balance cannot be null");
        }
        AccountKey key = AccountKey.of(cardNumber, pin);
        if (accounts.containsKey(key)) {
            throw new DuplicateAccountException(cardNumber);
        }

        Account account = new Account(key, nextAccountNumber++, ownerName, initialBalance);
        accounts.put(key, account);
        transactions.put(key, new ArrayList<>());

        log.info("Registered account for card {} with balance {}", cardNumber, initialBalance.format());
        return account;
    }

    public synchronized Money checkBalance(long cardNumber, long pin) {
        Money balance = getAccount(cardNumber, pin).getBalance();
        log.debug("Balance inquiry for card {}", cardNumber);
        return balance;
    }

    /**
     * Pay cash into an account and record the movement.
     *
     * @return the updated balance
     * @throws AccountNotFoundException if no account matches
     * @throws com.atmledger.common.exception.InvalidAmountException if the amount is negative
     */
    public synchronized Money depositCash(long cardNumber, long pin, Money amount) {
        Account account = getAccount(cardNumber, pin);
        Money updated = account.deposit(amount);
        transactions.get(account.getKey()).add(TransactionRecord.deposit(amount, updated));

        log.info("Deposited {} to card {}, balance now {}", amount.format(), cardNumber, updated.format());
        return updated;
    }

    /**
     * Take cash out of an account and record the movement.
     *
     * @return the updated balance
     * @throws AccountNotFoundException if no account matches
     * @throws com.atmledger.common.exception.InvalidAmountException if the amount is negative
     * @throws com.atmledger.common.exception.InsufficientFundsException if the amount exceeds the balance
     */
    public synchronized Money withdrawCash(long cardNumber, long pin, Money amount) {
        Account account = getAccount(cardNumber, pin);
        Money updated = account.withdraw(amount);
        transactions.get(account.getKey()).add(TransactionRecord.withdrawal(amount, updated));

        log.info("Withdrew {} from card {}, balance now {}", amount.format(), cardNumber, updated.format());
        return updated;
    }

    /**
     * Write the account's ledger to a file, replacing any existing content.
     * The file is opened and closed within this call.
     *
     * @throws AccountNotFoundException if no account matches
     * @throws LedgerWriteException if the file cannot be written
     */
    public synchronized void printLedger(Path destination, long cardNumber, long pin) {
        Account account = getAccount(cardNumber, pin);
        try (Writer out = Files.newBufferedWriter(destination, StandardCharsets.UTF_8)) {
            writeLedger(out, account);
        } catch (IOException e) {
            throw new LedgerWriteException(destination.toString(), e);
        }
        log.info("Printed ledger for card {} to {}", cardNumber, destination);
    }

    /**
     * Write the account's ledger to a caller-owned writer. The writer is flushed but not closed.
     *
     * @throws AccountNotFoundException if no account matches
     * @throws LedgerWriteException if the writer fails
     */
    public synchronized void printLedger(Writer destination, long cardNumber, long pin) {
        Account account = getAccount(cardNumber, pin);
        try {
            writeLedger(destination, account);
        } catch (IOException e) {
            throw new LedgerWriteException(destination.getClass().getSimpleName(), e);
        }
        log.debug("Printed ledger for card {}", cardNumber);
    }

    public synchronized Account getAccount(long cardNumber, long pin) {
        Account account = accounts.get(lookupKey(cardNumber, pin));
        if (account == null) {
            throw new AccountNotFoundException(cardNumber);
        }
        return account;
    }

    public synchronized List<TransactionRecord> getTransactionHistory(long cardNumber, long pin) {
        Account account = getAccount(cardNumber, pin);
        return List.copyOf(transactions.get(account.getKey()));
    }

    /**
     * Read-only snapshot of the account store, in registration order.
     */
    public synchronized Map<AccountKey, Account> getAccounts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(accounts));
    }

    /**
     * Read-only snapshot of the transaction store. The lists are read-only as well.
     */
    public synchronized Map<AccountKey, List<TransactionRecord>> getTransactions() {
        Map<AccountKey, List<TransactionRecord>> view = new LinkedHashMap<>();
        transactions.forEach((key, records) -> view.put(key, List.copyOf(records)));
        return Collections.unmodifiableMap(view);
    }

    private void writeLedger(Writer out, Account account) throws IOException {
        AccountKey key = account.getKey();
        LedgerWriter.write(out, account.getOwnerName(), key.getCardNumber(), key.getPin(),
            transactions.get(key));
    }

    // A key that cannot exist (negative part) is reported as unknown rather than malformed
    private static AccountKey lookupKey(long cardNumber, long pin) {
        if (cardNumber < 0 || pin < 0) {
            return null;
        }
        return AccountKey.of(cardNumber, pin);
    }
}
