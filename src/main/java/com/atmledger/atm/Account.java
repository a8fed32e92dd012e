package com.atmledger.atm;

import com.atmledger.common.AccountKey;
import com.atmledger.common.Money;
import com.atmledger.common.exception.InsufficientFundsException;
import com.atmledger.common.exception.InvalidAmountException;
import lombok.Getter;

/**
 * Account held by the teller, identified by card number and PIN.
 *
 * The balance is only changed through {@link AtmService} so that every movement
 * lands in the transaction history.
 */
@Getter
public class Account {

    private final AccountKey key;

    /**
     * Registration order within the owning service, starting at 1.
     * Tells apart accounts that share a card number without revealing the PIN.
     */
    private final long accountNumber;

    private final String ownerName;

    private volatile Money balance;

    Account(AccountKey key, long accountNumber, String ownerName, Money initialBalance) {
        this.key = key;
        this.accountNumber = accountNumber;
        this.ownerName = ownerName;
        this.balance = initialBalance;
    }

    public long getCardNumber() {
        return key.getCardNumber();
    }

    Money deposit(Money amount) {
        if (amount.isNegative()) {
            throw new InvalidAmountException("Deposit", amount);
        }
        this.balance = this.balance.add(amount);
        return this.balance;
    }

    Money withdraw(Money amount) {
        if (amount.isNegative()) {
            throw new InvalidAmountException("Withdrawal", amount);
        }
        if (amount.isGreaterThan(balance)) {
            throw new InsufficientFundsException(key.getCardNumber(), amount, balance);
        }
        this.balance = this.balance.subtract(amount);
        return this.balance;
    }
}
