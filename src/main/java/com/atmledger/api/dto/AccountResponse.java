package com.atmledger.api.dto;

import com.atmledger.atm.Account;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Account summary returned after registration. Never carries the PIN.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountResponse {

    private long cardNumber;
    private long accountNumber;
    private String ownerName;
    private BigDecimal balance;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .cardNumber(account.getCardNumber())
            .accountNumber(account.getAccountNumber())
            .ownerName(account.getOwnerName())
            .balance(account.getBalance().getAmount())
            .build();
    }
}
