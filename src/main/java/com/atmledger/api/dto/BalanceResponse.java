package com.atmledger.api.dto;

import com.atmledger.common.Money;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Current balance of an account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceResponse {

    private long cardNumber;
    private BigDecimal balance;
    private String formattedBalance;

    public static BalanceResponse of(long cardNumber, Money balance) {
        return BalanceResponse.builder()
            .cardNumber(cardNumber)
            .balance(balance.getAmount())
            .formattedBalance(balance.format())
            .build();
    }
}
