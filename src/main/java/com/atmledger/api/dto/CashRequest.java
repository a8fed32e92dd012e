package com.atmledger.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for a cash deposit or withdrawal.
 * The sign of the amount is checked by the service, not here.
 */
@Data
public class CashRequest {

    @NotNull(message = "Card number is required")
    private Long cardNumber;

    @NotNull(message = "PIN is required")
    private Long pin;

    @NotNull(message = "Amount is required")
    private BigDecimal amount;
}
