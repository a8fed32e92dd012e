package com.atmledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for registering a new account.
 */
@Data
public class RegisterAccountRequest {

    @NotNull(message = "Card number is required")
    @PositiveOrZero(message = "Card number cannot be negative")
    private Long cardNumber;

    @NotNull(message = "PIN is required")
    @PositiveOrZero(message = "PIN cannot be negative")
    private Long pin;

    @NotBlank(message = "Owner name is required")
    private String ownerName;

    @NotNull(message = "Initial balance is required")
    private BigDecimal initialBalance;
}
