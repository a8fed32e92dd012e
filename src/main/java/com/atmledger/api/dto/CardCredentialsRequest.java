package com.atmledger.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO identifying an account by card number and PIN.
 */
@Data
public class CardCredentialsRequest {

    @NotNull(message = "Card number is required")
    private Long cardNumber;

    @NotNull(message = "PIN is required")
    private Long pin;
}
