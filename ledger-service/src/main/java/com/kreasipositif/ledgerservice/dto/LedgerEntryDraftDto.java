package com.kreasipositif.ledgerservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One committed statement row.
 */
@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Ledger entry committed from a bank statement row")
public class LedgerEntryDraftDto {

    @NotBlank(message = "clientId must not be blank")
    private String clientId;

    @NotNull(message = "amount is required")
    @PositiveOrZero(message = "amount must not be negative")
    private BigDecimal amount;

    private LocalDate date;

    @NotBlank(message = "direction must not be blank")
    @Schema(description = "INCOME or EXPENSE", example = "INCOME")
    private String direction;

    @Schema(example = "FULL_PAYMENT")
    private String paymentType;

    private String description;

    private String bankDocumentNumber;

    private String bankClientName;

    @Schema(description = "Existing entry this bank row settles; null creates a new entry")
    private String linkedTransactionId;
}
