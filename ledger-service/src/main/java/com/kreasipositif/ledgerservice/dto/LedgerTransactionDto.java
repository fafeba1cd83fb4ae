package com.kreasipositif.ledgerservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A ledger entry as exposed to the statement processor.
 */
@Getter
@Builder
@Schema(description = "A ledger transaction")
public class LedgerTransactionDto {

    private final String id;

    private final String clientId;

    @Schema(description = "Booked amount in the base currency", example = "10000.00")
    private final BigDecimal amount;

    private final LocalDate date;

    @Schema(description = "INCOME or EXPENSE", example = "INCOME")
    private final String direction;

    @Schema(example = "FULL_PAYMENT")
    private final String paymentType;

    @Schema(description = "Purpose text, followed by bank-import tags for imported entries",
            example = "Оплата по счету 15 [KNP:710] [BANK:IN] [DOC:4411]")
    private final String description;

    @Schema(description = "Bank document number of the statement row that created or settled this entry")
    private final String bankDocumentNumber;

    @Schema(description = "Counterparty name as the bank printed it")
    private final String bankClientName;

    @Schema(description = "Amount the bank reported when this entry was settled; null until then")
    private final BigDecimal bankAmount;

    @Schema(description = "Date of the statement row that created or settled this entry; null until then")
    private final LocalDate bankDate;

    @Schema(description = "MANUAL, VERIFIED, DISCREPANCY or BANK_IMPORT", example = "MANUAL")
    private final String reconciliationStatus;
}
