package com.kreasipositif.ledgerservice.service;

import com.kreasipositif.ledgerservice.dto.LedgerTransactionDto;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Mutable in-memory ledger row. Guarded by {@link LedgerTransactionService}.
 */
@Data
@Builder
public class LedgerEntry {

    public static final String MANUAL = "MANUAL";
    public static final String VERIFIED = "VERIFIED";
    public static final String DISCREPANCY = "DISCREPANCY";
    public static final String BANK_IMPORT = "BANK_IMPORT";

    private String id;
    private String clientId;
    private BigDecimal amount;
    private LocalDate date;
    private String direction;
    private String paymentType;
    private String description;
    private String bankDocumentNumber;
    private String bankClientName;
    private BigDecimal bankAmount;
    private LocalDate bankDate;
    private String reconciliationStatus;

    LedgerTransactionDto toDto() {
        return LedgerTransactionDto.builder()
                .id(id)
                .clientId(clientId)
                .amount(amount)
                .date(date)
                .direction(direction)
                .paymentType(paymentType)
                .description(description)
                .bankDocumentNumber(bankDocumentNumber)
                .bankClientName(bankClientName)
                .bankAmount(bankAmount)
                .bankDate(bankDate)
                .reconciliationStatus(reconciliationStatus)
                .build();
    }
}
