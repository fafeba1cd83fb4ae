package com.kreasipositif.statementprocessor.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A single record recovered from a statement file, before normalization.
 *
 * <p>{@code amount} is unsigned and in the source currency. {@code direction} is {@code null}
 * when the format does not encode it (the 1C export), in which case the normalizer decides
 * from the payer identity.
 */
@Value
@Builder(toBuilder = true)
public class StatementLine {

    /** 1-based line (or row) in the source where the record starts. */
    int sourceLine;

    LocalDate date;

    BigDecimal amount;

    Direction direction;

    @Builder.Default
    Party payer = Party.EMPTY;

    @Builder.Default
    Party payee = Party.EMPTY;

    /** Upper-case ISO code, or empty when the file does not say. */
    @Builder.Default
    String currency = "";

    /** Explicit rate column or field; {@code null} when absent. */
    BigDecimal exchangeRate;

    @Builder.Default
    String description = "";

    @Builder.Default
    String documentNumber = "";

    @Builder.Default
    String knpCode = "";
}
