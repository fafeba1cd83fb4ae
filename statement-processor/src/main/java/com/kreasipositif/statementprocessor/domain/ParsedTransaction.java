package com.kreasipositif.statementprocessor.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Canonical, immutable transaction produced by an import.
 *
 * <p>The amount is always non-negative and expressed in the base currency; the direction is
 * carried by {@code income}. For foreign-currency lines {@code amountOriginal} and
 * {@code exchangeRate} keep the source values.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ParsedTransaction {

    int sourceLine;

    LocalDate date;

    boolean income;

    BigDecimal amount;

    String currency;

    /** Source-currency amount; {@code null} for base-currency lines. */
    BigDecimal amountOriginal;

    /** {@code null} for base-currency lines. */
    BigDecimal exchangeRate;

    /** Foreign line without a usable rate: {@code amount} holds the source-currency figure. */
    boolean foreignAmountUnconverted;

    /** Counterparty name exactly as printed in the statement. */
    String clientNameRaw;

    /** Display label. */
    String clientName;

    /** Matching key; never shown to users. */
    String clientNameKey;

    String clientBin;

    String documentNumber;

    String description;

    String knpCode;

    PaymentType paymentType;

    MatchStatus matchStatus;

    MatchSource matchSource;

    /** Set iff {@code matchStatus == MATCHED}. */
    String matchedClientId;

    boolean ambiguousMatch;

    /** Set iff {@code matchStatus == MATCHED}. */
    Reconciliation reconciliation;

    @JsonIgnore
    public Direction getDirection() {
        return Direction.of(income);
    }

    @JsonIgnore
    public boolean isMatched() {
        return matchStatus == MatchStatus.MATCHED;
    }

    @JsonIgnore
    public boolean isDuplicate() {
        return matchStatus == MatchStatus.DUPLICATE;
    }
}
