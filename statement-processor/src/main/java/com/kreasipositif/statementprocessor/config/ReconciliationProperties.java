package com.kreasipositif.statementprocessor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Binds the {@code reconciliation} section from application.yml.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    /** A ledger entry is a candidate when dated at most this many days from the bank row. */
    private int dateToleranceDays = 3;

    /** When true, any entry in the same calendar month is a candidate regardless of day distance. */
    private boolean sameMonth = false;

    /**
     * Amount gap limit, as a percentage of the larger of the two amounts. Only gaps strictly
     * below it are accepted.
     */
    private BigDecimal amountTolerancePercent = BigDecimal.valueOf(5);
}
