package com.kreasipositif.statementprocessor.domain;

/**
 * Commercial meaning of a payment, inferred from the KNP code or purpose text.
 */
public enum PaymentType {
    PREPAYMENT,
    FULL_PAYMENT,
    POSTPAYMENT,
    RETAINER,
    REFUND
}
