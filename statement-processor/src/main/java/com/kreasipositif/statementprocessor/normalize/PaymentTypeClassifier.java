package com.kreasipositif.statementprocessor.normalize;

import com.kreasipositif.statementprocessor.config.StatementImportProperties;
import com.kreasipositif.statementprocessor.domain.PaymentType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Infers the commercial meaning of a payment.
 *
 * <p>The KNP code table wins when it knows the code. Otherwise the purpose text is checked
 * against keyword groups in a fixed order (refund, prepayment, postpayment, retainer) and the
 * first group that hits decides. Anything else is a full payment.
 */
@Component
@RequiredArgsConstructor
public class PaymentTypeClassifier {

    private static final List<String> REFUND = List.of("возврат", "қайтар", "refund", "chargeback");
    private static final List<String> PREPAYMENT = List.of("предоплат", "аванс", "алдын ала", "prepay", "advance");
    private static final List<String> POSTPAYMENT = List.of(
            "окончательн", "постоплат", "доплат", "закрыти", "final payment", "closing", "balance due");
    private static final List<String> RETAINER = List.of(
            "абонент", "абон.", "ретейнер", "ежемесяч", "подписк", "retainer", "subscription", "monthly");

    private final StatementImportProperties properties;

    public PaymentType classify(String knpCode, String description) {
        if (knpCode != null && !knpCode.isBlank()) {
            PaymentType byCode = properties.getPaymentTypes().getKnpCodes().get(knpCode.trim());
            if (byCode != null) {
                return byCode;
            }
        }
        String text = description == null ? "" : description.toLowerCase(Locale.ROOT);
        if (containsAny(text, REFUND)) {
            return PaymentType.REFUND;
        }
        if (containsAny(text, PREPAYMENT)) {
            return PaymentType.PREPAYMENT;
        }
        if (containsAny(text, POSTPAYMENT)) {
            return PaymentType.POSTPAYMENT;
        }
        if (containsAny(text, RETAINER)) {
            return PaymentType.RETAINER;
        }
        return PaymentType.FULL_PAYMENT;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
