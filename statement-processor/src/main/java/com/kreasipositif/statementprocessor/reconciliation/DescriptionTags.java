package com.kreasipositif.statementprocessor.reconciliation;

import com.kreasipositif.statementprocessor.domain.Direction;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bracketed tags appended to the description of ledger entries created from a bank row. They
 * are how later imports recognize rows that were already committed.
 *
 * <pre>
 *   Оплата по счету 15 [100 USD x 450.5] [KNP:710] [BANK:IN] [DOC:000123]
 * </pre>
 */
public final class DescriptionTags {

    private static final Pattern DOC_TAG = Pattern.compile("\\[DOC:([^\\]]*)]");
    private static final String BANK_TAG_PREFIX = "[BANK:";

    private DescriptionTags() {
    }

    public static String document(String documentNumber) {
        return "[DOC:" + documentNumber + "]";
    }

    public static String bank(Direction direction) {
        return BANK_TAG_PREFIX + direction.marker() + "]";
    }

    public static String knp(String code) {
        return "[KNP:" + code + "]";
    }

    public static String conversion(BigDecimal amountOriginal, String currency, BigDecimal rate) {
        return "[" + amountOriginal.stripTrailingZeros().toPlainString() + " " + currency
                + " x " + rate.stripTrailingZeros().toPlainString() + "]";
    }

    /** True when the description carries a document or bank-direction tag. */
    public static boolean isBankTagged(String description) {
        return description != null && (description.contains(BANK_TAG_PREFIX) || DOC_TAG.matcher(description).find());
    }

    /** Document number from a {@code [DOC:...]} tag; empty when absent. */
    public static String documentNumber(String description) {
        if (description == null) {
            return "";
        }
        Matcher m = DOC_TAG.matcher(description);
        return m.find() ? m.group(1).trim() : "";
    }
}
