package com.kreasipositif.statementprocessor.domain;

import java.util.Locale;

/**
 * Canonical forms of identifiers and free-text fields shared by the value types.
 */
public final class Identifiers {

    private Identifiers() {
    }

    /** Reduces a BIN/IIN to its digits; {@code null} becomes the empty string. */
    public static String digitsOnly(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Trims the value; {@code null} and blank strings become the empty string. */
    public static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    /** Account numbers (IBAN/IIK) compare without spaces and case. */
    public static String account(String value) {
        return trimToEmpty(value).replace(" ", "").toUpperCase(Locale.ROOT);
    }
}
