package com.kreasipositif.statementprocessor.parser;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient parsing of the amount, date and rate notations found in bank exports.
 */
public final class StatementValues {

    private static final Pattern DAY_FIRST = Pattern.compile("(\\d{1,2})[./-](\\d{1,2})[./-](\\d{4}|\\d{2})");

    private static final Pattern YEAR_FIRST = Pattern.compile("(\\d{4})[-./](\\d{1,2})[-./](\\d{1,2})");

    private static final Pattern PURPOSE_RATE = Pattern.compile(
            "курс(?:\\s+сделки)?\\s*[:=]?\\s*(\\d+(?:[.,]\\d+)?)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private StatementValues() {
    }

    /**
     * Parses a signed amount.
     *
     * <p>Spaces, NBSP and apostrophes group digits. When both {@code ,} and {@code .} occur the
     * last one is the decimal mark; a single {@code ,} is decimal unless exactly three digits
     * follow it. Parentheses, a leading or a trailing minus make the value negative. Letters
     * (currency codes) are ignored.
     *
     * @return the amount, or {@code null} when the text holds no digits
     */
    public static BigDecimal parseAmount(String raw) {
        if (raw == null) {
            return null;
        }
        String s = raw.trim();
        if (s.isEmpty()) {
            return null;
        }
        boolean negative = false;
        if (s.startsWith("(") && s.endsWith(")")) {
            negative = true;
        }
        StringBuilder kept = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c >= '0' && c <= '9') || c == ',' || c == '.') {
                kept.append(c);
            } else if ((c == '-' || c == '\u2212') && (kept.length() == 0 || i == s.length() - 1)) {
                negative = true;
            }
        }
        String digits = kept.toString();
        if (digits.chars().noneMatch(Character::isDigit)) {
            return null;
        }

        int lastComma = digits.lastIndexOf(',');
        int lastDot = digits.lastIndexOf('.');
        String plain;
        if (lastComma >= 0 && lastDot >= 0) {
            char decimal = lastComma > lastDot ? ',' : '.';
            char grouping = decimal == ',' ? '.' : ',';
            plain = digits.replace(String.valueOf(grouping), "").replace(decimal, '.');
        } else if (lastComma >= 0) {
            boolean single = digits.indexOf(',') == lastComma;
            boolean thousands = digits.length() - lastComma - 1 == 3;
            plain = single && !thousands ? digits.replace(',', '.') : digits.replace(",", "");
        } else if (lastDot >= 0 && digits.indexOf('.') != lastDot) {
            plain = digits.replace(".", "");
        } else {
            plain = digits;
        }
        if (plain.startsWith(".")) {
            plain = "0" + plain;
        }
        if (plain.endsWith(".")) {
            plain = plain.substring(0, plain.length() - 1);
        }
        try {
            BigDecimal value = new BigDecimal(plain);
            return negative ? value.negate() : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses {@code dd.MM.yyyy}, {@code yyyy-MM-dd} and the common variants; a trailing time of
     * day is ignored.
     *
     * @return the date, or {@code null} when the text is not a date
     */
    public static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String s = raw.trim();
        int space = s.indexOf(' ');
        if (space > 0) {
            s = s.substring(0, space);
        }
        int t = s.indexOf('T');
        if (t == 10) {
            s = s.substring(0, t);
        }
        Matcher yearFirst = YEAR_FIRST.matcher(s);
        if (yearFirst.matches()) {
            return date(yearFirst.group(1), yearFirst.group(2), yearFirst.group(3));
        }
        Matcher dayFirst = DAY_FIRST.matcher(s);
        if (dayFirst.matches()) {
            String year = dayFirst.group(3);
            if (year.length() == 2) {
                year = "20" + year;
            }
            return date(year, dayFirst.group(2), dayFirst.group(1));
        }
        return null;
    }

    private static LocalDate date(String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        } catch (DateTimeException e) {
            return null;
        }
    }

    /**
     * Finds a conversion rate quoted in a payment purpose, e.g. "курс сделки 450,5".
     */
    public static BigDecimal rateFromPurpose(String purpose) {
        if (purpose == null || purpose.isBlank()) {
            return null;
        }
        Matcher m = PURPOSE_RATE.matcher(purpose);
        if (!m.find()) {
            return null;
        }
        BigDecimal rate = parseAmount(m.group(1).replace(',', '.'));
        return rate != null && rate.signum() > 0 ? rate : null;
    }
}
