package com.kreasipositif.statementprocessor.parser;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the columns of a tabular statement to the fields they carry, from the header row.
 *
 * <p>Headers are matched case-insensitively against Russian, Kazakh and English synonyms.
 * Cyrillic synonyms are word stems and match anywhere in the header; Latin synonyms must be a
 * whole word, so that {@code "in"} does not claim "Incoming". Roles are resolved in declaration
 * order and each column is claimed by at most one role.
 */
public final class StatementColumnLayout {

    public enum Column {
        DATE("дата", "күні", "date"),
        BIN("бин", "иин", "инн", "бсн", "жсн", "bin", "iin", "inn", "tax id"),
        KNP("кнп", "код назначения", "knp"),
        RATE("курс", "rate"),
        CURRENCY("валюта", "currency", "ccy"),
        CREDIT("зачислен", "приход", "кредит", "кіріс", "поступлен", "credit", "incoming"),
        DEBIT("списан", "расход", "дебет", "шығыс", "debit", "outgoing"),
        AMOUNT("сумма", "сома", "amount", "sum"),
        DOCUMENT("номер", "документ", "doc", "document", "number", "reference"),
        DESCRIPTION("назначение", "описание", "мақсаты", "description", "purpose", "details", "narrative"),
        DIRECTION("тип операции", "вид операции", "направление", "type", "direction"),
        NAME("наименование", "фио", "контрагент", "плательщик", "получатель", "корреспондент",
                "атауы", "name", "counterparty", "payer", "beneficiary");

        private final List<String> synonyms;

        Column(String... synonyms) {
            this.synonyms = List.of(synonyms);
        }

        boolean matches(String header) {
            for (String synonym : synonyms) {
                if (isLatin(synonym) ? containsWord(header, synonym) : header.contains(synonym)) {
                    return true;
                }
            }
            return false;
        }
    }

    private final Map<Column, Integer> columns;

    private StatementColumnLayout(Map<Column, Integer> columns) {
        this.columns = columns;
    }

    /**
     * Resolves a header row.
     *
     * @return the layout, or empty when the row lacks a date column or any amount column
     */
    public static Optional<StatementColumnLayout> fromHeader(List<String> headerCells) {
        List<String> headers = new ArrayList<>(headerCells.size());
        for (String cell : headerCells) {
            headers.add(cell == null ? "" : cell.replace('"', ' ').trim().toLowerCase(Locale.ROOT));
        }

        Map<Column, Integer> resolved = new EnumMap<>(Column.class);
        boolean[] claimed = new boolean[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            // running row number, never a field
            claimed[i] = headers.get(i).contains("п/п") || headers.get(i).equals("№");
        }
        for (Column column : Column.values()) {
            for (int i = 0; i < headers.size(); i++) {
                if (!claimed[i] && !headers.get(i).isEmpty() && column.matches(headers.get(i))) {
                    resolved.put(column, i);
                    claimed[i] = true;
                    break;
                }
            }
        }

        boolean hasAmount = resolved.containsKey(Column.AMOUNT)
                || resolved.containsKey(Column.CREDIT)
                || resolved.containsKey(Column.DEBIT);
        if (!resolved.containsKey(Column.DATE) || !hasAmount) {
            return Optional.empty();
        }
        return Optional.of(new StatementColumnLayout(resolved));
    }

    public boolean has(Column column) {
        return columns.containsKey(column);
    }

    /** Zero-based index, or -1 when the column is absent. */
    public int indexOf(Column column) {
        return columns.getOrDefault(column, -1);
    }

    /** Value of {@code column} in {@code cells}; empty when absent or out of range. */
    public String cell(List<String> cells, Column column) {
        int idx = indexOf(column);
        if (idx < 0 || idx >= cells.size() || cells.get(idx) == null) {
            return "";
        }
        return cells.get(idx).trim();
    }

    @Override
    public String toString() {
        return "StatementColumnLayout" + columns;
    }

    private static boolean isLatin(String synonym) {
        for (int i = 0; i < synonym.length(); i++) {
            char c = synonym.charAt(i);
            if (Character.isLetter(c) && c > 'z') {
                return false;
            }
        }
        return true;
    }

    private static boolean containsWord(String header, String word) {
        int from = 0;
        while (true) {
            int idx = header.indexOf(word, from);
            if (idx < 0) {
                return false;
            }
            int end = idx + word.length();
            boolean startOk = idx == 0 || !Character.isLetterOrDigit(header.charAt(idx - 1));
            boolean endOk = end == header.length() || !Character.isLetterOrDigit(header.charAt(end));
            if (startOk && endOk) {
                return true;
            }
            from = idx + 1;
        }
    }
}
