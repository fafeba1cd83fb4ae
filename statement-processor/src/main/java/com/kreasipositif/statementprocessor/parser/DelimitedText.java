package com.kreasipositif.statementprocessor.parser;

import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.batch.item.file.transform.FieldSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Record splitting and tokenizing for delimiter-separated statement text.
 */
final class DelimitedText {

    static final int HEADER_SCAN_ROWS = 15;

    private static final char[] CANDIDATE_DELIMITERS = {';', '\t', ','};

    private DelimitedText() {
    }

    /** One logical record; quoted fields may span several physical lines. */
    record TextRecord(int line, String text) {
    }

    /** Header row of a delimited statement. */
    record Header(int recordIndex, char delimiter, StatementColumnLayout layout) {
    }

    /**
     * Splits LF-separated text into logical records, joining physical lines while a quoted
     * field is still open.
     */
    static List<TextRecord> records(String text) {
        List<TextRecord> records = new ArrayList<>();
        String[] lines = text.split("\n", -1);
        StringBuilder pending = null;
        int pendingLine = 0;
        for (int i = 0; i < lines.length; i++) {
            if (pending == null) {
                pending = new StringBuilder(lines[i]);
                pendingLine = i + 1;
            } else {
                pending.append('\n').append(lines[i]);
            }
            if (countQuotes(pending) % 2 == 0) {
                records.add(new TextRecord(pendingLine, pending.toString()));
                pending = null;
            }
        }
        if (pending != null) {
            // unbalanced quote at end of file; keep what we have
            records.add(new TextRecord(pendingLine, pending.toString()));
        }
        return records;
    }

    /**
     * Looks for a header row among the first {@value #HEADER_SCAN_ROWS} non-blank records.
     */
    static Optional<Header> findHeader(List<TextRecord> records) {
        int scanned = 0;
        for (int i = 0; i < records.size() && scanned < HEADER_SCAN_ROWS; i++) {
            String text = records.get(i).text();
            if (text.isBlank()) {
                continue;
            }
            scanned++;
            char delimiter = detectDelimiter(text);
            if (delimiter == 0) {
                continue;
            }
            Optional<StatementColumnLayout> layout = StatementColumnLayout.fromHeader(tokenize(text, delimiter));
            if (layout.isPresent()) {
                return Optional.of(new Header(i, delimiter, layout.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * Most frequent candidate delimiter outside quotes; {@code ;} wins ties, then tab, then
     * comma. Returns {@code 0} when the line contains none.
     */
    static char detectDelimiter(String line) {
        int[] counts = new int[CANDIDATE_DELIMITERS.length];
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted) {
                for (int d = 0; d < CANDIDATE_DELIMITERS.length; d++) {
                    if (c == CANDIDATE_DELIMITERS[d]) {
                        counts[d]++;
                    }
                }
            }
        }
        int best = -1;
        for (int d = 0; d < counts.length; d++) {
            if (counts[d] > 0 && (best < 0 || counts[d] > counts[best])) {
                best = d;
            }
        }
        return best < 0 ? 0 : CANDIDATE_DELIMITERS[best];
    }

    static List<String> tokenize(String record, char delimiter) {
        return Arrays.asList(fieldSet(record, delimiter).getValues());
    }

    static FieldSet fieldSet(String record, char delimiter) {
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer(String.valueOf(delimiter));
        tokenizer.setQuoteCharacter('"');
        tokenizer.setStrict(false);
        return tokenizer.tokenize(record);
    }

    /** Blank lines and rules made of dashes, equals signs or bare delimiters. */
    static boolean isSeparator(String record, char delimiter) {
        for (int i = 0; i < record.length(); i++) {
            char c = record.charAt(i);
            if (!Character.isWhitespace(c) && c != delimiter && c != '-' && c != '=' && c != '_' && c != '"') {
                return false;
            }
        }
        return true;
    }

    private static int countQuotes(CharSequence text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '"') {
                count++;
            }
        }
        return count;
    }
}
