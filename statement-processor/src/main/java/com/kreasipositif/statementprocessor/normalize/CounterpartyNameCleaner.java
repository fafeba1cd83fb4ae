package com.kreasipositif.statementprocessor.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counterparty name handling: a readable label for reviewers and a key for matching.
 *
 * <p>Bank exports wrap long names at fixed widths, which splits words ("Товарище ство") and
 * inserts line breaks or slashes; {@link #sanitize} undoes that. The matching key additionally
 * drops legal-form tokens and punctuation, so "ТОО «Ромашка»" and "Ромашка" share a key.
 */
public final class CounterpartyNameCleaner {

    static final Set<String> LEGAL_FORMS = Set.of(
            "ТОО", "ИП", "АО", "ЖШС", "ОАО", "ЗАО", "ПАО", "НАО", "КТ", "КХ", "ПК", "РГП", "ГКП", "КГП",
            "ГУ", "РГУ", "ООО", "LLP", "LLC", "JSC");

    private static final List<String[]> BROKEN_WORDS = List.of(
            new String[]{"Товарище\\s+ство", "Товарищество"},
            new String[]{"Обще\\s+ство", "Общество"},
            new String[]{"Предприя\\s+тие", "Предприятие"},
            new String[]{"Учрежде\\s+ние", "Учреждение"},
            new String[]{"Акционер\\s+ное", "Акционерное"},
            new String[]{"ответствен\\s+ностью", "ответственностью"},
            new String[]{"ограничен\\s+ной", "ограниченной"},
            new String[]{"предприни\\s+матель", "предприниматель"});

    private static final List<String> LEGAL_PHRASES = List.of(
            "товарищество с ограниченной ответственностью",
            "общество с ограниченной ответственностью",
            "индивидуальный предприниматель",
            "акционерное общество");

    private static final Pattern BIN_RUN = Pattern.compile("(?<!\\d)(\\d{12})(?!\\d)");
    private static final Pattern SHORT_LATIN = Pattern.compile("[A-Za-z]{1,5}");
    private static final String QUOTES = "\"'«»“”„‟‘’";

    private CounterpartyNameCleaner() {
    }

    /**
     * Joins wrapped lines, replaces slashes, collapses whitespace and re-joins known legal words
     * that the bank split in two.
     */
    public static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String result = raw.replaceAll("[\\r\\n/]+", " ").replaceAll("\\s{2,}", " ").trim();
        for (String[] fix : BROKEN_WORDS) {
            result = Pattern.compile(fix[0], Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    .matcher(result)
                    .replaceAll(Matcher.quoteReplacement(fix[1]));
        }
        return result;
    }

    /**
     * Display label: legal form upper-cased, other words title-cased, short Latin words
     * treated as acronyms. Quotes around a word are kept.
     */
    public static String displayName(String raw) {
        String sanitized = sanitize(raw);
        if (sanitized.isEmpty()) {
            return sanitized;
        }
        String[] words = sanitized.split("\\s+");
        List<String> formatted = new ArrayList<>(words.length);
        for (int i = 0; i < words.length; i++) {
            String word = words[i];
            String core = stripQuotes(word);
            if (i == 0 && LEGAL_FORMS.contains(core.toUpperCase(Locale.ROOT))) {
                formatted.add(word.toUpperCase(Locale.ROOT));
            } else {
                formatted.add(formatWord(word));
            }
        }
        return String.join(" ", formatted);
    }

    /**
     * Lower-case comparison key: quotes and punctuation removed, ё folded to е, legal forms
     * dropped, whitespace collapsed.
     */
    public static String matchingKey(String raw) {
        String s = sanitize(raw).toLowerCase(Locale.ROOT).replace('ё', 'е');
        for (String phrase : LEGAL_PHRASES) {
            s = s.replace(phrase, " ");
        }
        s = s.replaceAll("[^\\p{L}\\p{N}]+", " ").trim();
        if (s.isEmpty()) {
            return s;
        }
        List<String> kept = new ArrayList<>();
        for (String token : s.split(" ")) {
            if (!LEGAL_FORMS.contains(token.toUpperCase(Locale.ROOT))) {
                kept.add(token);
            }
        }
        return String.join(" ", kept);
    }

    /**
     * First run of exactly twelve digits in {@code text}, e.g. a BIN printed inside the name
     * field; empty when there is none.
     */
    public static String extractBin(String text) {
        if (text == null) {
            return "";
        }
        Matcher m = BIN_RUN.matcher(text);
        return m.find() ? m.group(1) : "";
    }

    private static String formatWord(String word) {
        int start = 0;
        while (start < word.length() && QUOTES.indexOf(word.charAt(start)) >= 0) {
            start++;
        }
        int end = word.length();
        while (end > start && QUOTES.indexOf(word.charAt(end - 1)) >= 0) {
            end--;
        }
        String core = word.substring(start, end);
        String shaped;
        if (core.isEmpty() || Character.isDigit(core.charAt(0))) {
            shaped = core;
        } else if (SHORT_LATIN.matcher(core).matches()) {
            shaped = core.toUpperCase(Locale.ROOT);
        } else {
            shaped = core.substring(0, 1).toUpperCase(Locale.ROOT) + core.substring(1).toLowerCase(Locale.ROOT);
        }
        return word.substring(0, start) + shaped + word.substring(end);
    }

    private static String stripQuotes(String word) {
        StringBuilder sb = new StringBuilder(word.length());
        for (int i = 0; i < word.length(); i++) {
            if (QUOTES.indexOf(word.charAt(i)) < 0) {
                sb.append(word.charAt(i));
            }
        }
        return sb.toString();
    }
}
