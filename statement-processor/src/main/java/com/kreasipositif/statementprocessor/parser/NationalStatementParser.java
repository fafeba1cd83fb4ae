package com.kreasipositif.statementprocessor.parser;

import com.kreasipositif.statementprocessor.domain.Party;
import com.kreasipositif.statementprocessor.domain.StatementFormat;
import com.kreasipositif.statementprocessor.domain.StatementLine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the 1C "ClientBankExchange" export.
 *
 * <p>The file is a list of {@code Key=Value} lines. Each payment sits between a
 * {@code СекцияДокумент=...} line and {@code КонецДокумента}; everything outside those blocks is
 * statement-level header, of which only the statement account ({@code РасчСчет}) is kept. The
 * format does not say which side is the statement owner, so lines leave this parser without a
 * direction.
 */
@Slf4j
@Component
public class NationalStatementParser implements StatementParser {

    private static final String BLOCK_START = "секциядокумент";
    private static final String BLOCK_END = "конецдокумента";
    private static final String STATEMENT_ACCOUNT = "расчсчет";

    private static final String[] DATE_KEYS = {"ДатаДокумента", "ДатаОперации", "ДатаПоступило", "ДатаСписано"};
    private static final String[] PAYER_NAME_KEYS = {"ПлательщикНаименование", "Плательщик", "Плательщик1"};
    private static final String[] PAYER_BIN_KEYS = {
            "Плательщик_ИНН", "Плательщик_БИН", "ПлательщикИНН", "ПлательщикБИН", "ПлательщикИИН"};
    private static final String[] PAYER_ACCOUNT_KEYS = {"ПлательщикИИК", "ПлательщикСчет", "ПлательщикРасчСчет"};
    private static final String[] PAYEE_NAME_KEYS = {"ПолучательНаименование", "Получатель", "Получатель1"};
    private static final String[] PAYEE_BIN_KEYS = {
            "Получатель_ИНН", "Получатель_БИН", "ПолучательИНН", "ПолучательБИН", "ПолучательИИН"};
    private static final String[] PAYEE_ACCOUNT_KEYS = {"ПолучательИИК", "ПолучательСчет", "ПолучательРасчСчет"};
    private static final String[] KNP_KEYS = {"КодНазначенияПлатежа", "КНП"};
    private static final String[] RATE_KEYS = {"Курс", "КурсВалюты"};

    @Override
    public boolean supports(DetectedStatement statement) {
        return statement.format() == StatementFormat.NATIONAL_TXT;
    }

    @Override
    public ParseOutcome parse(DetectedStatement statement) {
        String[] lines = statement.text().split("\n", -1);
        List<StatementLine> result = new ArrayList<>();
        int warnings = 0;
        String statementAccount = "";

        Map<String, String> block = null;
        int blockStart = 0;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            int eq = line.indexOf('=');
            String key = (eq < 0 ? line : line.substring(0, eq)).trim().toLowerCase(Locale.ROOT);
            String value = eq < 0 ? "" : line.substring(eq + 1).trim();

            if (key.equals(BLOCK_START)) {
                if (block != null) {
                    warnings++;
                    log.debug("{}: document at line {} has no КонецДокумента, dropped", statement.fileName(), blockStart);
                }
                block = new HashMap<>();
                blockStart = i + 1;
            } else if (key.equals(BLOCK_END)) {
                if (block == null) {
                    continue;
                }
                try {
                    result.add(toLine(block, blockStart));
                } catch (MalformedStatementRecordException e) {
                    warnings++;
                    log.debug("{}: document at line {} dropped: {}", statement.fileName(), blockStart, e.getMessage());
                }
                block = null;
            } else if (block != null) {
                block.putIfAbsent(key, value);
            } else if (key.equals(STATEMENT_ACCOUNT) && statementAccount.isEmpty()) {
                statementAccount = value;
            }
        }
        if (block != null) {
            warnings++;
            log.debug("{}: document at line {} has no КонецДокумента, dropped", statement.fileName(), blockStart);
        }
        return new ParseOutcome(result, warnings, statementAccount);
    }

    private StatementLine toLine(Map<String, String> block, int sourceLine) {
        String rawDate = first(block, DATE_KEYS);
        LocalDate date = StatementValues.parseDate(rawDate);
        if (date == null) {
            throw new MalformedStatementRecordException("no parseable date in '" + rawDate + "'");
        }
        BigDecimal amount = StatementValues.parseAmount(first(block, "Сумма"));
        if (amount == null || amount.signum() == 0) {
            throw new MalformedStatementRecordException("no non-zero amount");
        }

        String purpose = first(block, "НазначениеПлатежа");
        BigDecimal rate = StatementValues.parseAmount(first(block, RATE_KEYS));
        if (rate == null || rate.signum() <= 0) {
            rate = StatementValues.rateFromPurpose(purpose);
        }

        return StatementLine.builder()
                .sourceLine(sourceLine)
                .date(date)
                .amount(amount.abs())
                .payer(new Party(first(block, PAYER_NAME_KEYS), first(block, PAYER_BIN_KEYS),
                        first(block, PAYER_ACCOUNT_KEYS)))
                .payee(new Party(first(block, PAYEE_NAME_KEYS), first(block, PAYEE_BIN_KEYS),
                        first(block, PAYEE_ACCOUNT_KEYS)))
                .currency(first(block, "Валюта").toUpperCase(Locale.ROOT))
                .exchangeRate(rate)
                .description(purpose)
                .documentNumber(first(block, "НомерДокумента"))
                .knpCode(first(block, KNP_KEYS))
                .build();
    }

    private static String first(Map<String, String> block, String... keys) {
        for (String key : keys) {
            String value = block.get(key.toLowerCase(Locale.ROOT));
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return "";
    }
}
