package com.kreasipositif.statementprocessor.parser;

import com.kreasipositif.statementprocessor.domain.Direction;
import com.kreasipositif.statementprocessor.domain.Party;
import com.kreasipositif.statementprocessor.domain.StatementLine;
import com.kreasipositif.statementprocessor.parser.StatementColumnLayout.Column;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps one tabular row (CSV record or spreadsheet row) to a {@link StatementLine}.
 *
 * <p>Direction is taken from whichever of the credit or debit columns is populated; failing
 * that from the operation-type column; failing that from the sign of the amount column.
 */
class StatementRowMapper {

    private static final Set<String> INCOME_WORDS = Set.of("in", "cr", "+", "income", "incoming", "credit");
    private static final Set<String> EXPENSE_WORDS = Set.of("out", "dr", "-", "expense", "outgoing", "debit");
    private static final List<String> INCOME_STEMS = List.of("приход", "зачисл", "поступл", "кредит", "кіріс");
    private static final List<String> EXPENSE_STEMS = List.of("расход", "списан", "дебет", "шығыс");

    private final StatementColumnLayout layout;

    StatementRowMapper(StatementColumnLayout layout) {
        this.layout = layout;
    }

    StatementLine map(List<String> cells, int sourceLine) {
        LocalDate date = StatementValues.parseDate(layout.cell(cells, Column.DATE));
        if (date == null) {
            throw new MalformedStatementRecordException(
                    "no parseable date in '" + layout.cell(cells, Column.DATE) + "'");
        }

        BigDecimal amount;
        Direction direction;
        BigDecimal credit = StatementValues.parseAmount(layout.cell(cells, Column.CREDIT));
        BigDecimal debit = StatementValues.parseAmount(layout.cell(cells, Column.DEBIT));
        if (credit != null && credit.signum() != 0) {
            amount = credit.abs();
            direction = Direction.INCOME;
        } else if (debit != null && debit.signum() != 0) {
            amount = debit.abs();
            direction = Direction.EXPENSE;
        } else {
            BigDecimal signed = StatementValues.parseAmount(layout.cell(cells, Column.AMOUNT));
            if (signed == null || signed.signum() == 0) {
                throw new MalformedStatementRecordException("no non-zero amount");
            }
            amount = signed.abs();
            direction = directionOf(layout.cell(cells, Column.DIRECTION), signed);
        }

        Party counterparty = new Party(layout.cell(cells, Column.NAME), layout.cell(cells, Column.BIN), "");
        String currency = layout.cell(cells, Column.CURRENCY).toUpperCase(Locale.ROOT);
        BigDecimal rate = StatementValues.parseAmount(layout.cell(cells, Column.RATE));

        return StatementLine.builder()
                .sourceLine(sourceLine)
                .date(date)
                .amount(amount)
                .direction(direction)
                .payer(direction == Direction.INCOME ? counterparty : Party.EMPTY)
                .payee(direction == Direction.EXPENSE ? counterparty : Party.EMPTY)
                .currency(currency)
                .exchangeRate(rate != null && rate.signum() > 0 ? rate : null)
                .description(layout.cell(cells, Column.DESCRIPTION))
                .documentNumber(layout.cell(cells, Column.DOCUMENT))
                .knpCode(layout.cell(cells, Column.KNP))
                .build();
    }

    private static Direction directionOf(String typeCell, BigDecimal signedAmount) {
        String type = typeCell.toLowerCase(Locale.ROOT).trim();
        if (type.isEmpty()) {
            return signedAmount.signum() < 0 ? Direction.EXPENSE : Direction.INCOME;
        }
        if (INCOME_WORDS.contains(type) || INCOME_STEMS.stream().anyMatch(type::contains)) {
            return Direction.INCOME;
        }
        if (EXPENSE_WORDS.contains(type) || EXPENSE_STEMS.stream().anyMatch(type::contains)) {
            return Direction.EXPENSE;
        }
        if (signedAmount.signum() < 0) {
            return Direction.EXPENSE;
        }
        throw new MalformedStatementRecordException("undeterminable direction '" + typeCell + "'");
    }
}
