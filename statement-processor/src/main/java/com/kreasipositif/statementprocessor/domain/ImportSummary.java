package com.kreasipositif.statementprocessor.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
@Jacksonized
public class ImportSummary {

    int total;
    int matched;
    int unmatched;
    int duplicates;
    int verified;
    int discrepancies;
    int newEntries;
    int ambiguousMatches;
    int parseWarnings;
    int unconvertedForeign;
    BigDecimal incomeTotal;
    BigDecimal expenseTotal;

    /**
     * Tallies the final transaction list. Totals exclude duplicates.
     */
    public static ImportSummary of(List<ParsedTransaction> transactions, int parseWarnings) {
        int matched = 0;
        int unmatched = 0;
        int duplicates = 0;
        int verified = 0;
        int discrepancies = 0;
        int newEntries = 0;
        int ambiguous = 0;
        int unconverted = 0;
        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expense = BigDecimal.ZERO;

        for (ParsedTransaction tx : transactions) {
            switch (tx.getMatchStatus()) {
                case MATCHED -> matched++;
                case UNMATCHED -> unmatched++;
                case DUPLICATE -> duplicates++;
            }
            if (tx.isAmbiguousMatch()) {
                ambiguous++;
            }
            if (tx.isForeignAmountUnconverted()) {
                unconverted++;
            }
            if (tx.getReconciliation() != null) {
                switch (tx.getReconciliation().type()) {
                    case VERIFIED -> verified++;
                    case DISCREPANCY -> discrepancies++;
                    case NEW -> newEntries++;
                }
            }
            if (!tx.isDuplicate()) {
                if (tx.isIncome()) {
                    income = income.add(tx.getAmount());
                } else {
                    expense = expense.add(tx.getAmount());
                }
            }
        }

        return ImportSummary.builder()
                .total(transactions.size())
                .matched(matched)
                .unmatched(unmatched)
                .duplicates(duplicates)
                .verified(verified)
                .discrepancies(discrepancies)
                .newEntries(newEntries)
                .ambiguousMatches(ambiguous)
                .parseWarnings(parseWarnings)
                .unconvertedForeign(unconverted)
                .incomeTotal(income)
                .expenseTotal(expense)
                .build();
    }
}
