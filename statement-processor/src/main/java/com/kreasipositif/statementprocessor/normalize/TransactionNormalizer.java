package com.kreasipositif.statementprocessor.normalize;

import com.kreasipositif.statementprocessor.config.StatementImportProperties;
import com.kreasipositif.statementprocessor.domain.CompanyInfo;
import com.kreasipositif.statementprocessor.domain.Direction;
import com.kreasipositif.statementprocessor.domain.Identifiers;
import com.kreasipositif.statementprocessor.domain.MatchSource;
import com.kreasipositif.statementprocessor.domain.MatchStatus;
import com.kreasipositif.statementprocessor.domain.ParsedTransaction;
import com.kreasipositif.statementprocessor.domain.Party;
import com.kreasipositif.statementprocessor.domain.StatementLine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;
import java.util.Locale;

/**
 * Turns a {@link StatementLine} into an unmatched {@link ParsedTransaction}: direction,
 * counterparty, base-currency amount, cleaned names and payment type.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionNormalizer {

    private final StatementImportProperties properties;
    private final PaymentTypeClassifier paymentTypeClassifier;

    /**
     * @param statementAccount account the statement was issued for, empty when unknown
     * @param company          own-company identity, may be {@code null}
     */
    public ParsedTransaction normalize(StatementLine line, String statementAccount, CompanyInfo company) {
        Direction direction = line.getDirection() != null
                ? line.getDirection()
                : isSelf(line.getPayer(), statementAccount, company) ? Direction.EXPENSE : Direction.INCOME;
        Party counterparty = direction.isIncome() ? line.getPayer() : line.getPayee();

        String rawName = counterparty.name();
        String bin = counterparty.bin().isEmpty() ? CounterpartyNameCleaner.extractBin(rawName) : counterparty.bin();

        String baseCurrency = properties.getBaseCurrency().toUpperCase(Locale.ROOT);
        String currency = resolveCurrency(line.getCurrency(), baseCurrency);
        int scale = fractionDigits(baseCurrency);

        BigDecimal amount;
        BigDecimal amountOriginal = null;
        BigDecimal rate = null;
        boolean unconverted = false;
        if (currency.equals(baseCurrency)) {
            amount = line.getAmount().setScale(scale, RoundingMode.HALF_EVEN);
        } else {
            amountOriginal = line.getAmount();
            rate = line.getExchangeRate();
            if (rate != null) {
                amount = amountOriginal.multiply(rate).setScale(scale, RoundingMode.HALF_EVEN);
            } else {
                amount = amountOriginal.setScale(Math.max(scale, amountOriginal.scale()), RoundingMode.HALF_EVEN);
                unconverted = true;
                log.debug("Line {}: {} {} has no exchange rate, kept unconverted",
                        line.getSourceLine(), amountOriginal.toPlainString(), currency);
            }
        }

        return ParsedTransaction.builder()
                .sourceLine(line.getSourceLine())
                .date(line.getDate())
                .income(direction.isIncome())
                .amount(amount)
                .currency(currency)
                .amountOriginal(amountOriginal)
                .exchangeRate(rate)
                .foreignAmountUnconverted(unconverted)
                .clientNameRaw(rawName)
                .clientName(CounterpartyNameCleaner.displayName(rawName))
                .clientNameKey(CounterpartyNameCleaner.matchingKey(rawName))
                .clientBin(bin)
                .documentNumber(line.getDocumentNumber())
                .description(line.getDescription())
                .knpCode(line.getKnpCode())
                .paymentType(paymentTypeClassifier.classify(line.getKnpCode(), line.getDescription()))
                .matchStatus(MatchStatus.UNMATCHED)
                .matchSource(MatchSource.NONE)
                .build();
    }

    private static boolean isSelf(Party payer, String statementAccount, CompanyInfo company) {
        if (company != null) {
            if (!company.bin().isEmpty() && company.bin().equals(payer.bin())) {
                return true;
            }
            if (!company.iban().isEmpty() && company.iban().equals(payer.account())) {
                return true;
            }
        }
        String account = Identifiers.account(statementAccount);
        return !account.isEmpty() && account.equals(payer.account());
    }

    private static String resolveCurrency(String code, String baseCurrency) {
        String trimmed = Identifiers.trimToEmpty(code).toUpperCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            return baseCurrency;
        }
        if (trimmed.length() <= 3 && trimmed.chars().allMatch(Character::isDigit)) {
            int numeric = Integer.parseInt(trimmed);
            for (Currency currency : Currency.getAvailableCurrencies()) {
                if (currency.getNumericCode() == numeric) {
                    return currency.getCurrencyCode();
                }
            }
        }
        return trimmed;
    }

    private static int fractionDigits(String currencyCode) {
        try {
            return Math.max(0, Currency.getInstance(currencyCode).getDefaultFractionDigits());
        } catch (IllegalArgumentException e) {
            return 2;
        }
    }
}
