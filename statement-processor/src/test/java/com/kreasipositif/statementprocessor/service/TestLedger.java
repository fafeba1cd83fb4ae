package com.kreasipositif.statementprocessor.service;

import com.kreasipositif.statementprocessor.config.ReconciliationProperties;
import com.kreasipositif.statementprocessor.config.StatementImportProperties;
import com.kreasipositif.statementprocessor.domain.ClientRecord;
import com.kreasipositif.statementprocessor.domain.CompanyInfo;
import com.kreasipositif.statementprocessor.domain.CounterpartyAlias;
import com.kreasipositif.statementprocessor.domain.Direction;
import com.kreasipositif.statementprocessor.domain.ExistingTransaction;
import com.kreasipositif.statementprocessor.domain.PaymentType;
import com.kreasipositif.statementprocessor.domain.ReconciliationStatus;
import com.kreasipositif.statementprocessor.matching.CounterpartyMatcher;
import com.kreasipositif.statementprocessor.matching.InMemoryCounterpartyAliasStore;
import com.kreasipositif.statementprocessor.normalize.PaymentTypeClassifier;
import com.kreasipositif.statementprocessor.normalize.TransactionNormalizer;
import com.kreasipositif.statementprocessor.parser.DelimitedStatementParser;
import com.kreasipositif.statementprocessor.parser.NationalStatementParser;
import com.kreasipositif.statementprocessor.parser.SpreadsheetStatementParser;
import com.kreasipositif.statementprocessor.parser.StatementFormatDetector;
import com.kreasipositif.statementprocessor.reconciliation.DuplicateDetector;
import com.kreasipositif.statementprocessor.reconciliation.ReconciliationEngine;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Ledger snapshot shared by the service tests; mirrors the ledger-service seed data.
 */
public final class TestLedger {

    public static final CompanyInfo COMPANY = new CompanyInfo("990140001122", "KZ86 125K ZT50 0410 0100");

    public static final List<ClientRecord> CLIENTS = List.of(
            new ClientRecord("1", "Алма Трейд", "ТОО Алма Трейд", "180540012345"),
            new ClientRecord("2", "Дана Касымова", "ИП Касымова", ""),
            new ClientRecord("3", "Northwind", "Northwind Traders LLP", ""),
            new ClientRecord("4", "Степь Логистик", "ТОО Степь Логистик", "200840098765"));

    public static final List<ExistingTransaction> ENTRIES = List.of(
            new ExistingTransaction("t-100", "1", new BigDecimal("10000.00"), LocalDate.of(2026, 3, 2),
                    Direction.INCOME, "Счет 15, март", "", "", ReconciliationStatus.MANUAL),
            new ExistingTransaction("t-101", "4", new BigDecimal("95000.00"), LocalDate.of(2026, 3, 5),
                    Direction.EXPENSE, "Доставка, март", "", "", ReconciliationStatus.MANUAL),
            new ExistingTransaction("t-102", "2", new BigDecimal("50000.00"), LocalDate.of(2026, 2, 10),
                    Direction.INCOME, "Абонентское обслуживание, февраль", "", "", ReconciliationStatus.VERIFIED));

    private TestLedger() {
    }

    public static ImportContext context() {
        return context(ENTRIES);
    }

    public static ImportContext context(List<ExistingTransaction> entries) {
        return ImportContext.builder()
                .clients(CLIENTS)
                .existingTransactions(entries)
                .aliases(new InMemoryCounterpartyAliasStore(List.of(new CounterpartyAlias("NORTHWIND TRADERS", "", "3"))))
                .company(COMPANY)
                .build();
    }

    public static StatementImportService importService(ReferenceDataService referenceDataService) {
        StatementImportProperties importProperties = new StatementImportProperties();
        importProperties.getPaymentTypes().getKnpCodes().put("710", PaymentType.FULL_PAYMENT);
        importProperties.getPaymentTypes().getKnpCodes().put("859", PaymentType.FULL_PAYMENT);
        return new StatementImportService(
                new StatementFormatDetector(),
                List.of(new NationalStatementParser(), new DelimitedStatementParser(), new SpreadsheetStatementParser()),
                new TransactionNormalizer(importProperties, new PaymentTypeClassifier(importProperties)),
                new CounterpartyMatcher(importProperties),
                new DuplicateDetector(),
                new ReconciliationEngine(new ReconciliationProperties()),
                referenceDataService);
    }

    public static byte[] fixture(String name) throws IOException {
        return new ClassPathResource("statements/" + name).getContentAsByteArray();
    }
}
