package com.kreasipositif.statementprocessor.reconciliation;

import com.kreasipositif.statementprocessor.domain.Direction;
import com.kreasipositif.statementprocessor.domain.ExistingTransaction;
import com.kreasipositif.statementprocessor.domain.MatchStatus;
import com.kreasipositif.statementprocessor.domain.ParsedTransaction;
import com.kreasipositif.statementprocessor.domain.ReconciliationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.kreasipositif.statementprocessor.reconciliation.ReconciliationEngineTest.matched;
import static org.assertj.core.api.Assertions.assertThat;

class DuplicateDetectorTest {

    private static final LocalDate DATE = LocalDate.of(2026, 3, 3);

    private final DuplicateDetector detector = new DuplicateDetector();

    @Test
    @DisplayName("Document number already committed by a bank import is a duplicate")
    void byDocumentNumber() {
        ParsedTransaction tx = matched("1", "10000.00", DATE).toBuilder().documentNumber("4411").build();
        ExistingTransaction committed = new ExistingTransaction("e-1", "1", new BigDecimal("10000.00"),
                DATE.minusDays(5), Direction.INCOME, "Оплата", "4411", "ТОО АЛМА ТРЕЙД", ReconciliationStatus.BANK_IMPORT);

        ParsedTransaction result = detector.flagDuplicates(List.of(tx), List.of(committed)).get(0);

        assertThat(result.getMatchStatus()).isEqualTo(MatchStatus.DUPLICATE);
        assertThat(result.getMatchedClientId()).isNull();
        assertThat(result.getReconciliation()).isNull();
    }

    @Test
    @DisplayName("Document number found only in a description tag is a duplicate too")
    void byDocumentTag() {
        ParsedTransaction tx = matched("1", "10000.00", DATE).toBuilder().documentNumber("4411").build();
        ExistingTransaction settled = new ExistingTransaction("t-100", "1", new BigDecimal("10000.00"), DATE,
                Direction.INCOME, "Оплата [KNP:710] [BANK:IN] [DOC:4411]", "", "", ReconciliationStatus.VERIFIED);

        assertThat(detector.flagDuplicates(List.of(tx), List.of(settled)).get(0).isDuplicate()).isTrue();
    }

    @Test
    @DisplayName("Row with a document number is not a duplicate when that number is new")
    void newDocumentNumber() {
        ParsedTransaction tx = matched("1", "10000.00", DATE).toBuilder().documentNumber("4499").build();
        ExistingTransaction committed = new ExistingTransaction("e-1", "1", new BigDecimal("10000.00"), DATE,
                Direction.INCOME, "", "4411", "ТОО Алма Трейд", ReconciliationStatus.BANK_IMPORT);

        assertThat(detector.flagDuplicates(List.of(tx), List.of(committed)).get(0).isDuplicate()).isFalse();
    }

    @Test
    @DisplayName("Without a document number, same date, amount, direction and counterparty is a duplicate")
    void withoutDocumentNumber() {
        ParsedTransaction tx = matched("1", "10000.00", DATE);
        ExistingTransaction sameName = new ExistingTransaction("e-1", "", new BigDecimal("10000"), DATE,
                Direction.INCOME, "[BANK:IN]", "", "ТОО «Алма Трейд»", ReconciliationStatus.BANK_IMPORT);
        ExistingTransaction otherDay = new ExistingTransaction("e-2", "1", new BigDecimal("10000"), DATE.plusDays(1),
                Direction.INCOME, "[BANK:IN]", "", "ТОО Алма Трейд", ReconciliationStatus.BANK_IMPORT);

        assertThat(detector.flagDuplicates(List.of(tx), List.of(sameName)).get(0).isDuplicate()).isTrue();
        assertThat(detector.flagDuplicates(List.of(tx), List.of(otherDay)).get(0).isDuplicate()).isFalse();
    }

    @Test
    @DisplayName("Without a document number, a settled entry is compared by the bank amount and date")
    void settledEntryComparedByBankSide() {
        ExistingTransaction discrepancy = new ExistingTransaction("t-100", "1", new BigDecimal("10000.00"),
                DATE.minusDays(1), Direction.INCOME, "Счет 15 [BANK:IN]", "", "ТОО Алма Трейд",
                ReconciliationStatus.DISCREPANCY, new BigDecimal("9600.00"), DATE);
        ExistingTransaction verified = new ExistingTransaction("t-100", "1", new BigDecimal("10000.00"),
                DATE.minusDays(1), Direction.INCOME, "Счет 15 [BANK:IN]", "", "ТОО Алма Трейд",
                ReconciliationStatus.VERIFIED, new BigDecimal("10000.00"), DATE);

        assertThat(detector.flagDuplicates(List.of(matched("1", "9600.00", DATE)), List.of(discrepancy))
                .get(0).isDuplicate()).isTrue();
        assertThat(detector.flagDuplicates(List.of(matched("1", "10000.00", DATE)), List.of(verified))
                .get(0).isDuplicate()).isTrue();
        assertThat(detector.flagDuplicates(List.of(matched("1", "10000.00", DATE.minusDays(1))), List.of(verified))
                .get(0).isDuplicate()).isFalse();
    }

    @Test
    @DisplayName("Manually entered ledger entries are never duplicates")
    void manualEntryIsNotDuplicate() {
        ParsedTransaction tx = matched("1", "10000.00", DATE);
        ExistingTransaction manual = new ExistingTransaction("t-100", "1", new BigDecimal("10000"), DATE,
                Direction.INCOME, "Оплата по счету 15", "", "", ReconciliationStatus.MANUAL);

        ParsedTransaction result = detector.flagDuplicates(List.of(tx), List.of(manual)).get(0);

        assertThat(result.getMatchStatus()).isEqualTo(MatchStatus.MATCHED);
        assertThat(result.getMatchedClientId()).isEqualTo("1");
    }
}
