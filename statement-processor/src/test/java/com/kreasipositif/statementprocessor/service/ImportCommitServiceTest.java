package com.kreasipositif.statementprocessor.service;

import com.kreasipositif.statementprocessor.client.LedgerServiceClient;
import com.kreasipositif.statementprocessor.client.LedgerServiceClient.WriteResult;
import com.kreasipositif.statementprocessor.domain.CounterpartyAlias;
import com.kreasipositif.statementprocessor.domain.ImportResult;
import com.kreasipositif.statementprocessor.domain.ImportSummary;
import com.kreasipositif.statementprocessor.domain.LedgerEntryDraft;
import com.kreasipositif.statementprocessor.domain.MatchSource;
import com.kreasipositif.statementprocessor.domain.MatchStatus;
import com.kreasipositif.statementprocessor.domain.ParsedTransaction;
import com.kreasipositif.statementprocessor.domain.PaymentType;
import com.kreasipositif.statementprocessor.domain.Reconciliation;
import com.kreasipositif.statementprocessor.matching.LedgerServiceAliasStore;
import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ImportCommitServiceTest {

    private LedgerServiceClient ledgerServiceClient;
    private ThreadPoolBulkhead bulkhead;
    private ImportCommitService commitService;
    private StatementImportService importService;

    @BeforeEach
    void setUp() {
        ledgerServiceClient = mock(LedgerServiceClient.class);
        bulkhead = ThreadPoolBulkhead.ofDefaults("test-ledger-write");
        commitService = new ImportCommitService(ledgerServiceClient,
                new LedgerServiceAliasStore(ledgerServiceClient), bulkhead);
        importService = TestLedger.importService(mock(ReferenceDataService.class));

        when(ledgerServiceClient.appendTransactions(anyList())).thenAnswer(inv -> {
            List<LedgerEntryDraft> drafts = inv.getArgument(0);
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < drafts.size(); i++) {
                ids.add(drafts.get(i).linkedTransactionId() != null ? drafts.get(i).linkedTransactionId() : "new-" + i);
            }
            return ids;
        });
        when(ledgerServiceClient.upsertAlias(any())).thenReturn(WriteResult.APPLIED);
        when(ledgerServiceClient.backfillBin(anyString(), anyString())).thenReturn(WriteResult.APPLIED);
    }

    @AfterEach
    void tearDown() throws Exception {
        bulkhead.close();
    }

    // ─── drafts ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Default selection commits every row; reconciled rows link to their ledger entry")
    void commit_defaultSelection() throws IOException {
        ImportResult result = nationalImport();

        CommitReport report = commitService.commit(result, CommitRequest.defaults());

        List<LedgerEntryDraft> drafts = capturedDrafts();
        assertThat(drafts).extracting(LedgerEntryDraft::clientId).containsExactly("1", "4", "3");
        assertThat(drafts).extracting(LedgerEntryDraft::linkedTransactionId).containsExactly("t-100", "t-101", null);
        assertThat(report.committed()).isEqualTo(3);
        assertThat(report.linked()).isEqualTo(2);
        assertThat(report.skipped()).isZero();
        assertThat(report.failedWrites()).isEmpty();
    }

    @Test
    @DisplayName("Committed description carries purpose, conversion, KNP, bank direction and document tags")
    void commit_descriptionTags() throws IOException {
        commitService.commit(nationalImport(), CommitRequest.defaults());

        List<LedgerEntryDraft> drafts = capturedDrafts();
        assertThat(drafts.get(0).description())
                .isEqualTo("Оплата по счету 15 за март [KNP:710] [BANK:IN] [DOC:4411]");
        assertThat(drafts.get(1).description()).endsWith("[BANK:OUT] [DOC:4412]");
        assertThat(drafts.get(2).description()).contains("[100 USD x 450.5]");
        assertThat(drafts.get(0).bankClientName()).isEqualTo("ТОО \"АЛМА ТРЕЙД\"");
        assertThat(drafts.get(0).bankDocumentNumber()).isEqualTo("4411");
    }

    @Test
    @DisplayName("Unmatched rows without an override are skipped; out-of-range rows are skipped")
    void commit_skipsRowsWithoutClient() throws IOException {
        ImportResult result = importService.importStatement("delimited-march.csv",
                TestLedger.fixture("delimited-march.csv"), TestLedger.context());

        CommitReport report = commitService.commit(result, new CommitRequest(List.of(0, 2, 17), Map.of()));

        assertThat(capturedDrafts()).hasSize(1);
        assertThat(report.committed()).isEqualTo(1);
        assertThat(report.skipped()).isEqualTo(2);
    }

    // ─── learning ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Override assigns the client, drops the link and learns an alias")
    void commit_overrideLearnsAlias() throws IOException {
        ImportResult result = importService.importStatement("delimited-march.csv",
                TestLedger.fixture("delimited-march.csv"), TestLedger.context());

        CommitReport report = commitService.commit(result, new CommitRequest(List.of(2), Map.of(2, "2")));

        LedgerEntryDraft draft = capturedDrafts().get(0);
        assertThat(draft.clientId()).isEqualTo("2");
        assertThat(draft.linkedTransactionId()).isNull();
        ArgumentCaptor<CounterpartyAlias> alias = ArgumentCaptor.forClass(CounterpartyAlias.class);
        verify(ledgerServiceClient).upsertAlias(alias.capture());
        assertThat(alias.getValue().bankName()).isEqualTo("ИП Касымова Д.");
        assertThat(alias.getValue().clientId()).isEqualTo("2");
        assertThat(report.aliasesLearned()).isEqualTo(1);
        assertThat(report.binsBackfilled()).isZero();
    }

    @Test
    @DisplayName("Name-tier match with a statement BIN backfills the client's BIN and learns the alias")
    void commit_nameMatchBackfillsBin() {
        ParsedTransaction byName = nameMatched();
        ImportResult result = ImportResult.builder()
                .fileName("manual.csv")
                .transaction(byName)
                .summary(ImportSummary.of(List.of(byName), 0))
                .build();

        CommitReport report = commitService.commit(result, CommitRequest.defaults());

        verify(ledgerServiceClient).backfillBin("2", "170340011111");
        verify(ledgerServiceClient).upsertAlias(any());
        assertThat(report.binsBackfilled()).isEqualTo(1);
        assertThat(report.aliasesLearned()).isEqualTo(1);
    }

    @Test
    @DisplayName("BIN-tier matches neither learn aliases nor touch BINs")
    void commit_binMatchLearnsNothing() throws IOException {
        commitService.commit(nationalImport(), new CommitRequest(List.of(0, 1), Map.of()));

        verify(ledgerServiceClient, never()).upsertAlias(any());
        verify(ledgerServiceClient, never()).backfillBin(anyString(), anyString());
    }

    // ─── failures ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Failed alias and BIN writes are reported without aborting the commit")
    void commit_failedWritesReported() {
        when(ledgerServiceClient.upsertAlias(any())).thenReturn(WriteResult.FAILED);
        when(ledgerServiceClient.backfillBin(anyString(), anyString())).thenReturn(WriteResult.FAILED);
        ParsedTransaction byName = nameMatched();
        ImportResult result = ImportResult.builder()
                .fileName("manual.csv")
                .transaction(byName)
                .summary(ImportSummary.of(List.of(byName), 0))
                .build();

        CommitReport report = commitService.commit(result, CommitRequest.defaults());

        assertThat(report.committed()).isEqualTo(1);
        assertThat(report.aliasesLearned()).isZero();
        assertThat(report.binsBackfilled()).isZero();
        assertThat(report.failedWrites()).hasSize(2);
    }

    @Test
    @DisplayName("Unreachable ledger on append is reported and nothing counts as committed")
    void commit_appendFailure() throws IOException {
        when(ledgerServiceClient.appendTransactions(anyList())).thenReturn(List.of());

        CommitReport report = commitService.commit(nationalImport(), CommitRequest.defaults());

        assertThat(report.committed()).isZero();
        assertThat(report.linked()).isZero();
        assertThat(report.failedWrites()).singleElement().asString().startsWith("ledger append");
    }

    private ImportResult nationalImport() throws IOException {
        return importService.importStatement("national-march.txt",
                TestLedger.fixture("national-march.txt"), TestLedger.context());
    }

    @SuppressWarnings("unchecked")
    private List<LedgerEntryDraft> capturedDrafts() {
        ArgumentCaptor<List<LedgerEntryDraft>> captor = ArgumentCaptor.forClass(List.class);
        verify(ledgerServiceClient).appendTransactions(captor.capture());
        return captor.getValue();
    }

    /** "ИП Касымова" with a BIN the ledger does not know yet, matched to client 2 by name. */
    private static ParsedTransaction nameMatched() {
        return ParsedTransaction.builder()
                .sourceLine(7)
                .date(LocalDate.of(2026, 3, 12))
                .income(true)
                .amount(new BigDecimal("50000.00"))
                .currency("KZT")
                .clientNameRaw("ИП Касымова")
                .clientName("ИП Касымова")
                .clientNameKey("касымова")
                .clientBin("170340011111")
                .documentNumber("4415")
                .description("Абонентское обслуживание, март")
                .knpCode("")
                .paymentType(PaymentType.RETAINER)
                .matchStatus(MatchStatus.MATCHED)
                .matchSource(MatchSource.NAME)
                .matchedClientId("2")
                .reconciliation(Reconciliation.newEntry())
                .build();
    }
}
