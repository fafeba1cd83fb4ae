package com.kreasipositif.statementprocessor.service;

import com.kreasipositif.statementprocessor.domain.ClientRecord;
import com.kreasipositif.statementprocessor.domain.CompanyInfo;
import com.kreasipositif.statementprocessor.domain.ExistingTransaction;
import com.kreasipositif.statementprocessor.matching.CounterpartyAliasStore;
import com.kreasipositif.statementprocessor.matching.InMemoryCounterpartyAliasStore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Reference data an import runs against. The engine only reads it.
 */
@Value
@Builder
public class ImportContext {

    @Singular
    List<ClientRecord> clients;

    @Singular
    List<ExistingTransaction> existingTransactions;

    @Builder.Default
    CounterpartyAliasStore aliases = new InMemoryCounterpartyAliasStore();

    /** {@code null} when the organization has not registered its own identifiers. */
    CompanyInfo company;

    public static ImportContext empty() {
        return ImportContext.builder().build();
    }
}
