package com.kreasipositif.statementprocessor.matching;

import com.kreasipositif.statementprocessor.client.LedgerServiceClient;
import com.kreasipositif.statementprocessor.client.LedgerServiceClient.WriteResult;
import com.kreasipositif.statementprocessor.domain.CounterpartyAlias;
import com.kreasipositif.statementprocessor.normalize.CounterpartyNameCleaner;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Alias store backed by the ledger-service. Lookups read the current alias list; saves write
 * through with the ledger's upsert.
 */
@Component
@RequiredArgsConstructor
public class LedgerServiceAliasStore implements CounterpartyAliasStore {

    private final LedgerServiceClient ledgerServiceClient;

    @Override
    public Optional<String> find(String bankName, String bankBin) {
        return snapshot().find(bankName, bankBin);
    }

    /**
     * @throws AliasWriteException when the ledger could not be reached
     */
    @Override
    public boolean save(String bankName, String bankBin, String clientId) {
        CounterpartyAlias alias = new CounterpartyAlias(CounterpartyNameCleaner.sanitize(bankName), bankBin, clientId);
        WriteResult result = ledgerServiceClient.upsertAlias(alias);
        if (result == WriteResult.FAILED) {
            throw new AliasWriteException("alias upsert failed for '" + alias.bankName() + "' -> " + clientId);
        }
        return result == WriteResult.APPLIED;
    }

    @Override
    public List<CounterpartyAlias> findAll() {
        return ledgerServiceClient.fetchAliases();
    }

    /** Copies the current persistent aliases into an in-memory store. */
    public InMemoryCounterpartyAliasStore snapshot() {
        return new InMemoryCounterpartyAliasStore(findAll());
    }

    public static class AliasWriteException extends RuntimeException {
        public AliasWriteException(String message) {
            super(message);
        }
    }
}
