package com.kreasipositif.statementprocessor.service;

import com.kreasipositif.statementprocessor.client.LedgerServiceClient;
import com.kreasipositif.statementprocessor.domain.CompanyInfo;
import com.kreasipositif.statementprocessor.matching.InMemoryCounterpartyAliasStore;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Loads the {@link ImportContext} from the ledger-service.
 *
 * <p>Each read holds a permit of the {@code ledgerReadBulkhead} semaphore bulkhead for the
 * duration of its HTTP call, so concurrent batch partitions cannot flood the ledger. A read
 * that cannot get a permit, or fails, contributes an empty list.
 */
@Slf4j
@Service
public class ReferenceDataService {

    private final LedgerServiceClient ledgerServiceClient;
    private final Bulkhead ledgerReadBulkhead;

    public ReferenceDataService(LedgerServiceClient ledgerServiceClient,
                                @Qualifier("ledgerReadBulkhead") Bulkhead ledgerReadBulkhead) {
        this.ledgerServiceClient = ledgerServiceClient;
        this.ledgerReadBulkhead = ledgerReadBulkhead;
    }

    public ImportContext loadContext() {
        ImportContext context = ImportContext.builder()
                .clients(read("clients", ledgerServiceClient::fetchClients, List.of()))
                .existingTransactions(read("transactions", ledgerServiceClient::fetchTransactions, List.of()))
                .aliases(new InMemoryCounterpartyAliasStore(
                        read("aliases", ledgerServiceClient::fetchAliases, List.of())))
                .company(read("company", ledgerServiceClient::fetchCompany, Optional.<CompanyInfo>empty())
                        .orElse(null))
                .build();
        log.info("Reference snapshot loaded — {} clients, {} ledger entries, {} aliases, company={}",
                context.getClients().size(), context.getExistingTransactions().size(),
                context.getAliases().findAll().size(), context.getCompany() != null);
        return context;
    }

    private <T> T read(String what, Supplier<T> call, T fallback) {
        try {
            return Bulkhead.decorateSupplier(ledgerReadBulkhead, call).get();
        } catch (BulkheadFullException e) {
            log.warn("Bulkhead full while reading {} from ledger-service: {}", what, e.getMessage());
            return fallback;
        }
    }
}
