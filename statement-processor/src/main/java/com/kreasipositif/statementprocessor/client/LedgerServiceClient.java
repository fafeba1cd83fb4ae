package com.kreasipositif.statementprocessor.client;

import com.kreasipositif.statementprocessor.domain.ClientRecord;
import com.kreasipositif.statementprocessor.domain.CompanyInfo;
import com.kreasipositif.statementprocessor.domain.CounterpartyAlias;
import com.kreasipositif.statementprocessor.domain.ExistingTransaction;
import com.kreasipositif.statementprocessor.domain.LedgerEntryDraft;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Optional;

/**
 * REST client for the ledger-service (port 8082).
 *
 * <p>Reads return an empty result when the call fails, so an unreachable ledger degrades an
 * import to "everything unmatched" instead of failing it. Writes report failure through their
 * return value.
 */
@Slf4j
@Component
public class LedgerServiceClient {

    private final RestClient restClient;

    public LedgerServiceClient(
            RestClient.Builder builder,
            @Value("${downstream.ledger-service.base-url}") String baseUrl) {
        this.restClient = builder.baseUrl(baseUrl).build();
    }

    // ─── Reference data ──────────────────────────────────────────────────────

    /**
     * Calls {@code GET /api/v1/ledger/clients}.
     */
    public List<ClientRecord> fetchClients() {
        try {
            List<ClientRecord> clients = restClient.get()
                    .uri("/api/v1/ledger/clients")
                    .retrieve()
                    .body(new ParameterizedTypeReference<List<ClientRecord>>() {});
            return clients != null ? clients : List.of();
        } catch (RestClientException e) {
            log.warn("Client list call failed: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Calls {@code GET /api/v1/ledger/transactions}.
     */
    public List<ExistingTransaction> fetchTransactions() {
        try {
            List<ExistingTransaction> transactions = restClient.get()
                    .uri("/api/v1/ledger/transactions")
                    .retrieve()
                    .body(new ParameterizedTypeReference<List<ExistingTransaction>>() {});
            return transactions != null ? transactions : List.of();
        } catch (RestClientException e) {
            log.warn("Ledger transaction list call failed: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Calls {@code GET /api/v1/ledger/aliases}.
     */
    public List<CounterpartyAlias> fetchAliases() {
        try {
            List<CounterpartyAlias> aliases = restClient.get()
                    .uri("/api/v1/ledger/aliases")
                    .retrieve()
                    .body(new ParameterizedTypeReference<List<CounterpartyAlias>>() {});
            return aliases != null ? aliases : List.of();
        } catch (RestClientException e) {
            log.warn("Alias list call failed: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Calls {@code GET /api/v1/ledger/company}.
     */
    public Optional<CompanyInfo> fetchCompany() {
        try {
            return Optional.ofNullable(restClient.get()
                    .uri("/api/v1/ledger/company")
                    .retrieve()
                    .body(CompanyInfo.class));
        } catch (RestClientException e) {
            log.warn("Company identity call failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ─── Writes ──────────────────────────────────────────────────────────────

    /**
     * Calls {@code PUT /api/v1/ledger/aliases}.
     */
    public WriteResult upsertAlias(CounterpartyAlias alias) {
        try {
            AliasUpsertResponse response = restClient.put()
                    .uri("/api/v1/ledger/aliases")
                    .body(alias)
                    .retrieve()
                    .body(AliasUpsertResponse.class);
            if (response == null) {
                return WriteResult.FAILED;
            }
            return response.changed() ? WriteResult.APPLIED : WriteResult.UNCHANGED;
        } catch (RestClientException e) {
            log.warn("Alias upsert failed for bankName='{}', bankBin='{}': {}",
                    alias.bankName(), alias.bankBin(), e.getMessage());
            return WriteResult.FAILED;
        }
    }

    /**
     * Calls {@code PATCH /api/v1/ledger/clients/{id}/bin}. The ledger only sets the BIN when
     * the client has none.
     */
    public WriteResult backfillBin(String clientId, String bin) {
        try {
            BinUpdateResponse response = restClient.patch()
                    .uri("/api/v1/ledger/clients/{id}/bin", clientId)
                    .body(new BinUpdateRequest(bin))
                    .retrieve()
                    .body(BinUpdateResponse.class);
            if (response == null) {
                return WriteResult.FAILED;
            }
            return response.updated() ? WriteResult.APPLIED : WriteResult.UNCHANGED;
        } catch (RestClientException e) {
            log.warn("BIN backfill failed for client '{}': {}", clientId, e.getMessage());
            return WriteResult.FAILED;
        }
    }

    /**
     * Calls {@code POST /api/v1/ledger/transactions/bulk}.
     *
     * @return ids of the written entries in draft order (a linked draft yields the id of the entry
     *         it settled); empty when the call failed
     */
    public List<String> appendTransactions(List<LedgerEntryDraft> drafts) {
        try {
            BulkAppendResponse response = restClient.post()
                    .uri("/api/v1/ledger/transactions/bulk")
                    .body(new BulkAppendRequest(drafts))
                    .retrieve()
                    .body(BulkAppendResponse.class);
            if (response == null || response.entryIds() == null) {
                log.warn("Bulk ledger append returned null response");
                return List.of();
            }
            return response.entryIds();
        } catch (RestClientException e) {
            log.warn("Bulk ledger append of {} drafts failed: {}", drafts.size(), e.getMessage());
            return List.of();
        }
    }

    // ─── Request / Response records ──────────────────────────────────────────

    public enum WriteResult {
        APPLIED,
        UNCHANGED,
        FAILED
    }

    public record AliasUpsertResponse(String bankName, String bankBin, String clientId, boolean changed) {}

    public record BinUpdateRequest(String bin) {}

    public record BinUpdateResponse(String clientId, String bin, boolean updated) {}

    public record BulkAppendRequest(List<LedgerEntryDraft> entries) {}

    public record BulkAppendResponse(int totalCreated, int totalLinked, List<String> entryIds) {}
}
