package com.kreasipositif.ledgerservice.service;

import com.kreasipositif.ledgerservice.config.LedgerSeedProperties;
import com.kreasipositif.ledgerservice.config.LedgerSeedProperties.ClientEntry;
import com.kreasipositif.ledgerservice.dto.BinUpdateResponse;
import com.kreasipositif.ledgerservice.dto.ClientDto;
import com.kreasipositif.ledgerservice.dto.CompanyDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Clients and company identity, seeded from {@code ledger.*}.
 */
@Slf4j
@Service
public class ClientDirectoryService {

    private final LedgerSeedProperties properties;
    private final Map<String, ClientDto> clients = new ConcurrentHashMap<>();

    public ClientDirectoryService(LedgerSeedProperties properties) {
        this.properties = properties;
        for (ClientEntry entry : properties.getClients()) {
            clients.put(entry.getId(), ClientDto.builder()
                    .id(entry.getId())
                    .name(nullToEmpty(entry.getName()))
                    .company(nullToEmpty(entry.getCompany()))
                    .bin(digits(entry.getBin()))
                    .build());
        }
        log.info("Client directory seeded with {} clients", clients.size());
    }

    public CompanyDto company() {
        return CompanyDto.builder()
                .bin(digits(properties.getCompany().getBin()))
                .iban(nullToEmpty(properties.getCompany().getIban()).replace(" ", "").toUpperCase(Locale.ROOT))
                .build();
    }

    public List<ClientDto> findAll() {
        return clients.values().stream()
                .sorted(Comparator.comparing(ClientDto::getId))
                .toList();
    }

    public boolean exists(String clientId) {
        return clientId != null && clients.containsKey(clientId);
    }

    /**
     * Sets the client's BIN only when it has none. Empty when the client is unknown.
     */
    public synchronized Optional<BinUpdateResponse> backfillBin(String clientId, String bin) {
        ClientDto current = clients.get(clientId);
        if (current == null) {
            return Optional.empty();
        }
        String normalized = digits(bin);
        boolean updated = current.getBin().isEmpty() && !normalized.isEmpty();
        if (updated) {
            current = ClientDto.builder()
                    .id(current.getId())
                    .name(current.getName())
                    .company(current.getCompany())
                    .bin(normalized)
                    .build();
            clients.put(clientId, current);
            log.info("Client {} BIN set to {}", clientId, normalized);
        }
        return Optional.of(BinUpdateResponse.builder()
                .clientId(clientId)
                .bin(current.getBin())
                .updated(updated)
                .build());
    }

    static String digits(String value) {
        return value == null ? "" : value.replaceAll("\\D", "");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
