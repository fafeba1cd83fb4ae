package com.kreasipositif.ledgerservice.service;

import com.kreasipositif.ledgerservice.config.LedgerSeedProperties;
import com.kreasipositif.ledgerservice.config.LedgerSeedProperties.AliasEntry;
import com.kreasipositif.ledgerservice.dto.AliasUpsertResponse;
import com.kreasipositif.ledgerservice.dto.CounterpartyAliasDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Learned counterparty aliases.
 *
 * <p>An alias is keyed by its BIN when it has one, otherwise by its lower-cased name with
 * collapsed whitespace. Upserts are last-write-wins; storing an alias that already resolves to
 * the same client changes nothing.
 */
@Slf4j
@Service
public class CounterpartyAliasService {

    private final Map<String, CounterpartyAliasDto> aliases = new LinkedHashMap<>();

    public CounterpartyAliasService(LedgerSeedProperties properties) {
        for (AliasEntry entry : properties.getAliases()) {
            upsert(new CounterpartyAliasDto(entry.getBankName(), entry.getBankBin(), entry.getClientId()));
        }
        log.info("Alias store seeded with {} aliases", aliases.size());
    }

    public synchronized List<CounterpartyAliasDto> findAll() {
        return new ArrayList<>(aliases.values());
    }

    public synchronized AliasUpsertResponse upsert(CounterpartyAliasDto request) {
        String bankName = collapse(request.getBankName());
        String bankBin = ClientDirectoryService.digits(request.getBankBin());
        String clientId = request.getClientId().trim();
        if (bankName.isEmpty() && bankBin.isEmpty()) {
            throw new IllegalArgumentException("alias needs a bank name or a BIN");
        }

        String key = bankBin.isEmpty() ? "name:" + bankName.toLowerCase(Locale.ROOT) : "bin:" + bankBin;
        CounterpartyAliasDto existing = aliases.get(key);
        boolean changed = existing == null || !existing.getClientId().equals(clientId);
        if (changed) {
            aliases.put(key, new CounterpartyAliasDto(bankName, bankBin, clientId));
            log.info("Alias {} -> client {}", key, clientId);
        } else {
            log.debug("Alias {} already resolves to client {}", key, clientId);
        }
        return AliasUpsertResponse.builder()
                .bankName(bankName)
                .bankBin(bankBin)
                .clientId(clientId)
                .changed(changed)
                .build();
    }

    private static String collapse(String value) {
        return value == null ? "" : value.trim().replaceAll("\\s+", " ");
    }
}
