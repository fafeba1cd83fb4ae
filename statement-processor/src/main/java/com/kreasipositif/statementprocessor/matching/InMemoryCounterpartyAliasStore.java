package com.kreasipositif.statementprocessor.matching;

import com.kreasipositif.statementprocessor.domain.CounterpartyAlias;
import com.kreasipositif.statementprocessor.domain.Identifiers;
import com.kreasipositif.statementprocessor.normalize.CounterpartyNameCleaner;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Alias store held in memory. Serves as the per-import snapshot of the persistent aliases.
 */
public class InMemoryCounterpartyAliasStore implements CounterpartyAliasStore {

    private final Map<String, CounterpartyAlias> aliases = new ConcurrentHashMap<>();

    public InMemoryCounterpartyAliasStore() {
    }

    public InMemoryCounterpartyAliasStore(Collection<CounterpartyAlias> snapshot) {
        snapshot.forEach(a -> save(a.bankName(), a.bankBin(), a.clientId()));
    }

    @Override
    public Optional<String> find(String bankName, String bankBin) {
        String bin = Identifiers.digitsOnly(bankBin);
        if (!bin.isEmpty()) {
            CounterpartyAlias byBin = aliases.get(binKey(bin));
            if (byBin != null) {
                return Optional.of(byBin.clientId());
            }
        }
        String key = CounterpartyNameCleaner.matchingKey(bankName);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return aliases.values().stream()
                .filter(a -> key.equals(CounterpartyNameCleaner.matchingKey(a.bankName())))
                .filter(a -> bin.isEmpty() || a.bankBin().isEmpty() || a.bankBin().equals(bin))
                .map(CounterpartyAlias::clientId)
                .min(ClientDirectory.ID_ORDER);
    }

    @Override
    public boolean save(String bankName, String bankBin, String clientId) {
        String name = CounterpartyNameCleaner.sanitize(bankName);
        String bin = Identifiers.digitsOnly(bankBin);
        if (name.isEmpty() && bin.isEmpty()) {
            return false;
        }
        CounterpartyAlias alias = new CounterpartyAlias(name, bin, clientId);
        CounterpartyAlias previous = aliases.put(keyOf(alias), alias);
        return !Objects.equals(previous, alias);
    }

    @Override
    public List<CounterpartyAlias> findAll() {
        List<CounterpartyAlias> all = new ArrayList<>(aliases.values());
        all.sort(Comparator.comparing(CounterpartyAlias::bankBin).thenComparing(CounterpartyAlias::bankName));
        return all;
    }

    /** BIN when present, else the lower-cased sanitized name. */
    static String keyOf(CounterpartyAlias alias) {
        return alias.bankBin().isEmpty()
                ? "name:" + alias.bankName().toLowerCase(Locale.ROOT)
                : binKey(alias.bankBin());
    }

    private static String binKey(String bin) {
        return "bin:" + bin;
    }
}
