package com.kreasipositif.statementprocessor.matching;

import com.kreasipositif.statementprocessor.domain.ClientRecord;
import com.kreasipositif.statementprocessor.normalize.CounterpartyNameCleaner;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup indexes over the client list of one import.
 */
public final class ClientDirectory {

    /** Numeric ids compare as numbers, anything else lexicographically. */
    public static final Comparator<String> ID_ORDER = (a, b) -> {
        boolean numericA = !a.isEmpty() && a.chars().allMatch(Character::isDigit);
        boolean numericB = !b.isEmpty() && b.chars().allMatch(Character::isDigit);
        if (numericA && numericB) {
            int byLength = Integer.compare(a.length(), b.length());
            return byLength != 0 ? byLength : a.compareTo(b);
        }
        if (numericA != numericB) {
            return numericA ? -1 : 1;
        }
        return a.compareTo(b);
    };

    private final Map<String, ClientRecord> byId = new HashMap<>();
    private final Map<String, List<ClientRecord>> byBin = new HashMap<>();
    private final Map<String, List<ClientRecord>> byKey = new HashMap<>();
    private final Map<String, Set<String>> keysById = new HashMap<>();

    public ClientDirectory(Collection<ClientRecord> clients) {
        List<ClientRecord> sorted = new ArrayList<>(clients);
        sorted.sort(Comparator.comparing(ClientRecord::id, ID_ORDER));
        for (ClientRecord client : sorted) {
            byId.put(client.id(), client);
            if (client.hasBin()) {
                byBin.computeIfAbsent(client.bin(), k -> new ArrayList<>()).add(client);
            }
            Set<String> keys = new LinkedHashSet<>();
            addKey(keys, client.company());
            addKey(keys, client.name());
            keysById.put(client.id(), keys);
            for (String key : keys) {
                byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(client);
            }
        }
    }

    public Optional<ClientRecord> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /** Clients holding {@code bin}, lowest id first. */
    public List<ClientRecord> withBin(String bin) {
        return byBin.getOrDefault(bin, List.of());
    }

    /** Clients whose company or name has this matching key, lowest id first. */
    public List<ClientRecord> withKey(String key) {
        return byKey.getOrDefault(key, List.of());
    }

    /** Matching keys of a client (company, then name). */
    public Set<String> keysOf(String id) {
        return keysById.getOrDefault(id, Set.of());
    }

    public Collection<ClientRecord> all() {
        return byId.values();
    }

    private static void addKey(Set<String> keys, String value) {
        String key = CounterpartyNameCleaner.matchingKey(value);
        if (!key.isEmpty()) {
            keys.add(key);
        }
    }
}
