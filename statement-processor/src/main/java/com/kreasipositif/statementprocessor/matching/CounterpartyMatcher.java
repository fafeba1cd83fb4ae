package com.kreasipositif.statementprocessor.matching;

import com.kreasipositif.statementprocessor.config.StatementImportProperties;
import com.kreasipositif.statementprocessor.domain.ClientRecord;
import com.kreasipositif.statementprocessor.domain.MatchSource;
import com.kreasipositif.statementprocessor.domain.MatchStatus;
import com.kreasipositif.statementprocessor.domain.ParsedTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the counterparty of each transaction to a client.
 *
 * <p>Tiers, first hit wins:
 * <ol>
 *   <li><b>BIN</b> equal to a client's registered BIN;</li>
 *   <li><b>Alias</b> learned from an earlier commit;</li>
 *   <li><b>Name</b>: matching key equal to a client's company or name key, optionally within
 *       a small edit distance.</li>
 * </ol>
 * Transactions are matched independently of each other.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CounterpartyMatcher {

    private final StatementImportProperties properties;

    public ParsedTransaction match(ParsedTransaction tx, ClientDirectory clients, CounterpartyAliasStore aliases) {
        String bin = tx.getClientBin();

        if (!bin.isEmpty()) {
            List<ClientRecord> byBin = clients.withBin(bin);
            if (!byBin.isEmpty()) {
                return matched(tx, byBin.get(0).id(), MatchSource.BIN, false);
            }
        }

        Optional<String> aliased = aliases.find(tx.getClientNameRaw(), bin);
        if (aliased.isPresent()) {
            if (clients.get(aliased.get()).isPresent()) {
                return matched(tx, aliased.get(), MatchSource.ALIAS, false);
            }
            log.debug("Line {}: alias points to unknown client '{}', ignored", tx.getSourceLine(), aliased.get());
        }

        List<ClientRecord> byName = nameCandidates(tx.getClientNameKey(), clients);
        if (!byName.isEmpty()) {
            List<ClientRecord> ranked = new ArrayList<>(byName);
            ranked.sort(Comparator
                    .comparing((ClientRecord c) -> contradicts(c, bin))
                    .thenComparing(ClientRecord::id, ClientDirectory.ID_ORDER));
            boolean ambiguous = ranked.size() > 1;
            if (ambiguous) {
                log.debug("Line {}: name '{}' fits {} clients, picked {}",
                        tx.getSourceLine(), tx.getClientNameKey(), ranked.size(), ranked.get(0).id());
            }
            return matched(tx, ranked.get(0).id(), MatchSource.NAME, ambiguous);
        }

        return tx.toBuilder()
                .matchStatus(MatchStatus.UNMATCHED)
                .matchSource(MatchSource.NONE)
                .matchedClientId(null)
                .ambiguousMatch(false)
                .reconciliation(null)
                .build();
    }

    public List<ParsedTransaction> matchAll(List<ParsedTransaction> transactions,
                                            ClientDirectory clients,
                                            CounterpartyAliasStore aliases) {
        List<ParsedTransaction> result = new ArrayList<>(transactions.size());
        for (ParsedTransaction tx : transactions) {
            result.add(match(tx, clients, aliases));
        }
        return result;
    }

    private List<ClientRecord> nameCandidates(String key, ClientDirectory clients) {
        if (key == null || key.isEmpty()) {
            return List.of();
        }
        List<ClientRecord> exact = clients.withKey(key);
        if (!exact.isEmpty()) {
            return exact;
        }
        StatementImportProperties.Matching matching = properties.getMatching();
        int maxDistance = matching.getMaxEditDistance();
        if (maxDistance <= 0 || key.length() < matching.getMinFuzzyKeyLength()) {
            return List.of();
        }

        int best = maxDistance + 1;
        List<ClientRecord> closest = new ArrayList<>();
        for (ClientRecord client : clients.all()) {
            int distance = maxDistance + 1;
            for (String clientKey : clients.keysOf(client.id())) {
                if (clientKey.length() >= matching.getMinFuzzyKeyLength()) {
                    distance = Math.min(distance, EditDistance.bounded(key, clientKey, maxDistance));
                }
            }
            if (distance < best) {
                best = distance;
                closest.clear();
                closest.add(client);
            } else if (distance == best && distance <= maxDistance) {
                closest.add(client);
            }
        }
        return closest;
    }

    private static boolean contradicts(ClientRecord client, String bin) {
        return !bin.isEmpty() && client.hasBin() && !client.bin().equals(bin);
    }

    private static ParsedTransaction matched(ParsedTransaction tx, String clientId, MatchSource source, boolean ambiguous) {
        log.debug("Line {}: '{}' matched client {} by {}", tx.getSourceLine(), tx.getClientName(), clientId, source);
        return tx.toBuilder()
                .matchStatus(MatchStatus.MATCHED)
                .matchSource(source)
                .matchedClientId(clientId)
                .ambiguousMatch(ambiguous)
                .build();
    }
}
