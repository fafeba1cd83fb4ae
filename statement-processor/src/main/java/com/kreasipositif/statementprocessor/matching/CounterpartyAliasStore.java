package com.kreasipositif.statementprocessor.matching;

import com.kreasipositif.statementprocessor.domain.CounterpartyAlias;

import java.util.List;
import java.util.Optional;

/**
 * Learned mappings from the way a bank prints a counterparty to a client.
 *
 * <p>Aliases are keyed by BIN when the bank row carried one, otherwise by the lower-cased
 * sanitized name. Saving replaces whatever the key pointed to before.
 */
public interface CounterpartyAliasStore {

    /**
     * Resolves a bank-side counterparty: an alias with the same BIN first, else an alias whose
     * name has the same matching key and whose BIN does not contradict {@code bankBin}.
     */
    Optional<String> find(String bankName, String bankBin);

    /**
     * Upserts an alias.
     *
     * @return {@code true} when the store changed, {@code false} when the alias was already there
     */
    boolean save(String bankName, String bankBin, String clientId);

    List<CounterpartyAlias> findAll();
}
