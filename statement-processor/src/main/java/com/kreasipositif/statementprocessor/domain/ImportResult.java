package com.kreasipositif.statementprocessor.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything an import produced for review. Immutable once returned.
 */
@Value
@Builder
@Jacksonized
public class ImportResult {

    String fileName;

    StatementFormat format;

    SourceKind sourceKind;

    @Singular
    List<ParsedTransaction> transactions;

    ImportSummary summary;

    /**
     * Row indices pre-selected for commit: every row except duplicates.
     */
    @JsonIgnore
    public List<Integer> defaultSelection() {
        List<Integer> selection = new ArrayList<>();
        for (int i = 0; i < transactions.size(); i++) {
            if (!transactions.get(i).isDuplicate()) {
                selection.add(i);
            }
        }
        return selection;
    }
}
