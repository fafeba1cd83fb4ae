package com.kreasipositif.statementprocessor.service;

import java.util.List;
import java.util.Map;

/**
 * The reviewer's decision on an {@code ImportResult}.
 *
 * @param selectedRows    row indices to commit; {@code null} means the default selection
 *                        (every row except duplicates)
 * @param clientOverrides row index to client id, replacing the matcher's choice
 */
public record CommitRequest(List<Integer> selectedRows, Map<Integer, String> clientOverrides) {

    public CommitRequest {
        selectedRows = selectedRows == null ? null : List.copyOf(selectedRows);
        clientOverrides = clientOverrides == null ? Map.of() : Map.copyOf(clientOverrides);
    }

    public static CommitRequest defaults() {
        return new CommitRequest(null, Map.of());
    }
}
