package com.kreasipositif.statementprocessor.service;

import java.util.List;

/**
 * @param committed      ledger entries written
 * @param linked         of which were linked to an existing ledger entry
 * @param skipped        selected rows without a client, or out of range
 * @param failedWrites   one message per write that did not go through
 */
public record CommitReport(int committed,
                           int linked,
                           int skipped,
                           int aliasesLearned,
                           int binsBackfilled,
                           List<String> failedWrites) {
}
