package com.cardledger.backend.dto.reconciliation;

/**
 * Transaction-level overlap of a candidate batch against storage.
 *
 * @param overlapRatio  softCount / positiveCount, 0 when there are no positive candidates
 * @param totalCount    size of the whole batch, credits included
 * @param positiveCount candidates with amount &gt; 0, the only ones that were compared
 */
public record OverlapResult(
        int exactCount,
        int softCount,
        double overlapRatio,
        int totalCount,
        int positiveCount
) {

    public static OverlapResult none(int totalCount) {
        return new OverlapResult(0, 0, 0.0, totalCount, 0);
    }
}
