package com.cardledger.backend.services.reconciliation;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Most-frequent value with a stable tie-break: among equally frequent values the one observed
 * first wins. Nulls and blank strings are not observations.
 */
public final class MajorityVote {

    private MajorityVote() {
    }

    public static <T> Optional<T> mostFrequent(Collection<? extends T> observations) {
        if (observations == null || observations.isEmpty()) {
            return Optional.empty();
        }

        Map<T, Integer> counts = new LinkedHashMap<>();
        for (T value : observations) {
            if (!isObserved(value)) {
                continue;
            }
            counts.merge(value, 1, Integer::sum);
        }

        T winner = null;
        int best = 0;
        // Strictly greater, so an earlier key keeps the lead on ties.
        for (Map.Entry<T, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                winner = entry.getKey();
            }
        }
        return Optional.ofNullable(winner);
    }

    private static boolean isObserved(Object value) {
        if (value == null) {
            return false;
        }
        return !(value instanceof CharSequence) || !value.toString().isBlank();
    }
}
