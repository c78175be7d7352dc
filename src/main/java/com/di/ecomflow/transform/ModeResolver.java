package com.di.ecomflow.transform;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Most frequent value with a stable tie-break: among values sharing the
 * highest count, the one seen first wins. Nulls are not candidates.
 */
final class ModeResolver {

    private ModeResolver() {
    }

    static Object mode(List<?> values) {
        Map<Object, int[]> tally = new HashMap<>();   // value -> {count, firstIndex}
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (value == null) {
                continue;
            }
            int[] entry = tally.get(value);
            if (entry == null) {
                tally.put(value, new int[] {1, i});
            } else {
                entry[0]++;
            }
        }
        Object best = null;
        int bestCount = 0;
        int bestFirst = Integer.MAX_VALUE;
        for (Map.Entry<Object, int[]> candidate : tally.entrySet()) {
            int count = candidate.getValue()[0];
            int first = candidate.getValue()[1];
            if (count > bestCount || (count == bestCount && first < bestFirst)) {
                best = candidate.getKey();
                bestCount = count;
                bestFirst = first;
            }
        }
        return best;
    }
}
