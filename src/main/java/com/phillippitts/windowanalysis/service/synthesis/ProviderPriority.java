package com.phillippitts.windowanalysis.service.synthesis;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Total order over provider ids used to break ties when merging fields.
 *
 * <p>Providers in the configured list rank by position; providers not in the list rank after
 * all listed ones, alphabetically.
 */
public final class ProviderPriority implements Comparator<String> {

    private final Map<String, Integer> rank = new HashMap<>();

    public ProviderPriority(List<String> order) {
        for (int i = 0; i < order.size(); i++) {
            rank.putIfAbsent(order.get(i), i);
        }
    }

    @Override
    public int compare(String a, String b) {
        Integer ra = rank.get(a);
        Integer rb = rank.get(b);
        if (ra != null && rb != null) {
            return Integer.compare(ra, rb);
        }
        if (ra != null) {
            return -1;
        }
        if (rb != null) {
            return 1;
        }
        return a.compareTo(b);
    }
}
