package com.photoraces.zones;

import java.util.Comparator;
import java.util.List;

/**
 * Insertion sort for the small lists the planner orders. Unlike {@link List#sort}, it accepts comparators that
 * are not transitive, such as the row tolerance in {@link ZoneOrderer} or coordinates holding NaN, and never
 * throws for them. Equal elements keep their input order.
 */
final class StableSort {

    private StableSort() {
    }

    static <T> void sort(List<T> list, Comparator<? super T> comparator) {
        for (int i = 1; i < list.size(); i++) {
            T current = list.get(i);
            int j = i - 1;
            while (j >= 0 && comparator.compare(list.get(j), current) > 0) {
                list.set(j + 1, list.get(j));
                j--;
            }
            list.set(j + 1, current);
        }
    }

    /**
     * Orders by {@code <} and {@code >} only, so -0.0 equals 0.0 and NaN equals everything.
     */
    static int compareValues(double a, double b) {
        return a < b ? -1 : a > b ? 1 : 0;
    }
}
