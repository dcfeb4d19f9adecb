package com.photoraces.zones;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reading order for zones: north to south, and west to east within a row. Zones whose northern edges are
 * within {@link #SAME_ROW_DEGREES} of each other count as one row.
 */
public final class ZoneOrderer {

    public static final double SAME_ROW_DEGREES = 0.01;

    static final Comparator<Zone> READING_ORDER = (a, b) -> {
        double aNorth = a.getBounds().getNorth();
        double bNorth = b.getBounds().getNorth();
        if (Math.abs(aNorth - bNorth) > SAME_ROW_DEGREES) {
            return StableSort.compareValues(bNorth, aNorth);
        }
        return StableSort.compareValues(a.getBounds().getWest(), b.getBounds().getWest());
    };

    private ZoneOrderer() {
    }

    /**
     * Returns the zones sorted into reading order, with ids reassigned {@code zone-0 .. zone-(k-1)}.
     * Each zone compares at or before the next one under {@link #READING_ORDER}.
     */
    public static List<Zone> order(List<Zone> zones) {
        List<Zone> sorted = new ArrayList<>(zones);
        StableSort.sort(sorted, READING_ORDER);
        List<Zone> renumbered = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            renumbered.add(sorted.get(i).withId(Zone.idForPosition(i)));
        }
        return renumbered;
    }
}
