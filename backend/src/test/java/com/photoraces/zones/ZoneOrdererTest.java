package com.photoraces.zones;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

class ZoneOrdererTest {

    private static Zone zone(int index, double north, double west) {
        Bounds bounds = new Bounds(north, north - 0.005, west + 0.005, west);
        return new Zone("tmp", List.of(index), bounds, new Coordinate(north, west), 15);
    }

    private static List<Integer> firstIndices(List<Zone> zones) {
        return zones.stream().map(z -> z.getPoiIndices().get(0)).toList();
    }

    @Test
    void testNorthToSouth() {
        List<Zone> ordered = ZoneOrderer.order(List.of(zone(0, 43.60, -79.0), zone(1, 43.70, -79.5)));
        assertEquals(List.of(1, 0), firstIndices(ordered));
    }

    @Test
    void testSameRowReadsWestToEast() {
        List<Zone> ordered = ZoneOrderer.order(List.of(zone(0, 43.700, -79.30), zone(1, 43.705, -79.40)));
        assertEquals(List.of(1, 0), firstIndices(ordered));
    }

    @Test
    void testJustOutsideRowToleranceUsesNorth() {
        List<Zone> ordered = ZoneOrderer.order(List.of(zone(0, 43.700, -79.40), zone(1, 43.711, -79.30)));
        assertEquals(List.of(1, 0), firstIndices(ordered));
    }

    @Test
    void testIdsRenumberedByPosition() {
        List<Zone> ordered = ZoneOrderer.order(List.of(
                zone(0, 43.5, 0), zone(1, 43.9, 0), zone(2, 43.7, 0)));
        assertEquals(List.of("zone-0", "zone-1", "zone-2"), ordered.stream().map(Zone::getId).toList());
        assertEquals(List.of(1, 2, 0), firstIndices(ordered));
    }

    @Test
    void testEmpty() {
        assertEquals(List.of(), ZoneOrderer.order(List.of()));
    }

    @Test
    void testChainedRowsWithManyZones() {
        // each north is within tolerance of its neighbours but not of zones two steps away
        List<Zone> zones = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            zones.add(zone(i, 43.0 + i * 0.008, -79.0 - (i % 7) * 0.1));
        }
        Collections.shuffle(zones, new Random(3));

        List<Zone> ordered = ZoneOrderer.order(zones);
        assertEquals(60, ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            assertEquals("zone-" + i, ordered.get(i).getId());
            if (i > 0) {
                assertTrue(ZoneOrderer.READING_ORDER.compare(ordered.get(i - 1), ordered.get(i)) <= 0,
                        ordered.get(i - 1) + " before " + ordered.get(i));
            }
        }
        assertEquals(60, ordered.stream().map(z -> z.getPoiIndices().get(0)).distinct().count());
    }

    @Test
    void testNegativeZeroTiesKeepInputOrder() {
        List<Zone> ordered = ZoneOrderer.order(List.of(zone(0, 0.0, 0.0), zone(1, 0.0, -0.0)));
        assertEquals(List.of(0, 1), firstIndices(ordered));
    }
}
