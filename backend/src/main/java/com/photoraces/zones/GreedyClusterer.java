package com.photoraces.zones;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.photoraces.util.GeoDistance;

/**
 * Greedy radius clustering over point indices.
 *
 * <p>Points are visited north to south. Each point not yet taken seeds a new cluster, which then takes the
 * unassigned points within {@code radiusMeters} of the seed, nearest first, until it holds {@code maxSize}
 * points. Every index ends up in exactly one cluster. The visiting order only exists to make the result
 * reproducible; it is not meant to be geographically optimal.
 *
 * <p>Runs in O(n²), which is fine for the tens of checkpoints a race has.
 */
public final class GreedyClusterer {

    private static final class Candidate {
        final int index;
        final double distance;

        Candidate(int index, double distance) {
            this.index = index;
            this.distance = distance;
        }
    }

    private GreedyClusterer() {
    }

    public static List<List<Integer>> cluster(List<? extends LatLng> points, double radiusMeters, int maxSize) {
        int n = points.size();
        List<List<Integer>> clusters = new ArrayList<>();
        if (n == 0) {
            return clusters;
        }

        List<Integer> byLatitude = sortedNorthToSouth(points);
        boolean[] assigned = new boolean[n];

        for (int seed : byLatitude) {
            if (assigned[seed]) {
                continue;
            }
            List<Integer> cluster = new ArrayList<>();
            cluster.add(seed);
            assigned[seed] = true;

            LatLng seedPoint = points.get(seed);
            List<Candidate> candidates = new ArrayList<>();
            for (int other : byLatitude) {
                if (assigned[other]) {
                    continue;
                }
                LatLng p = points.get(other);
                double distance = GeoDistance.haversineMeters(seedPoint.getLat(), seedPoint.getLng(), p.getLat(), p.getLng());
                if (distance <= radiusMeters) {
                    candidates.add(new Candidate(other, distance));
                }
            }

            // List.sort is stable, so equidistant candidates keep latitude order
            candidates.sort(Comparator.comparingDouble(c -> c.distance));
            for (Candidate candidate : candidates) {
                if (cluster.size() >= maxSize) {
                    break;
                }
                cluster.add(candidate.index);
                assigned[candidate.index] = true;
            }

            clusters.add(cluster);
        }
        return clusters;
    }

    static List<Integer> sortedNorthToSouth(List<? extends LatLng> points) {
        List<Integer> indices = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            indices.add(i);
        }
        StableSort.sort(indices, (a, b) -> StableSort.compareValues(points.get(b).getLat(), points.get(a).getLat()));
        return indices;
    }
}
