package com.photoraces.zones;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.photoraces.util.GeoDistance;

/**
 * Folds undersized clusters into their nearest neighbour.
 *
 * <p>A cluster below {@code minPoisPerZone} absorbs the closest other cluster (centroid to centroid) as long
 * as the combined size stays within {@code maxPoisPerZone} and the centroids are at most three cluster radii
 * apart. After each merge the scan starts over from the first cluster; the loop ends after a full pass with
 * no merge. A small cluster with no eligible partner is left as it is.
 */
public final class ClusterRebalancer {

    private static final Logger log = LoggerFactory.getLogger(ClusterRebalancer.class);

    private ClusterRebalancer() {
    }

    public static List<List<Integer>> rebalance(List<List<Integer>> clusters, List<? extends LatLng> points, ZoneConfig config) {
        if (clusters.size() <= 1) {
            return clusters;
        }

        int minSize = config.getMinPoisPerZone();
        int maxSize = config.getMaxPoisPerZone();
        double maxMergeDistance = config.getMaxMergeDistanceMeters();

        List<List<Integer>> working = new ArrayList<>(clusters.size());
        for (List<Integer> cluster : clusters) {
            working.add(new ArrayList<>(cluster));
        }

        int merges = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < working.size(); i++) {
                List<Integer> small = working.get(i);
                if (small.size() >= minSize) {
                    continue;
                }
                Coordinate centerI = centroid(small, points);
                int best = -1;
                double bestDistance = Double.POSITIVE_INFINITY;

                for (int j = 0; j < working.size(); j++) {
                    if (i == j) {
                        continue;
                    }
                    List<Integer> other = working.get(j);
                    if (small.size() + other.size() > maxSize) {
                        continue;
                    }
                    Coordinate centerJ = centroid(other, points);
                    double distance = GeoDistance.haversineMeters(centerI.getLat(), centerI.getLng(), centerJ.getLat(), centerJ.getLng());
                    if (distance < bestDistance && distance <= maxMergeDistance) {
                        bestDistance = distance;
                        best = j;
                    }
                }

                if (best != -1) {
                    small.addAll(working.get(best));
                    working.remove(best);
                    merges++;
                    changed = true;
                    break;
                }
            }
        }

        if (merges > 0) {
            log.debug("Merged {} undersized clusters, {} -> {} clusters", merges, clusters.size(), working.size());
        }
        return working;
    }

    /**
     * Arithmetic mean of member coordinates. Not a geodesic centroid.
     */
    static Coordinate centroid(List<Integer> cluster, List<? extends LatLng> points) {
        double lat = 0;
        double lng = 0;
        for (int index : cluster) {
            LatLng p = points.get(index);
            lat += p.getLat();
            lng += p.getLng();
        }
        return new Coordinate(lat / cluster.size(), lng / cluster.size());
    }
}
