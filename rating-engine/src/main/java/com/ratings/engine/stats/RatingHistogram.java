package com.ratings.engine.stats;

import com.ratings.engine.model.RatingChange;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Number of players per rating band of fixed width, keyed by the band's lower bound.
 */
public final class RatingHistogram {

    private final int binWidth;
    private final Map<Integer, Integer> bins;

    private RatingHistogram(int binWidth, Map<Integer, Integer> bins) {
        this.binWidth = binWidth;
        this.bins = Collections.unmodifiableMap(bins);
    }

    /**
     * Histogram of new ratings. Players without a new rating are left out.
     */
    public static RatingHistogram of(Collection<RatingChange> changes, int binWidth) {
        if (binWidth <= 0) {
            throw new IllegalArgumentException("Bin width must be positive: " + binWidth);
        }
        Map<Integer, Integer> bins = new TreeMap<>();
        for (RatingChange change : changes) {
            Integer rating = change.getNewRating();
            if (rating == null) continue;
            int bin = Math.floorDiv(rating, binWidth) * binWidth;
            bins.merge(bin, 1, Integer::sum);
        }
        return new RatingHistogram(binWidth, bins);
    }

    public int getBinWidth() { return binWidth; }

    public Map<Integer, Integer> getBins() { return bins; }

    public boolean isEmpty() {
        return bins.isEmpty();
    }
}
