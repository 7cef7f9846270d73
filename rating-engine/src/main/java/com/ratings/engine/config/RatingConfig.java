package com.ratings.engine.config;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Constants of the rating update. Immutable; build one per run.
 */
public final class RatingConfig {

    public static final int DEFAULT_RATING = 1500;
    public static final int DEFAULT_PROVISIONAL_THRESHOLD = 30;
    public static final double DEFAULT_STANDARD_K = 15.0;
    public static final double DEFAULT_PROVISIONAL_K = 30.0;
    public static final int DEFAULT_RATING_FLOOR = 300;
    public static final int DEFAULT_PERFORMANCE_SPREAD_CAP = 800;

    private final int defaultRating;
    private final int provisionalThreshold;
    private final double standardK;
    private final double provisionalK;
    private final int ratingFloor;
    private final int performanceSpreadCap;
    private final RoundingMode rounding;
    private final boolean parallel;

    private RatingConfig(Builder builder) {
        this.defaultRating = builder.defaultRating;
        this.provisionalThreshold = builder.provisionalThreshold;
        this.standardK = builder.standardK;
        this.provisionalK = builder.provisionalK;
        this.ratingFloor = builder.ratingFloor;
        this.performanceSpreadCap = builder.performanceSpreadCap;
        this.rounding = builder.rounding;
        this.parallel = builder.parallel;
    }

    public static RatingConfig defaults() {
        return builder().build();
    }

    // ============ BUILDER PATTERN ============

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int defaultRating = DEFAULT_RATING;
        private int provisionalThreshold = DEFAULT_PROVISIONAL_THRESHOLD;
        private double standardK = DEFAULT_STANDARD_K;
        private double provisionalK = DEFAULT_PROVISIONAL_K;
        private int ratingFloor = DEFAULT_RATING_FLOOR;
        private int performanceSpreadCap = DEFAULT_PERFORMANCE_SPREAD_CAP;
        private RoundingMode rounding = RoundingMode.HALF_EVEN;
        private boolean parallel;

        public Builder defaultRating(int rating) { this.defaultRating = rating; return this; }
        public Builder provisionalThreshold(int games) { this.provisionalThreshold = games; return this; }
        public Builder standardK(double k) { this.standardK = k; return this; }
        public Builder provisionalK(double k) { this.provisionalK = k; return this; }
        public Builder ratingFloor(int floor) { this.ratingFloor = floor; return this; }
        public Builder performanceSpreadCap(int cap) { this.performanceSpreadCap = cap; return this; }
        public Builder rounding(RoundingMode rounding) { this.rounding = rounding; return this; }
        public Builder parallel(boolean parallel) { this.parallel = parallel; return this; }

        public RatingConfig build() {
            if (defaultRating < 0) {
                throw new IllegalArgumentException("Default rating must not be negative: " + defaultRating);
            }
            if (provisionalThreshold < 0) {
                throw new IllegalArgumentException("Provisional threshold must not be negative: " + provisionalThreshold);
            }
            if (!(standardK > 0) || !(provisionalK > 0)) {
                throw new IllegalArgumentException(
                        String.format("K factors must be positive: standard=%s provisional=%s", standardK, provisionalK));
            }
            if (ratingFloor < 0) {
                throw new IllegalArgumentException("Rating floor must not be negative: " + ratingFloor);
            }
            if (performanceSpreadCap <= 0) {
                throw new IllegalArgumentException("Performance spread cap must be positive: " + performanceSpreadCap);
            }
            if (rounding != RoundingMode.HALF_EVEN && rounding != RoundingMode.HALF_UP) {
                throw new IllegalArgumentException("Rounding must be HALF_EVEN or HALF_UP: " + rounding);
            }
            return new RatingConfig(this);
        }
    }

    // ============ HELPER METHODS ============

    /**
     * Round a rating to an integer with the configured rule.
     */
    public int round(double rating) {
        return new BigDecimal(rating).setScale(0, rounding).intValueExact();
    }

    public boolean isProvisional(int gamesPlayedLifetime) {
        return gamesPlayedLifetime < provisionalThreshold;
    }

    public double kFactorFor(int gamesPlayedLifetime) {
        return isProvisional(gamesPlayedLifetime) ? provisionalK : standardK;
    }

    // ============ GETTERS ============

    public int getDefaultRating() { return defaultRating; }

    public int getProvisionalThreshold() { return provisionalThreshold; }

    public double getStandardK() { return standardK; }

    public double getProvisionalK() { return provisionalK; }

    public int getRatingFloor() { return ratingFloor; }

    public int getPerformanceSpreadCap() { return performanceSpreadCap; }

    public RoundingMode getRounding() { return rounding; }

    public boolean isParallel() { return parallel; }

    @Override
    public String toString() {
        return String.format("RatingConfig[default=%d, provisional<%d, K=%s/%s, floor=%d, cap=%d, rounding=%s, parallel=%s]",
                defaultRating, provisionalThreshold, standardK, provisionalK, ratingFloor,
                performanceSpreadCap, rounding, parallel);
    }
}
