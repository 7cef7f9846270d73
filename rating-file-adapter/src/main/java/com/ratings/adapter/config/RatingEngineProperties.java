package com.ratings.adapter.config;

import com.ratings.engine.config.RatingConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.RoundingMode;

/**
 * Rating constants, bound from {@code rating.engine.*}.
 */
@ConfigurationProperties(prefix = "rating.engine")
public class RatingEngineProperties {

    private int defaultRating = RatingConfig.DEFAULT_RATING;
    private int provisionalThreshold = RatingConfig.DEFAULT_PROVISIONAL_THRESHOLD;
    private double standardK = RatingConfig.DEFAULT_STANDARD_K;
    private double provisionalK = RatingConfig.DEFAULT_PROVISIONAL_K;
    private int ratingFloor = RatingConfig.DEFAULT_RATING_FLOOR;
    private int performanceSpreadCap = RatingConfig.DEFAULT_PERFORMANCE_SPREAD_CAP;
    private RoundingMode rounding = RoundingMode.HALF_EVEN;
    private boolean parallel;

    public RatingConfig toRatingConfig() {
        return RatingConfig.builder()
                .defaultRating(defaultRating)
                .provisionalThreshold(provisionalThreshold)
                .standardK(standardK)
                .provisionalK(provisionalK)
                .ratingFloor(ratingFloor)
                .performanceSpreadCap(performanceSpreadCap)
                .rounding(rounding)
                .parallel(parallel)
                .build();
    }

    public int getDefaultRating() { return defaultRating; }
    public void setDefaultRating(int defaultRating) { this.defaultRating = defaultRating; }

    public int getProvisionalThreshold() { return provisionalThreshold; }
    public void setProvisionalThreshold(int provisionalThreshold) { this.provisionalThreshold = provisionalThreshold; }

    public double getStandardK() { return standardK; }
    public void setStandardK(double standardK) { this.standardK = standardK; }

    public double getProvisionalK() { return provisionalK; }
    public void setProvisionalK(double provisionalK) { this.provisionalK = provisionalK; }

    public int getRatingFloor() { return ratingFloor; }
    public void setRatingFloor(int ratingFloor) { this.ratingFloor = ratingFloor; }

    public int getPerformanceSpreadCap() { return performanceSpreadCap; }
    public void setPerformanceSpreadCap(int performanceSpreadCap) { this.performanceSpreadCap = performanceSpreadCap; }

    public RoundingMode getRounding() { return rounding; }
    public void setRounding(RoundingMode rounding) { this.rounding = rounding; }

    public boolean isParallel() { return parallel; }
    public void setParallel(boolean parallel) { this.parallel = parallel; }
}
