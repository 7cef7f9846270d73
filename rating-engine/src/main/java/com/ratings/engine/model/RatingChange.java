package com.ratings.engine.model;

import java.util.Objects;

/**
 * Rating update of one player for one tournament, as produced by the rating engine.
 */
public final class RatingChange {

    private final String name;
    private final Integer oldRating;            // null for unrated entrants
    private final Integer newRating;            // null only for an unrated player without games
    private final Integer performanceRating;    // null without games
    private final double expectedScore;
    private final double actualScore;
    private final int gamesPlayed;
    private final boolean provisional;
    private final double kFactor;
    private final int lifetimeGames;            // prior lifetime games plus this tournament

    private RatingChange(Builder builder) {
        this.name = builder.name;
        this.oldRating = builder.oldRating;
        this.newRating = builder.newRating;
        this.performanceRating = builder.performanceRating;
        this.expectedScore = builder.expectedScore;
        this.actualScore = builder.actualScore;
        this.gamesPlayed = builder.gamesPlayed;
        this.provisional = builder.provisional;
        this.kFactor = builder.kFactor;
        this.lifetimeGames = builder.lifetimeGames;
    }

    // ============ BUILDER PATTERN ============

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private Integer oldRating;
        private Integer newRating;
        private Integer performanceRating;
        private double expectedScore;
        private double actualScore;
        private int gamesPlayed;
        private boolean provisional;
        private double kFactor;
        private int lifetimeGames;

        public Builder name(String name) { this.name = name; return this; }
        public Builder oldRating(Integer rating) { this.oldRating = rating; return this; }
        public Builder newRating(Integer rating) { this.newRating = rating; return this; }
        public Builder performanceRating(Integer rating) { this.performanceRating = rating; return this; }
        public Builder expectedScore(double score) { this.expectedScore = score; return this; }
        public Builder actualScore(double score) { this.actualScore = score; return this; }
        public Builder gamesPlayed(int games) { this.gamesPlayed = games; return this; }
        public Builder provisional(boolean provisional) { this.provisional = provisional; return this; }
        public Builder kFactor(double kFactor) { this.kFactor = kFactor; return this; }
        public Builder lifetimeGames(int games) { this.lifetimeGames = games; return this; }

        public RatingChange build() { return new RatingChange(this); }
    }

    // ============ HELPER METHODS ============

    /**
     * New minus old rating; null when either side is missing.
     */
    public Integer getDelta() {
        if (oldRating == null || newRating == null) {
            return null;
        }
        return newRating - oldRating;
    }

    public String getDeltaFormatted() {
        Integer delta = getDelta();
        return delta != null ? String.format("%+d", delta) : "new";
    }

    public String getExpectedScoreFormatted() {
        return String.format("%.2f", expectedScore);
    }

    public boolean isUnrated() {
        return oldRating == null;
    }

    // ============ GETTERS ============

    public String getName() { return name; }

    public Integer getOldRating() { return oldRating; }

    public Integer getNewRating() { return newRating; }

    public Integer getPerformanceRating() { return performanceRating; }

    public double getExpectedScore() { return expectedScore; }

    public double getActualScore() { return actualScore; }

    public int getGamesPlayed() { return gamesPlayed; }

    public boolean isProvisional() { return provisional; }

    public double getKFactor() { return kFactor; }

    public int getLifetimeGames() { return lifetimeGames; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RatingChange other = (RatingChange) o;
        return Double.compare(expectedScore, other.expectedScore) == 0
                && Double.compare(actualScore, other.actualScore) == 0
                && gamesPlayed == other.gamesPlayed
                && provisional == other.provisional
                && Double.compare(kFactor, other.kFactor) == 0
                && lifetimeGames == other.lifetimeGames
                && Objects.equals(name, other.name)
                && Objects.equals(oldRating, other.oldRating)
                && Objects.equals(newRating, other.newRating)
                && Objects.equals(performanceRating, other.performanceRating);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, oldRating, newRating, performanceRating, expectedScore, actualScore,
                gamesPlayed, provisional, kFactor, lifetimeGames);
    }

    @Override
    public String toString() {
        return String.format("%s: %s -> %s (score %.1f/%d, expected %.3f, perf %s)",
                name, oldRating, newRating, actualScore, gamesPlayed, expectedScore, performanceRating);
    }
}
