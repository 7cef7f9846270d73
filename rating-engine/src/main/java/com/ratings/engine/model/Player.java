package com.ratings.engine.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A player as known before the tournament: identity, prior rating and experience.
 * Instances are immutable; the engine never updates them.
 */
public final class Player {

    private final String name;
    private final Integer priorRating;          // null when unrated
    private final int gamesPlayedLifetime;
    private final Integer ratingFloor;          // per-player minimum from the rating list, may be null
    private final LocalDate lastPlayed;         // provenance only

    private Player(Builder builder) {
        this.name = builder.name;
        this.priorRating = builder.priorRating;
        this.gamesPlayedLifetime = builder.gamesPlayedLifetime;
        this.ratingFloor = builder.ratingFloor;
        this.lastPlayed = builder.lastPlayed;
    }

    /**
     * A brand-new entrant with no rating and no games.
     */
    public static Player unrated(String name) {
        return builder().name(name).build();
    }

    public static Player rated(String name, int rating, int gamesPlayedLifetime) {
        return builder().name(name).priorRating(rating).gamesPlayedLifetime(gamesPlayedLifetime).build();
    }

    // ============ BUILDER PATTERN ============

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private Integer priorRating;
        private int gamesPlayedLifetime;
        private Integer ratingFloor;
        private LocalDate lastPlayed;

        public Builder name(String name) { this.name = name; return this; }
        public Builder priorRating(Integer priorRating) { this.priorRating = priorRating; return this; }
        public Builder gamesPlayedLifetime(int games) { this.gamesPlayedLifetime = games; return this; }
        public Builder ratingFloor(Integer ratingFloor) { this.ratingFloor = ratingFloor; return this; }
        public Builder lastPlayed(LocalDate lastPlayed) { this.lastPlayed = lastPlayed; return this; }

        public Player build() { return new Player(this); }
    }

    // ============ HELPER METHODS ============

    public boolean isUnrated() {
        return priorRating == null;
    }

    // ============ GETTERS ============

    public String getName() { return name; }

    public Integer getPriorRating() { return priorRating; }

    public int getGamesPlayedLifetime() { return gamesPlayedLifetime; }

    public Integer getRatingFloor() { return ratingFloor; }

    public LocalDate getLastPlayed() { return lastPlayed; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Player other = (Player) o;
        return gamesPlayedLifetime == other.gamesPlayedLifetime
                && Objects.equals(name, other.name)
                && Objects.equals(priorRating, other.priorRating)
                && Objects.equals(ratingFloor, other.ratingFloor)
                && Objects.equals(lastPlayed, other.lastPlayed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, priorRating, gamesPlayedLifetime, ratingFloor, lastPlayed);
    }

    @Override
    public String toString() {
        return name + " (" + (priorRating == null ? "unrated" : priorRating) + ", " + gamesPlayedLifetime + " games)";
    }
}
