package com.ratings.engine.stats;

import com.ratings.engine.model.RatingChange;

import java.util.Collection;

/**
 * Headline numbers of a rated tournament.
 */
public record TournamentSummary(
        int players,
        int ratedPlayers,
        int unratedPlayers,
        int games,
        double averageChange
) {

    public static TournamentSummary of(Collection<RatingChange> changes, int games) {
        int rated = 0;
        int unrated = 0;
        double totalChange = 0;
        for (RatingChange change : changes) {
            if (change.isUnrated()) {
                unrated++;
            } else {
                rated++;
                Integer delta = change.getDelta();
                totalChange += delta != null ? delta : 0;
            }
        }
        double average = rated > 0 ? totalChange / rated : 0.0;
        return new TournamentSummary(changes.size(), rated, unrated, games, average);
    }

    public String getAverageChangeFormatted() {
        return String.format("%+.1f", averageChange);
    }
}
