package com.ratings.adapter.format;

import com.ratings.engine.model.TournamentInfo;
import com.ratings.engine.stats.RatingHistogram;
import com.ratings.engine.stats.Standing;
import com.ratings.engine.stats.TournamentSummary;

import java.util.List;

/**
 * Everything the output writers render: the participants in standings order
 * plus tournament-wide figures.
 */
public record RatingReport(
        TournamentInfo info,
        List<Standing> standings,
        TournamentSummary summary,
        RatingHistogram histogram
) {

    public RatingReport {
        standings = List.copyOf(standings);
    }

    public List<Standing> unratedEntrants() {
        return standings.stream().filter(s -> s.change().isUnrated()).toList();
    }
}
