package com.ratings.engine.stats;

import com.ratings.engine.model.PlayerRecord;
import com.ratings.engine.model.RatingChange;
import com.ratings.engine.model.TournamentRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders players for the tournament report.
 *
 * Ranking keys, in order: score, spread, new rating (all descending).
 * Players equal on score and spread share a rank; rating and then name only
 * fix the order they are printed in.
 */
public final class Standings {

    private static final Comparator<Standing> RANK_ORDER = Comparator
            .comparingDouble((Standing s) -> s.record().getScore()).reversed()
            .thenComparing(Comparator.comparingInt((Standing s) -> s.record().getSpread()).reversed())
            .thenComparing(Comparator.comparingInt(Standings::newRatingOrMin).reversed())
            .thenComparing(Standing::getName);

    private Standings() {}

    /**
     * Rank every player that has a rating change.
     */
    public static List<Standing> rank(TournamentRecord tournament, Map<String, RatingChange> changes) {
        List<Standing> unranked = new ArrayList<>();
        for (RatingChange change : changes.values()) {
            PlayerRecord record = tournament.get(change.getName());
            unranked.add(new Standing(0, false, record, change));
        }
        unranked.sort(RANK_ORDER);

        List<Standing> ranked = new ArrayList<>(unranked.size());
        int rank = 0;
        for (int i = 0; i < unranked.size(); i++) {
            Standing current = unranked.get(i);
            if (i == 0 || !sameKeys(unranked.get(i - 1), current)) {
                rank = i + 1;
            }
            boolean tied = (i > 0 && sameKeys(unranked.get(i - 1), current))
                    || (i + 1 < unranked.size() && sameKeys(current, unranked.get(i + 1)));
            ranked.add(new Standing(rank, tied, current.record(), current.change()));
        }
        return List.copyOf(ranked);
    }

    private static boolean sameKeys(Standing a, Standing b) {
        return a.record().getScore() == b.record().getScore()
                && a.record().getSpread() == b.record().getSpread();
    }

    private static int newRatingOrMin(Standing standing) {
        Integer rating = standing.change().getNewRating();
        return rating != null ? rating : Integer.MIN_VALUE;
    }
}
