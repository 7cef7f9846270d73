package com.ratings.engine.stats;

import com.ratings.engine.model.PlayerRecord;
import com.ratings.engine.model.RatingChange;

/**
 * One line of the final standings.
 *
 * @param rank   1-based rank, shared by players equal on score and spread
 * @param tied   true when at least one other player shares the rank
 * @param record the player's games
 * @param change the player's rating change
 */
public record Standing(int rank, boolean tied, PlayerRecord record, RatingChange change) {

    public String getName() {
        return record.getName();
    }

    public String getRankFormatted() {
        return tied ? rank + "=" : String.valueOf(rank);
    }
}
