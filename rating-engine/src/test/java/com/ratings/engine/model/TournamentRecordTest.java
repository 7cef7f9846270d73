package com.ratings.engine.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TournamentRecordTest {

    private final List<GameResult> games = List.of(
            GameResult.scored(1, "Arthur Dent", 500, "Bertie Wooster", 450),
            GameResult.scored(2, "Arthur Dent", 300, "Sgt. Fred Colon", 300),
            GameResult.scored(3, "Obelix", 300, "Arthur Dent", 450));

    @Test
    void recordsFollowGameOrder() {
        TournamentRecord record = TournamentRecord.of(null, List.of("Idle"), games);

        PlayerRecord arthur = record.get("Arthur Dent");
        assertEquals(3, arthur.getGamesInTournament());
        assertEquals(List.of("Bertie Wooster", "Sgt. Fred Colon", "Obelix"), arthur.getOpponents());
        assertEquals(2.5, arthur.getScore());
        assertEquals(2, arthur.getWins());
        assertEquals(1, arthur.getDraws());
        assertEquals(0, arthur.getLosses());
        assertEquals(200, arthur.getSpread());
        assertEquals("2.5-0.5", arthur.getRecordFormatted());
    }

    @Test
    void listedPlayerWithoutGames_hasEmptyRecord() {
        TournamentRecord record = TournamentRecord.of(null, List.of("Idle"), games);

        assertEquals(0, record.get("Idle").getGamesInTournament());
        assertEquals(0.0, record.get("Idle").getScore());
        assertEquals("0-0", record.get("Idle").getRecordFormatted());
    }

    @Test
    void ratingList_addsOnlyMissingEntrants() {
        RatingList list = new RatingList(List.of(Player.rated("Arthur Dent", 1600, 40)));
        TournamentResults results = new TournamentResults(null, games);

        RatingList extended = list.withUnratedEntrants(results.playerNames());

        assertEquals(4, extended.size());
        assertFalse(extended.asMap().get("Arthur Dent").isUnrated());
        assertTrue(extended.asMap().get("Obelix").isUnrated());
        assertEquals(Set.of("Arthur Dent"), list.asMap().keySet(), "the original list is untouched");
    }

    @Test
    void outcome_followsScores() {
        assertEquals(GameOutcome.A_WINS, GameOutcome.fromScores(401, 400));
        assertEquals(GameOutcome.B_WINS, GameOutcome.fromScores(0, 1));
        assertEquals(GameOutcome.DRAW, GameOutcome.fromScores(350, 350));
    }
}
