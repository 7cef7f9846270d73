package com.ratings.engine.validation;

import com.ratings.engine.exception.ValidationException;
import com.ratings.engine.model.GameOutcome;
import com.ratings.engine.model.GameResult;
import com.ratings.engine.model.Player;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TournamentValidatorTest {

    private final TournamentValidator validator = new TournamentValidator();

    private final List<Player> players = List.of(
            Player.rated("Arthur Dent", 1600, 40),
            Player.rated("Obelix", 1450, 12),
            Player.unrated("Bertie Wooster"));

    @Test
    void wellFormedTournament_passes() {
        List<GameResult> games = List.of(
                GameResult.of(1, "Arthur Dent", "Obelix", GameOutcome.A_WINS),
                GameResult.of(2, "Obelix", "Bertie Wooster", GameOutcome.DRAW),
                GameResult.of(3, "Bertie Wooster", "Arthur Dent", GameOutcome.B_WINS));

        assertDoesNotThrow(() -> validator.validate(players, games));
    }

    @Test
    void unknownPlayer_isNamed() {
        List<GameResult> games = List.of(GameResult.of(1, "Arthur Dent", "Ford Prefect", GameOutcome.A_WINS));

        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(players, games));

        assertEquals(1, e.getProblems().size());
        assertTrue(e.getMessage().contains("Ford Prefect"), e.getMessage());
    }

    @Test
    void selfPlay_isRejected() {
        List<GameResult> games = List.of(GameResult.of(1, "Obelix", "Obelix", GameOutcome.DRAW));

        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(players, games));

        assertTrue(e.getProblems().get(0).contains("plays themself"));
    }

    @Test
    void duplicateNames_areRejected() {
        List<Player> withDuplicate = List.of(
                Player.rated("Obelix", 1450, 12),
                Player.rated("Obelix", 1500, 30));

        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(withDuplicate, List.of()));

        assertTrue(e.getMessage().contains("Duplicate player name: Obelix"));
    }

    @Test
    void negativeRating_isRejected() {
        List<Player> negative = List.of(Player.rated("Obelix", -5, 12));

        assertThrows(ValidationException.class, () -> validator.validate(negative, List.of()));
    }

    @Test
    void twoGamesInOneRound_areRejected() {
        List<GameResult> games = List.of(
                GameResult.of(1, "Arthur Dent", "Obelix", GameOutcome.A_WINS),
                GameResult.of(1, "Arthur Dent", "Bertie Wooster", GameOutcome.A_WINS));

        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(players, games));

        assertTrue(e.getMessage().contains("more than one game in round 1"));
    }

    @Test
    void unknownRounds_mayRepeat() {
        List<GameResult> games = List.of(
                GameResult.of(0, "Arthur Dent", "Obelix", GameOutcome.A_WINS),
                GameResult.of(0, "Arthur Dent", "Obelix", GameOutcome.B_WINS));

        assertDoesNotThrow(() -> validator.validate(players, games));
    }

    @Test
    void allProblems_areReportedTogether() {
        List<Player> bad = List.of(
                Player.rated("Obelix", -1, 12),
                Player.rated("Obelix", 1500, 30));
        List<GameResult> games = List.of(GameResult.of(1, "Obelix", "Asterix", GameOutcome.A_WINS));

        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(bad, games));

        assertEquals(3, e.getProblems().size(), e.getMessage());
    }
}
