package com.ratings.engine.validation;

import com.ratings.engine.exception.ValidationException;
import com.ratings.engine.model.GameResult;
import com.ratings.engine.model.Player;
import com.ratings.engine.model.PlayerRecord;
import com.ratings.engine.model.RatingList;
import com.ratings.engine.model.TournamentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cross-checks players and games before rating. This is the single place
 * malformed input is rejected; the engine assumes it has passed.
 */
public class TournamentValidator {

    private static final Logger log = LoggerFactory.getLogger(TournamentValidator.class);

    public void validate(RatingList ratingList, List<GameResult> games) {
        validate(ratingList.getPlayers(), games);
    }

    /**
     * @throws ValidationException listing every problem found
     */
    public void validate(Collection<Player> players, List<GameResult> games) {
        List<String> problems = new ArrayList<>();

        Set<String> names = new HashSet<>();
        for (Player player : players) {
            String name = player.getName();
            if (name == null || name.isBlank()) {
                problems.add("Player with blank name in rating list");
                continue;
            }
            if (!names.add(name)) {
                problems.add("Duplicate player name: " + name);
            }
            if (player.getPriorRating() != null && player.getPriorRating() < 0) {
                problems.add(String.format("Negative rating %d for player %s", player.getPriorRating(), name));
            }
            if (player.getGamesPlayedLifetime() < 0) {
                problems.add(String.format("Negative lifetime games %d for player %s",
                        player.getGamesPlayedLifetime(), name));
            }
        }

        Map<String, Set<Integer>> roundsPlayed = new HashMap<>();
        for (GameResult game : games) {
            String a = game.playerA();
            String b = game.playerB();
            if (a == null || a.isBlank() || b == null || b.isBlank()) {
                problems.add("Game with a blank player name: " + describe(game));
                continue;
            }
            if (a.equals(b)) {
                problems.add("Player plays themself: " + describe(game));
                continue;
            }
            if (!names.contains(a)) {
                problems.add(String.format("Unknown player %s in %s", a, describe(game)));
            }
            if (!names.contains(b)) {
                problems.add(String.format("Unknown player %s in %s", b, describe(game)));
            }
            if (game.round() > 0) {
                for (String name : List.of(a, b)) {
                    if (!roundsPlayed.computeIfAbsent(name, k -> new HashSet<>()).add(game.round())) {
                        problems.add(String.format("Player %s has more than one game in round %d", name, game.round()));
                    }
                }
            }
        }

        if (problems.isEmpty()) {
            TournamentRecord record = TournamentRecord.of(null, names, games);
            for (PlayerRecord playerRecord : record.getRecords().values()) {
                double score = playerRecord.getScore();
                if (score < 0 || score > playerRecord.getGamesInTournament()) {
                    problems.add(String.format("Impossible score %.1f from %d games for player %s",
                            score, playerRecord.getGamesInTournament(), playerRecord.getName()));
                }
            }
        }

        if (!problems.isEmpty()) {
            log.debug("Validation found {} problems", problems.size());
            throw new ValidationException(problems);
        }
        log.debug("Validated {} players and {} games", names.size(), games.size());
    }

    private static String describe(GameResult game) {
        String round = game.round() > 0 ? "round " + game.round() + " " : "";
        return String.format("game %s%s vs %s", round, game.playerA(), game.playerB());
    }
}
