package com.ratings.engine.engine;

import com.ratings.engine.config.RatingConfig;
import com.ratings.engine.exception.ValidationException;
import com.ratings.engine.model.GameResult;
import com.ratings.engine.model.Player;
import com.ratings.engine.model.PlayerRecord;
import com.ratings.engine.model.RatingChange;
import com.ratings.engine.model.TournamentRecord;
import com.ratings.engine.validation.TournamentValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Norwegian-system rating update for one tournament.
 *
 * Key rules:
 * - Expected score per game from the logistic Elo curve, unrated players counted at the default rating
 * - Rating moves by K times (actual - expected), K larger for provisional players
 * - A provisional player without any rating receives the tournament performance rating
 * - New ratings never drop below the floor; players without games keep their rating
 *
 * Every player is rated from a snapshot of the pre-tournament ratings, so the
 * result does not depend on the order players are processed in.
 */
public class RatingEngine {

    private static final Logger log = LoggerFactory.getLogger(RatingEngine.class);

    private final RatingConfig config;
    private final TournamentValidator validator;

    public RatingEngine(RatingConfig config) {
        this(config, new TournamentValidator());
    }

    public RatingEngine(RatingConfig config, TournamentValidator validator) {
        this.config = config;
        this.validator = validator;
    }

    public RatingConfig getConfig() {
        return config;
    }

    // ============ PUBLIC API ============

    /**
     * Compute the rating change of every player.
     *
     * @param players prior rating list keyed by player name
     * @param games   the tournament's games
     * @return one change per player, sorted by name
     * @throws ValidationException when the input is inconsistent
     */
    public Map<String, RatingChange> computeNewRatings(Map<String, Player> players, List<GameResult> games) {
        players.forEach((name, player) -> {
            if (!name.equals(player.getName())) {
                throw new ValidationException(
                        String.format("Player map key %s does not match player name %s", name, player.getName()));
            }
        });
        validator.validate(players.values(), games);

        Map<String, Double> snapshot = snapshot(players);
        TournamentRecord record = TournamentRecord.of(null, players.keySet(), games);

        Stream<Player> stream = config.isParallel()
                ? players.values().parallelStream()
                : players.values().stream();

        Map<String, RatingChange> changes = stream
                .map(player -> rate(player, record.get(player.getName()), snapshot))
                .collect(Collectors.toMap(RatingChange::getName, Function.identity(), (a, b) -> a, TreeMap::new));

        log.info("Rated {} players from {} games", changes.size(), games.size());
        return Collections.unmodifiableMap(changes);
    }

    // ============ CALCULATION ============

    /**
     * Pre-tournament rating of every player, with unrated players at the default rating.
     */
    Map<String, Double> snapshot(Map<String, Player> players) {
        Map<String, Double> ratings = new LinkedHashMap<>();
        for (Player player : players.values()) {
            ratings.put(player.getName(), (double) effectiveRating(player));
        }
        return Collections.unmodifiableMap(ratings);
    }

    RatingChange rate(Player player, PlayerRecord record, Map<String, Double> snapshot) {
        int games = record.getGamesInTournament();
        boolean provisional = config.isProvisional(player.getGamesPlayedLifetime());
        double k = config.kFactorFor(player.getGamesPlayedLifetime());

        RatingChange.Builder change = RatingChange.builder()
                .name(player.getName())
                .oldRating(player.getPriorRating())
                .gamesPlayed(games)
                .provisional(provisional)
                .kFactor(k)
                .lifetimeGames(player.getGamesPlayedLifetime() + games);

        if (games == 0) {
            return change.newRating(player.getPriorRating()).build();
        }

        double rating = snapshot.get(player.getName());
        double expected = 0.0;
        double opponentSum = 0.0;
        for (String opponent : record.getOpponents()) {
            double opponentRating = snapshot.get(opponent);
            expected += EloExpectation.expectedScore(rating, opponentRating);
            opponentSum += opponentRating;
        }
        double actual = record.getScore();
        double performance = EloExpectation.performanceRating(
                opponentSum / games, actual / games, config.getPerformanceSpreadCap());

        double unrounded;
        if (player.isUnrated() && provisional) {
            unrounded = performance;
        } else {
            unrounded = rating + k * (actual - expected);
        }
        int newRating = Math.max(floorFor(player), config.round(unrounded));

        log.debug("{}: rating {} expected {} actual {} K {} -> {} (performance {})",
                player.getName(), rating, String.format("%.3f", expected), actual, k, newRating,
                String.format("%.1f", performance));

        return change
                .newRating(newRating)
                .performanceRating(config.round(performance))
                .expectedScore(expected)
                .actualScore(actual)
                .build();
    }

    private int effectiveRating(Player player) {
        return player.isUnrated() ? config.getDefaultRating() : player.getPriorRating();
    }

    private int floorFor(Player player) {
        Integer own = player.getRatingFloor();
        return own != null ? Math.max(own, config.getRatingFloor()) : config.getRatingFloor();
    }
}
