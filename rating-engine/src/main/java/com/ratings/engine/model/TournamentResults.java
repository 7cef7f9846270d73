package com.ratings.engine.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything a result file yields: the tournament it belongs to and its games in file order.
 */
public record TournamentResults(TournamentInfo info, List<GameResult> games) {

    public TournamentResults {
        games = List.copyOf(games);
    }

    /**
     * Every player name mentioned by a game, in order of first appearance.
     */
    public Set<String> playerNames() {
        Set<String> names = new LinkedHashSet<>();
        for (GameResult game : games) {
            names.add(game.playerA());
            names.add(game.playerB());
        }
        return names;
    }
}
