package com.ratings.engine.model;

import java.util.Objects;

/**
 * One game of a tournament. The pair of players is unordered but the outcome
 * is read from player A's side.
 *
 * @param round   1-based round number, or 0 when the source does not record it
 * @param playerA name of the first player
 * @param playerB name of the second player
 * @param outcome who won
 * @param scoreA  game points of player A as printed in the source file, may be null
 * @param scoreB  game points of player B as printed in the source file, may be null
 */
public record GameResult(
        int round,
        String playerA,
        String playerB,
        GameOutcome outcome,
        Integer scoreA,
        Integer scoreB
) {

    public GameResult {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static GameResult of(int round, String playerA, String playerB, GameOutcome outcome) {
        return new GameResult(round, playerA, playerB, outcome, null, null);
    }

    public static GameResult scored(int round, String playerA, int scoreA, String playerB, int scoreB) {
        return new GameResult(round, playerA, playerB, GameOutcome.fromScores(scoreA, scoreB), scoreA, scoreB);
    }

    public boolean involves(String name) {
        return name.equals(playerA) || name.equals(playerB);
    }

    public String opponentOf(String name) {
        if (name.equals(playerA)) return playerB;
        if (name.equals(playerB)) return playerA;
        throw new IllegalArgumentException(name + " did not play in " + this);
    }

    public double pointsFor(String name) {
        if (name.equals(playerA)) return outcome.getPointsA();
        if (name.equals(playerB)) return outcome.getPointsB();
        throw new IllegalArgumentException(name + " did not play in " + this);
    }

    /**
     * Point difference from the given player's side, or 0 when the source file carried no scores.
     */
    public int spreadFor(String name) {
        if (scoreA == null || scoreB == null) {
            return 0;
        }
        int spread = scoreA - scoreB;
        return name.equals(playerA) ? spread : -spread;
    }

    public boolean hasScores() {
        return scoreA != null && scoreB != null;
    }
}
