package com.ratings.engine.model;

/**
 * Outcome of a single game, seen from player A.
 */
public enum GameOutcome {
    A_WINS(1.0, 0.0),
    B_WINS(0.0, 1.0),
    DRAW(0.5, 0.5);

    private final double pointsA;
    private final double pointsB;

    GameOutcome(double pointsA, double pointsB) {
        this.pointsA = pointsA;
        this.pointsB = pointsB;
    }

    public double getPointsA() { return pointsA; }
    public double getPointsB() { return pointsB; }

    /**
     * Decide the outcome from the game points both players scored.
     */
    public static GameOutcome fromScores(int scoreA, int scoreB) {
        if (scoreA > scoreB) return A_WINS;
        if (scoreB > scoreA) return B_WINS;
        return DRAW;
    }
}
