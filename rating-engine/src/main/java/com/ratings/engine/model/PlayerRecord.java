package com.ratings.engine.model;

import java.util.List;

/**
 * One player's games in a tournament, in the order they were played.
 */
public final class PlayerRecord {

    private final String name;
    private final List<GameResult> games;

    public PlayerRecord(String name, List<GameResult> games) {
        this.name = name;
        this.games = List.copyOf(games);
    }

    public String getName() { return name; }

    public List<GameResult> getGames() { return games; }

    public int getGamesInTournament() {
        return games.size();
    }

    public double getScore() {
        return games.stream().mapToDouble(g -> g.pointsFor(name)).sum();
    }

    public List<String> getOpponents() {
        return games.stream().map(g -> g.opponentOf(name)).toList();
    }

    public int getWins() {
        return (int) games.stream().filter(g -> g.pointsFor(name) == 1.0).count();
    }

    public int getDraws() {
        return (int) games.stream().filter(g -> g.outcome() == GameOutcome.DRAW).count();
    }

    public int getLosses() {
        return (int) games.stream().filter(g -> g.pointsFor(name) == 0.0).count();
    }

    public int getSpread() {
        return games.stream().mapToInt(g -> g.spreadFor(name)).sum();
    }

    /**
     * Win-loss record with draws counted as half a win and half a loss, e.g. {@code 2.5-0.5}.
     */
    public String getRecordFormatted() {
        double score = getScore();
        return formatHalf(score) + "-" + formatHalf(games.size() - score);
    }

    private static String formatHalf(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
