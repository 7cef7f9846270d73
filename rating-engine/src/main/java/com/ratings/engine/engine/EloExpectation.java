package com.ratings.engine.engine;

/**
 * Logistic expectation curve shared by the expected-score and performance-rating
 * calculations.
 *
 * <pre>
 *   E = 1 / (1 + 10^((opponent - rating) / 400))
 *   performance = averageOpponent + 400 * log10(p / (1 - p))
 * </pre>
 */
public final class EloExpectation {

    private static final double SCALE = 400.0;

    private EloExpectation() {}

    /**
     * Expected score (0..1) of a player against one opponent.
     */
    public static double expectedScore(double rating, double opponentRating) {
        return 1.0 / (1.0 + Math.pow(10.0, (opponentRating - rating) / SCALE));
    }

    /**
     * Rating that would have made the expected score equal the achieved fraction
     * against opponents of the given average rating. The rating difference is
     * capped at {@code spreadCap}, which is also the answer for a 0% or 100% score.
     *
     * @param averageOpponentRating mean rating of the opponents faced
     * @param scoreFraction         points divided by games, 0..1
     * @param spreadCap             largest difference from the opponent average
     */
    public static double performanceRating(double averageOpponentRating, double scoreFraction, int spreadCap) {
        if (scoreFraction <= 0.0) {
            return averageOpponentRating - spreadCap;
        }
        if (scoreFraction >= 1.0) {
            return averageOpponentRating + spreadCap;
        }
        double difference = SCALE * Math.log10(scoreFraction / (1.0 - scoreFraction));
        difference = Math.max(-spreadCap, Math.min(spreadCap, difference));
        return averageOpponentRating + difference;
    }
}
