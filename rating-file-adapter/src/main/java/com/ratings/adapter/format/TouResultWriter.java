package com.ratings.adapter.format;

import com.ratings.adapter.exception.FormatException;
import com.ratings.engine.model.GameResult;
import com.ratings.engine.model.TournamentResults;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes results as a single-section {@code .tou} file that {@link TouResultReader}
 * reads back. Players are numbered in order of first appearance. A win adds 2000
 * and a tie 1000 to the score; a round without a game is written as a bye.
 */
@Component
public class TouResultWriter implements ResultWriter {

    private static final DateTimeFormatter HEADER_DATE = DateTimeFormatter.ofPattern("dd.MM.uuuu");
    private static final Pattern NAME_TOKEN = Pattern.compile(".*\\p{L}.*");
    private static final String SOURCE = "tou output";

    @Override
    public Set<String> extensions() {
        return Set.of("tou");
    }

    @Override
    public void write(TournamentResults results, Writer out) throws IOException {
        List<String> players = new ArrayList<>(results.playerNames());
        Map<String, Integer> numbers = new HashMap<>();
        for (String player : players) {
            requireWritableName(player);
            numbers.put(player, numbers.size() + 1);
        }

        int rounds = 0;
        Map<String, Map<Integer, String>> entries = new LinkedHashMap<>();
        players.forEach(player -> entries.put(player, new HashMap<>()));
        for (GameResult game : results.games()) {
            requireWritable(game);
            rounds = Math.max(rounds, game.round());
            put(entries, game.playerA(), game.round(),
                    entry(game.scoreA(), game.outcome().getPointsA(), numbers.get(game.playerB())));
            put(entries, game.playerB(), game.round(),
                    entry(game.scoreB(), game.outcome().getPointsB(), numbers.get(game.playerA())));
        }

        PrintWriter printer = new PrintWriter(out);
        printer.printf("*M%s %s%n", HEADER_DATE.format(results.info().date()), results.info().name());
        printer.println("*A");
        for (String player : players) {
            StringBuilder line = new StringBuilder(player);
            Map<Integer, String> byRound = entries.get(player);
            for (int round = 1; round <= rounds; round++) {
                line.append(' ').append(byRound.getOrDefault(round, "0 " + numbers.get(player)));
            }
            printer.println(line);
        }
        printer.println("*** END OF FILE ***");
        printer.flush();
        if (printer.checkError()) {
            throw new IOException("Failed to write results");
        }
    }

    private static String entry(int score, double points, int opponent) {
        int marker = points == 1.0 ? 2000 : points == 0.5 ? 1000 : 0;
        return (marker + score) + " " + opponent;
    }

    private static void put(Map<String, Map<Integer, String>> entries, String player, int round, String entry) {
        if (entries.get(player).putIfAbsent(round, entry) != null) {
            throw new FormatException(String.format("%s plays twice in round %d", player, round), SOURCE, null);
        }
    }

    private static void requireWritable(GameResult game) {
        if (game.round() < 1) {
            throw new FormatException(String.format("Game %s vs %s has no round number",
                    game.playerA(), game.playerB()), SOURCE, null);
        }
        if (!game.hasScores()) {
            throw new FormatException(String.format("Game %s vs %s in round %d has no scores",
                    game.playerA(), game.playerB(), game.round()), SOURCE, null);
        }
        if (!fitsScoreField(game.scoreA()) || !fitsScoreField(game.scoreB())) {
            throw new FormatException(String.format("Scores %d-%d in round %d do not fit a .tou score field",
                    game.scoreA(), game.scoreB(), game.round()), SOURCE, null);
        }
    }

    private static boolean fitsScoreField(int score) {
        return score >= 0 && score < 1000;
    }

    // every word of a name must hold a letter, or the reader takes it for a score
    private static void requireWritableName(String name) {
        for (String token : name.strip().split("\\s+")) {
            if (!NAME_TOKEN.matcher(token).matches()) {
                throw new FormatException("Player name '" + name + "' cannot be written to .tou", SOURCE, null);
            }
        }
    }
}
