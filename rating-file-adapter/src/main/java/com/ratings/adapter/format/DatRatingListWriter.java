package com.ratings.adapter.format;

import com.ratings.adapter.exception.FormatException;
import com.ratings.engine.model.Player;
import com.ratings.engine.model.RatingList;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.time.format.DateTimeFormatter;
import java.util.Set;

/**
 * Writes the fixed-width {@code .dat} rating list in the columns
 * {@link DatRatingListReader} reads. Unrated players are written with rating 0.
 * The list carries no floors; use {@code .csv} to keep them.
 */
@Component
public class DatRatingListWriter implements RatingListWriter {

    private static final String ROW_FORMAT = "%-9s%-20s%5s%5s %-9s%n";
    private static final int NAME_WIDTH = 20;
    private static final int NUMBER_LIMIT = 99_999;
    private static final DateTimeFormatter LAST_PLAYED = DateTimeFormatter.ofPattern("uuuuMMdd");

    @Override
    public Set<String> extensions() {
        return Set.of("dat");
    }

    @Override
    public void write(RatingList ratingList, Writer out) throws IOException {
        PrintWriter printer = new PrintWriter(out);
        printer.printf(ROW_FORMAT, "NICK", "Name", "Games", " Rat", "Lastplayed");
        for (Player player : ratingList.getPlayers()) {
            requireFits(player);
            printer.printf(ROW_FORMAT,
                    "",
                    player.getName(),
                    player.getGamesPlayedLifetime(),
                    player.isUnrated() ? 0 : player.getPriorRating(),
                    player.getLastPlayed() != null ? LAST_PLAYED.format(player.getLastPlayed()) : "");
        }
        printer.flush();
        if (printer.checkError()) {
            throw new IOException("Failed to write rating list");
        }
    }

    private static void requireFits(Player player) {
        if (player.getName().length() > NAME_WIDTH) {
            throw new FormatException(String.format("Name '%s' is longer than %d characters",
                    player.getName(), NAME_WIDTH), "rating list", null);
        }
        if (player.getGamesPlayedLifetime() > NUMBER_LIMIT
                || (player.getPriorRating() != null && player.getPriorRating() > NUMBER_LIMIT)) {
            throw new FormatException("Numbers for " + player.getName() + " do not fit the .dat columns",
                    "rating list", null);
        }
    }
}
