package com.ratings.adapter.format;

import com.ratings.adapter.config.RatingInputProperties;
import com.ratings.adapter.exception.FormatException;
import com.ratings.engine.model.Player;
import com.ratings.engine.model.RatingList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads the fixed-width {@code .dat} rating list.
 *
 * <pre>
 * NICK     Name                Games  Rat Lastplayed New Dev
 *          Arthur Dent            40 1600 20240301 150.0
 * </pre>
 *
 * Columns: nick 0-8, name 9-28, lifetime games 29-33, rating 34-38, last played
 * date from column 40. The first line is a heading.
 */
@Component
public class DatRatingListReader implements RatingListReader {

    private static final Logger log = LoggerFactory.getLogger(DatRatingListReader.class);

    private static final DateTimeFormatter YEAR_MONTH_DAY =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter YEAR_DAY_MONTH =
            DateTimeFormatter.ofPattern("uuuuddMM").withResolverStyle(ResolverStyle.STRICT);

    // Hand-edited lists drift by a column either way
    private static final int[] DATE_COLUMNS = {40, 39, 41};
    private static final LocalDate UNKNOWN_LAST_PLAYED = LocalDate.of(2006, 1, 1);

    private final RatingInputProperties inputProperties;

    public DatRatingListReader(RatingInputProperties inputProperties) {
        this.inputProperties = inputProperties;
    }

    @Override
    public Set<String> extensions() {
        return Set.of("dat");
    }

    @Override
    public RatingList read(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, inputProperties.getEncoding())) {
            RatingList list = parse(reader, file.toString());
            log.info("Read {} players from rating list {}", list.size(), file);
            return list;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rating list " + file, e);
        }
    }

    public RatingList parse(BufferedReader reader, String source) throws IOException {
        List<Player> players = new ArrayList<>();
        String line = reader.readLine();   // heading
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            players.add(parsePlayer(line, source, lineNumber));
        }
        return new RatingList(players);
    }

    private Player parsePlayer(String row, String source, int lineNumber) {
        String name = column(row, 9, 29);
        if (name.isEmpty()) {
            throw new FormatException("Missing player name", source, lineNumber);
        }
        int games = parseNumber(column(row, 29, 34), "games", source, lineNumber);
        String ratingField = column(row, 34, 39);
        Integer rating = ratingField.isEmpty() ? null : parseNumber(ratingField, "rating", source, lineNumber);
        if (rating != null && rating == 0) {
            rating = null;
        }

        return Player.builder()
                .name(name)
                .gamesPlayedLifetime(games)
                .priorRating(rating)
                .lastPlayed(parseLastPlayed(row, source, lineNumber))
                .build();
    }

    private LocalDate parseLastPlayed(String row, String source, int lineNumber) {
        for (int start : DATE_COLUMNS) {
            String candidate = column(row, start, start + 8);
            for (DateTimeFormatter format : List.of(YEAR_MONTH_DAY, YEAR_DAY_MONTH)) {
                try {
                    return LocalDate.parse(candidate, format);
                } catch (DateTimeParseException e) {
                    log.debug("{}:{}: no date '{}' at column {}", source, lineNumber, candidate, start);
                }
            }
        }
        log.warn("{}:{}: could not parse last played date, using {}", source, lineNumber, UNKNOWN_LAST_PLAYED);
        return UNKNOWN_LAST_PLAYED;
    }

    private static int parseNumber(String field, String what, String source, int lineNumber) {
        try {
            return Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw new FormatException(String.format("Invalid %s field '%s'", what, field), source, lineNumber);
        }
    }

    private static String column(String row, int start, int end) {
        if (start >= row.length()) {
            return "";
        }
        return row.substring(start, Math.min(end, row.length())).strip();
    }
}
