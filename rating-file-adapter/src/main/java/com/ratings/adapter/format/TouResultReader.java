package com.ratings.adapter.format;

import com.ratings.adapter.config.RatingInputProperties;
import com.ratings.adapter.exception.FormatException;
import com.ratings.engine.model.GameResult;
import com.ratings.engine.model.TournamentInfo;
import com.ratings.engine.model.TournamentResults;
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
import java.util.regex.Pattern;

/**
 * Reads AUPAIR's {@code .tou} result format.
 *
 * <pre>
 * *M25.05.2020 Glorious Towel Day Tournament
 * *A
 * Arthur Dent 2500 2 1300 +3 2450 4
 * Bertie Wooster 450 +1 250 4 2550 3
 * *** END OF FILE ***
 * </pre>
 *
 * Each player line holds the name followed by one (score, opponent) pair per
 * round. The thousands digit of a score marks a win (2) or tie (1) and is
 * dropped; a {@code +} before the opponent number marks who moved first.
 * Opponents are numbered by their line within the section, starting at 1.
 * A player paired with themself has a bye.
 */
@Component
public class TouResultReader implements ResultReader {

    private static final Logger log = LoggerFactory.getLogger(TouResultReader.class);

    private static final String END_OF_FILE = "*** END OF FILE ***";
    private static final Pattern NAME_TOKEN = Pattern.compile(".*\\p{L}.*");
    private static final DateTimeFormatter HEADER_DATE =
            DateTimeFormatter.ofPattern("dd.MM.uuuu").withResolverStyle(ResolverStyle.STRICT);

    private final RatingInputProperties inputProperties;

    public TouResultReader(RatingInputProperties inputProperties) {
        this.inputProperties = inputProperties;
    }

    @Override
    public Set<String> extensions() {
        return Set.of("tou");
    }

    @Override
    public boolean carriesTournamentInfo() {
        return true;
    }

    @Override
    public TournamentResults read(Path file, TournamentInfo supplied) {
        try (BufferedReader reader = Files.newBufferedReader(file, inputProperties.getEncoding())) {
            TournamentResults results = parse(reader, file.toString(), supplied);
            log.info("Read {} games of '{}' from {}", results.games().size(), results.info().name(), file);
            return results;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read results " + file, e);
        }
    }

    public TournamentResults parse(BufferedReader reader, String source, TournamentInfo supplied) throws IOException {
        String header = reader.readLine();
        if (header == null) {
            throw new FormatException("Empty result file", source, 1);
        }
        TournamentInfo info = parseHeader(header, source, supplied);

        List<Section> sections = new ArrayList<>();
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isEmpty() || line.startsWith(" ")) {
                continue;
            }
            String trimmed = line.strip();
            if (trimmed.equals(END_OF_FILE)) {
                break;
            }
            if (trimmed.startsWith("*")) {
                sections.add(new Section(trimmed.substring(1).strip()));
                continue;
            }
            if (trimmed.length() < 3) {
                continue;
            }

            PlayerLine playerLine = parsePlayerLine(trimmed, source, lineNumber);
            if (playerLine == null) {
                // high word or similar annotation
                log.debug("{}:{}: skipping line without results", source, lineNumber);
                continue;
            }
            if (sections.isEmpty()) {
                throw new FormatException("Player line before the first section marker", source, lineNumber);
            }
            sections.get(sections.size() - 1).lines.add(playerLine);
        }

        List<GameResult> games = new ArrayList<>();
        for (Section section : sections) {
            games.addAll(pairGames(section, source));
        }
        return new TournamentResults(info, games);
    }

    // ============ HEADER ============

    private TournamentInfo parseHeader(String header, String source, TournamentInfo supplied) {
        // *M31.12.1969 Tournament Name
        String trimmed = header.strip();
        if (!trimmed.startsWith("*") || trimmed.length() < 2) {
            throw new FormatException("Header must look like '*MDD.MM.YYYY Tournament Name'", source, 1);
        }
        int space = trimmed.indexOf(' ');
        String dateField = (space < 0 ? trimmed : trimmed.substring(0, space)).substring(2);
        String name = space < 0 ? "" : trimmed.substring(space + 1).strip();

        if (name.isEmpty()) {
            if (supplied == null || supplied.name() == null) {
                throw new FormatException("Header has no tournament name", source, 1);
            }
            name = supplied.name();
        }

        LocalDate date;
        try {
            date = LocalDate.parse(dateField, HEADER_DATE);
        } catch (DateTimeParseException e) {
            if (supplied == null || supplied.date() == null) {
                throw new FormatException("Cannot parse tournament date '" + dateField + "' as dd.mm.yyyy", source, 1);
            }
            log.warn("{}: cannot parse tournament date '{}', using {}", source, dateField, supplied.date());
            date = supplied.date();
        }
        return new TournamentInfo(name, date);
    }

    // ============ PLAYER LINES ============

    /**
     * Splits a line into the name and its (score, opponent) pairs; null when the line has no pairs.
     */
    private PlayerLine parsePlayerLine(String line, String source, int lineNumber) {
        String[] tokens = line.split("\\s+");
        int nameLength = 0;
        while (nameLength < tokens.length && NAME_TOKEN.matcher(tokens[nameLength]).matches()) {
            nameLength++;
        }
        String name = String.join(" ", List.of(tokens).subList(0, nameLength));
        int fields = tokens.length - nameLength;
        if (fields < 2) {
            return null;
        }
        if (name.isEmpty()) {
            throw new FormatException("Result line without a player name", source, lineNumber);
        }
        if (fields % 2 != 0) {
            throw new FormatException(String.format("Player %s has an unpaired score field", name), source, lineNumber);
        }

        List<RoundEntry> rounds = new ArrayList<>();
        for (int i = nameLength; i < tokens.length; i += 2) {
            int score = parseField(tokens[i], source, lineNumber) % 1000;
            int opponent = parseField(tokens[i + 1], source, lineNumber);
            rounds.add(new RoundEntry(score, opponent));
        }
        return new PlayerLine(name, lineNumber, rounds);
    }

    private static int parseField(String token, String source, int lineNumber) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new FormatException("Score field contained a non-digit: " + token, source, lineNumber);
        }
    }

    // ============ PAIRING ============

    /**
     * Joins the two half-results of every game. Each game is emitted once, from
     * the side listed first in the section.
     */
    private List<GameResult> pairGames(Section section, String source) {
        List<GameResult> games = new ArrayList<>();
        List<PlayerLine> lines = section.lines;

        for (int i = 0; i < lines.size(); i++) {
            PlayerLine player = lines.get(i);
            for (int round = 0; round < player.rounds.size(); round++) {
                RoundEntry entry = player.rounds.get(round);
                int j = entry.opponent - 1;
                if (j < 0 || j >= lines.size()) {
                    throw new FormatException(String.format("Invalid opponent number %d for %s in section %s",
                            entry.opponent, player.name, section.name), source, player.lineNumber);
                }
                if (j == i) {
                    log.debug("{} has a bye in round {}", player.name, round + 1);
                    continue;
                }

                PlayerLine opponent = lines.get(j);
                if (round >= opponent.rounds.size() || opponent.rounds.get(round).opponent - 1 != i) {
                    throw new FormatException(String.format(
                            "Round %d: %s lists %s as opponent, but %s does not list %s back",
                            round + 1, player.name, opponent.name, opponent.name, player.name),
                            source, player.lineNumber);
                }
                if (i > j) {
                    continue;
                }
                if (inputProperties.isBye(player.name) || inputProperties.isBye(opponent.name)) {
                    log.info("Skipping bye game in round {}: {} vs {}", round + 1, player.name, opponent.name);
                    continue;
                }
                games.add(GameResult.scored(round + 1,
                        player.name, entry.score,
                        opponent.name, opponent.rounds.get(round).score));
            }
        }
        return games;
    }

    private record RoundEntry(int score, int opponent) {}

    private record PlayerLine(String name, int lineNumber, List<RoundEntry> rounds) {}

    private static final class Section {
        private final String name;
        private final List<PlayerLine> lines = new ArrayList<>();

        private Section(String name) {
            this.name = name;
        }
    }
}
