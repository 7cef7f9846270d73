package com.ratings.adapter.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.ratings.adapter.config.RatingInputProperties;
import com.ratings.adapter.exception.ConfigException;
import com.ratings.adapter.exception.FormatException;
import com.ratings.engine.model.GameResult;
import com.ratings.engine.model.TournamentInfo;
import com.ratings.engine.model.TournamentResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads results exported from a spreadsheet, one game per row:
 * {@code Submitted On, Round, Winner, Score, Opponent, Score}.
 * <p>
 * The first row is a header and is skipped. The file does not name or date
 * the tournament, so both must be supplied.
 */
@Component
public class CsvResultReader implements ResultReader {

    private static final Logger log = LoggerFactory.getLogger(CsvResultReader.class);

    private static final int COLUMNS = 6;

    private final CsvMapper csvMapper;
    private final RatingInputProperties inputProperties;

    public CsvResultReader(CsvMapper csvMapper, RatingInputProperties inputProperties) {
        this.csvMapper = csvMapper;
        this.inputProperties = inputProperties;
    }

    @Override
    public Set<String> extensions() {
        return Set.of("csv");
    }

    @Override
    public boolean carriesTournamentInfo() {
        return false;
    }

    @Override
    public TournamentResults read(Path file, TournamentInfo supplied) {
        TournamentInfo info = requireInfo(supplied, file);
        try (Reader reader = Files.newBufferedReader(file, inputProperties.getEncoding())) {
            List<GameResult> games = parse(reader, file.toString());
            log.info("Read {} games of '{}' from {}", games.size(), info.name(), file);
            return new TournamentResults(info, games);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read results " + file, e);
        }
    }

    public List<GameResult> parse(Reader reader, String source) throws IOException {
        List<GameResult> games = new ArrayList<>();
        try (MappingIterator<List<String>> rows = csvMapper.readerForListOf(String.class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(reader)) {
            int lineNumber = 0;
            while (rows.hasNextValue()) {
                List<String> row = rows.nextValue();
                lineNumber++;
                if (lineNumber == 1) {
                    continue;
                }
                if (row.size() < COLUMNS) {
                    throw new FormatException(String.format("Expected %d columns but found %d",
                            COLUMNS, row.size()), source, lineNumber);
                }
                GameResult game = toGame(row, source, lineNumber);
                if (inputProperties.isBye(game.playerA()) || inputProperties.isBye(game.playerB())) {
                    log.info("Skipping bye game in round {}: {} vs {}", game.round(), game.playerA(), game.playerB());
                    continue;
                }
                games.add(game);
            }
        } catch (JsonProcessingException e) {
            Integer line = e.getLocation() != null ? e.getLocation().getLineNr() : null;
            throw new FormatException("Malformed result file: " + e.getOriginalMessage(), source, line);
        }
        return games;
    }

    private static GameResult toGame(List<String> row, String source, int lineNumber) {
        String winner = row.get(2).strip();
        String opponent = row.get(4).strip();
        if (winner.isEmpty() || opponent.isEmpty()) {
            throw new FormatException("Missing player name", source, lineNumber);
        }
        int round = number(row.get(1), "round", source, lineNumber);
        int winnerScore = number(row.get(3), "score", source, lineNumber);
        int opponentScore = number(row.get(5), "score", source, lineNumber);
        return GameResult.scored(round, winner, winnerScore, opponent, opponentScore);
    }

    private static int number(String field, String what, String source, int lineNumber) {
        try {
            return Integer.parseInt(field.strip());
        } catch (NumberFormatException e) {
            throw new FormatException(String.format("Invalid %s '%s'", what, field), source, lineNumber);
        }
    }

    private static TournamentInfo requireInfo(TournamentInfo supplied, Path file) {
        if (supplied == null || supplied.name() == null || supplied.name().isBlank()) {
            throw new ConfigException("A tournament name is required for " + file + " (use --name)");
        }
        if (supplied.date() == null) {
            throw new ConfigException("A tournament date is required for " + file + " (use --date)");
        }
        return supplied;
    }
}
