package com.ratings.adapter.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ratings.adapter.config.RatingInputProperties;
import com.ratings.adapter.exception.FormatException;
import com.ratings.engine.model.Player;
import com.ratings.engine.model.RatingList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a delimited rating list with a header row. Column names are matched
 * case-insensitively:
 * <ul>
 *   <li>{@code Name} (required)</li>
 *   <li>{@code Rating} (required, blank or 0 for unrated players)</li>
 *   <li>{@code Games played} or {@code Games} (required)</li>
 *   <li>{@code Floor}, {@code Last played} (optional)</li>
 * </ul>
 * Other columns, such as {@code Deviation}, are ignored. {@code .tsv} files are tab separated.
 */
@Component
public class CsvRatingListReader implements RatingListReader {

    private static final Logger log = LoggerFactory.getLogger(CsvRatingListReader.class);

    private static final TypeReference<Map<String, String>> ROW_TYPE = new TypeReference<>() {};

    private final CsvMapper csvMapper;
    private final RatingInputProperties inputProperties;

    public CsvRatingListReader(CsvMapper csvMapper, RatingInputProperties inputProperties) {
        this.csvMapper = csvMapper;
        this.inputProperties = inputProperties;
    }

    @Override
    public Set<String> extensions() {
        return Set.of("csv", "tsv");
    }

    @Override
    public RatingList read(Path file) {
        char separator = "tsv".equals(FormatRegistry.extensionOf(file)) ? '\t' : ',';
        try (Reader reader = Files.newBufferedReader(file, inputProperties.getEncoding())) {
            RatingList list = parse(reader, file.toString(), separator);
            log.info("Read {} players from rating list {}", list.size(), file);
            return list;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rating list " + file, e);
        }
    }

    public RatingList parse(Reader reader, String source, char separator) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(separator);
        StringWriter buffer = new StringWriter();
        reader.transferTo(buffer);
        String text = buffer.toString();
        List<Integer> recordLines = recordStartLines(text);
        List<Player> players = new ArrayList<>();

        try (MappingIterator<Map<String, String>> rows = csvMapper.readerFor(ROW_TYPE).with(schema).readValues(text)) {
            boolean hasRows = rows.hasNextValue();
            requireColumns(headerOf(rows), source);
            int record = 1;
            while (hasRows) {
                int lineNumber = record < recordLines.size() ? recordLines.get(record) : recordLines.size();
                Map<String, String> row = normalize(rows.nextValue());
                record++;
                players.add(toPlayer(row, source, lineNumber));
                hasRows = rows.hasNextValue();
            }
        } catch (JsonProcessingException e) {
            Integer line = e.getLocation() != null ? e.getLocation().getLineNr() : null;
            throw new FormatException("Malformed rating list: " + e.getOriginalMessage(), source, line);
        }
        return new RatingList(players);
    }

    /**
     * Lower-case column names from the header row the parser has read.
     */
    private static Set<String> headerOf(MappingIterator<?> rows) {
        Set<String> columns = new HashSet<>();
        CsvSchema header = ((CsvParser) rows.getParser()).getSchema();
        for (CsvSchema.Column column : header) {
            columns.add(column.getName().strip().toLowerCase(Locale.ROOT));
        }
        return columns;
    }

    /**
     * Line on which each non-blank record starts, header first. A quoted field
     * may span lines, so newlines inside quotes do not start a record.
     */
    static List<Integer> recordStartLines(String text) {
        List<Integer> starts = new ArrayList<>();
        int line = 1;
        boolean quoted = false;
        boolean blank = true;
        int start = 1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                if (!quoted) {
                    if (!blank) {
                        starts.add(start);
                    }
                    blank = true;
                }
                line++;
                continue;
            }
            if (blank && !Character.isWhitespace(c)) {
                blank = false;
                start = line;
            }
            if (c == '"') {
                quoted = !quoted;
            }
        }
        if (!blank) {
            starts.add(start);
        }
        return starts;
    }

    private Player toPlayer(Map<String, String> row, String source, int lineNumber) {
        String name = row.get("name");
        if (name == null || name.isEmpty()) {
            throw new FormatException("Missing player name", source, lineNumber);
        }
        String games = row.containsKey("games played") ? row.get("games played") : row.get("games");

        return Player.builder()
                .name(name)
                .priorRating(rating(row.get("rating"), source, lineNumber))
                .gamesPlayedLifetime(number(games, "games", source, lineNumber))
                .ratingFloor(optionalNumber(row.get("floor"), "floor", source, lineNumber))
                .lastPlayed(optionalDate(row.get("last played"), source, lineNumber))
                .build();
    }

    private static void requireColumns(Set<String> header, String source) {
        for (String column : List.of("name", "rating")) {
            if (!header.contains(column)) {
                throw new FormatException("Missing column '" + column + "' in header", source, 1);
            }
        }
        if (!header.contains("games played") && !header.contains("games")) {
            throw new FormatException("Missing column 'Games played' in header", source, 1);
        }
    }

    private static Map<String, String> normalize(Map<String, String> row) {
        Map<String, String> normalized = new HashMap<>();
        row.forEach((key, value) -> normalized.put(
                key.strip().toLowerCase(Locale.ROOT), value == null ? "" : value.strip()));
        return normalized;
    }

    /**
     * Blank or 0 means unrated, as in the fixed-width list.
     */
    private static Integer rating(String field, String source, int lineNumber) {
        Integer rating = optionalNumber(field, "rating", source, lineNumber);
        return rating != null && rating == 0 ? null : rating;
    }

    private static int number(String field, String what, String source, int lineNumber) {
        Integer value = optionalNumber(field, what, source, lineNumber);
        return value != null ? value : 0;
    }

    private static Integer optionalNumber(String field, String what, String source, int lineNumber) {
        if (field == null || field.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(field);
        } catch (NumberFormatException e) {
            throw new FormatException(String.format("Invalid %s '%s'", what, field), source, lineNumber);
        }
    }

    private static LocalDate optionalDate(String field, String source, int lineNumber) {
        if (field == null || field.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(field);
        } catch (DateTimeParseException e) {
            throw new FormatException("Invalid last played date '" + field + "'", source, lineNumber);
        }
    }
}
