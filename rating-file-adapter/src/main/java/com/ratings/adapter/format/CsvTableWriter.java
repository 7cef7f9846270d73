package com.ratings.adapter.format;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ratings.engine.model.RatingChange;
import com.ratings.engine.stats.Standing;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Set;

/**
 * One CSV row per participant, in standings order.
 */
@Component
public class CsvTableWriter implements ReportWriter {

    private final CsvMapper csvMapper;

    public CsvTableWriter(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
    }

    @Override
    public Set<String> extensions() {
        return Set.of("csv");
    }

    @Override
    public void write(RatingReport report, Writer out) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(TableRow.class).withHeader();
        List<TableRow> rows = report.standings().stream().map(TableRow::of).toList();
        csvMapper.writer(schema).writeValue(out, rows);
    }

    @JsonPropertyOrder({"Name", "Old Rating", "New Rating", "Change", "Games", "Score",
            "Expected", "Performance", "Lifetime Games"})
    record TableRow(
            @JsonProperty("Name") String name,
            @JsonProperty("Old Rating") Integer oldRating,
            @JsonProperty("New Rating") Integer newRating,
            @JsonProperty("Change") Integer change,
            @JsonProperty("Games") int games,
            @JsonProperty("Score") double score,
            @JsonProperty("Expected") String expected,
            @JsonProperty("Performance") Integer performance,
            @JsonProperty("Lifetime Games") int lifetimeGames
    ) {

        static TableRow of(Standing standing) {
            RatingChange change = standing.change();
            return new TableRow(
                    change.getName(),
                    change.getOldRating(),
                    change.getNewRating(),
                    change.getDelta(),
                    change.getGamesPlayed(),
                    change.getActualScore(),
                    change.getExpectedScoreFormatted(),
                    change.getPerformanceRating(),
                    change.getLifetimeGames());
        }
    }
}
