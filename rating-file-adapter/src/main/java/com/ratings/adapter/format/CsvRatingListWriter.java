package com.ratings.adapter.format;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ratings.engine.model.Player;
import com.ratings.engine.model.RatingList;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Set;

/**
 * Writes a rating list in the layout {@link CsvRatingListReader} reads, in list
 * order, so it can feed the next tournament.
 */
@Component
public class CsvRatingListWriter implements RatingListWriter {

    private final CsvMapper csvMapper;

    public CsvRatingListWriter(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
    }

    @Override
    public Set<String> extensions() {
        return Set.of("csv");
    }

    @Override
    public void write(RatingList ratingList, Writer out) throws IOException {
        List<ListRow> rows = ratingList.getPlayers().stream()
                .map(ListRow::of)
                .toList();
        CsvSchema schema = csvMapper.schemaFor(ListRow.class).withHeader();
        csvMapper.writer(schema).writeValue(out, rows);
    }

    @JsonPropertyOrder({"Name", "Rating", "Games played", "Floor", "Last played"})
    record ListRow(
            @JsonProperty("Name") String name,
            @JsonProperty("Rating") Integer rating,
            @JsonProperty("Games played") int gamesPlayed,
            @JsonProperty("Floor") Integer floor,
            @JsonProperty("Last played") String lastPlayed
    ) {

        static ListRow of(Player player) {
            return new ListRow(
                    player.getName(),
                    player.getPriorRating(),
                    player.getGamesPlayedLifetime(),
                    player.getRatingFloor(),
                    player.getLastPlayed() != null ? player.getLastPlayed().toString() : null);
        }
    }
}
