package com.ratings.adapter.format;

import com.ratings.adapter.SampleFiles;
import com.ratings.adapter.config.RatingInputProperties;
import com.ratings.engine.model.Player;
import com.ratings.engine.model.RatingChange;
import com.ratings.engine.model.RatingList;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CsvRatingListWriterTest {

    private static final LocalDate PLAYED = LocalDate.of(2021, 6, 1);

    private final CsvRatingListWriter writer = new CsvRatingListWriter(SampleFiles.csvMapper());
    private final CsvRatingListReader reader =
            new CsvRatingListReader(SampleFiles.csvMapper(), new RatingInputProperties());

    private RatingList writeAndReadBack(RatingList list) throws IOException {
        StringWriter out = new StringWriter();
        writer.write(list, out);
        return reader.parse(new StringReader(out.toString()), "ratings-new.csv", ',');
    }

    @Test
    void playersWhoPlayedGetNewRatingGamesAndDate() throws IOException {
        RatingList list = new RatingList(List.of(
                Player.builder().name("Ann Able").priorRating(1450).gamesPlayedLifetime(12)
                        .lastPlayed(LocalDate.of(2020, 3, 1)).build(),
                Player.rated("Ben Baker", 1700, 90),
                Player.unrated("Cal Cole")));
        Map<String, RatingChange> changes = Map.of(
                "Ann Able", RatingChange.builder().name("Ann Able").oldRating(1450).newRating(1466)
                        .gamesPlayed(4).lifetimeGames(16).build(),
                "Ben Baker", RatingChange.builder().name("Ben Baker").oldRating(1700).newRating(1700)
                        .gamesPlayed(0).lifetimeGames(90).build());

        RatingList written = writeAndReadBack(list.afterTournament(changes, PLAYED));

        assertEquals(List.of("Ben Baker", "Ann Able", "Cal Cole"),
                written.getPlayers().stream().map(Player::getName).toList());
        Player ann = written.asMap().get("Ann Able");
        assertEquals(1466, ann.getPriorRating());
        assertEquals(16, ann.getGamesPlayedLifetime());
        assertEquals(PLAYED, ann.getLastPlayed());

        Player ben = written.asMap().get("Ben Baker");
        assertEquals(1700, ben.getPriorRating());
        assertNull(ben.getLastPlayed());

        Player cal = written.asMap().get("Cal Cole");
        assertNull(cal.getPriorRating());
    }

    @Test
    void ratingFloorSurvivesTheNextTournament() throws IOException {
        RatingList list = new RatingList(List.of(
                Player.builder().name("Ann Able").priorRating(1450).gamesPlayedLifetime(12)
                        .ratingFloor(1400).build(),
                Player.rated("Ben Baker", 1500, 40)));
        Map<String, RatingChange> changes = Map.of(
                "Ann Able", RatingChange.builder().name("Ann Able").oldRating(1450).newRating(1430)
                        .gamesPlayed(3).lifetimeGames(15).build());

        RatingList written = writeAndReadBack(list.afterTournament(changes, PLAYED));

        assertEquals(1400, written.asMap().get("Ann Able").getRatingFloor());
        assertNull(written.asMap().get("Ben Baker").getRatingFloor());
    }

    @Test
    void headerNamesEveryColumn() throws IOException {
        StringWriter out = new StringWriter();
        writer.write(new RatingList(List.of(Player.rated("Ann Able", 1450, 12))), out);

        String header = out.toString().lines().findFirst().orElseThrow();
        assertEquals("Name,Rating,Games played,Floor,Last played", header.replace("\"", ""));
    }
}
