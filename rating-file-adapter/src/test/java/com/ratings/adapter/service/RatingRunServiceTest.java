package com.ratings.adapter.service;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.ratings.adapter.SampleFiles;
import com.ratings.adapter.config.RatingInputProperties;
import com.ratings.adapter.config.RatingOutputProperties;
import com.ratings.adapter.exception.ConfigException;
import com.ratings.adapter.exception.FormatException;
import com.ratings.adapter.format.CsvRatingListReader;
import com.ratings.adapter.format.CsvRatingListWriter;
import com.ratings.adapter.format.CsvResultReader;
import com.ratings.adapter.format.CsvTableWriter;
import com.ratings.adapter.format.DatRatingListReader;
import com.ratings.adapter.format.DatRatingListWriter;
import com.ratings.adapter.format.FormatRegistry;
import com.ratings.adapter.format.TextReportWriter;
import com.ratings.adapter.format.TouResultReader;
import com.ratings.adapter.format.TouResultWriter;
import com.ratings.engine.config.RatingConfig;
import com.ratings.engine.engine.RatingEngine;
import com.ratings.engine.exception.ValidationException;
import com.ratings.engine.model.Player;
import com.ratings.engine.model.RatingChange;
import com.ratings.engine.model.RatingList;
import com.ratings.engine.model.TournamentResults;
import com.ratings.engine.validation.TournamentValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RatingRunServiceTest {

    @TempDir
    Path dir;

    private Path out;
    private Path ratings;
    private Path results;

    private final RatingInputProperties input = new RatingInputProperties();
    private final RatingOutputProperties output = new RatingOutputProperties();
    private RatingRunService service;

    @BeforeEach
    void setUp() throws IOException {
        CsvMapper csvMapper = SampleFiles.csvMapper();
        FormatRegistry formats = new FormatRegistry(
                List.of(new DatRatingListReader(input), new CsvRatingListReader(csvMapper, input)),
                List.of(new TouResultReader(input), new CsvResultReader(csvMapper, input)),
                List.of(new TextReportWriter(), new CsvTableWriter(csvMapper)),
                List.of(new CsvRatingListWriter(csvMapper), new DatRatingListWriter()),
                List.of(new TouResultWriter()));
        TournamentValidator validator = new TournamentValidator();
        service = new RatingRunService(formats, validator, new RatingEngine(RatingConfig.defaults(), validator),
                input, output);

        out = dir.resolve("out");
        ratings = dir.resolve("rating.dat");
        results = dir.resolve("towel.tou");
        Files.writeString(ratings, SampleFiles.towelDayRatingList());
        Files.writeString(results, SampleFiles.TOWEL_DAY_TOU);
    }

    private RunRequest request(Path ratingsFile, Path resultsFile) {
        return new RunRequest(ratingsFile, resultsFile, null, null, out);
    }

    @Test
    void ratesTournamentAndWritesReportAndTable() throws IOException {
        RunResult result = service.run(request(ratings, results));

        assertEquals("Glorious Towel Day Tournament", result.getInfo().name());
        assertEquals(6, result.getGames());
        assertEquals(List.of(out.resolve("ratings-report.txt"), out.resolve("ratings.csv")), result.getWrittenFiles());
        assertTrue(Files.readString(out.resolve("ratings-report.txt")).contains("R1 W Bertie Wooster 500-450"));
        assertTrue(Files.readString(out.resolve("ratings.csv")).contains("Arthur Dent"));

        assertEquals(1607, result.getChanges().get("Arthur Dent").getNewRating());
        RatingChange obelix = result.getChanges().get("Obelix");
        assertTrue(obelix.isUnrated());
        assertEquals(1620, obelix.getNewRating());
    }

    @Test
    void playersWithoutGamesKeepTheirRatingAndStayOutOfTheReport() throws IOException {
        RunResult result = service.run(request(ratings, results));

        RatingChange marvin = result.getChanges().get("Marvin");
        assertEquals(1700, marvin.getNewRating());
        assertEquals(0, marvin.getDelta());
        assertFalse(Files.readString(out.resolve("ratings-report.txt")).contains("Marvin"));
    }

    @Test
    void byeEntriesAreDroppedFromTheRatingList() {
        RunResult result = service.run(request(ratings, results));

        assertFalse(result.getChanges().containsKey("Zz Bye"));
    }

    @Test
    void writesUpdatedRatingListWhenEnabled() {
        output.setRatingListFile("ratings-new.csv");

        service.run(request(ratings, results));

        RatingList updated = new CsvRatingListReader(SampleFiles.csvMapper(), input).read(out.resolve("ratings-new.csv"));
        assertEquals(5, updated.size());
        assertEquals("Marvin", updated.getPlayers().get(0).getName());
        Player obelix = updated.asMap().get("Obelix");
        assertEquals(1620, obelix.getPriorRating());
        assertEquals(3, obelix.getGamesPlayedLifetime());
        assertEquals(LocalDate.of(2020, 5, 25), obelix.getLastPlayed());
        assertFalse(updated.asMap().containsKey("Zz Bye"));
    }

    @Test
    void validationFailure_writesNothing() throws IOException {
        Files.writeString(ratings, SampleFiles.towelDayRatingList()
                + SampleFiles.datRow("Arthur Dent", 3, 1200, "20200101"));

        ValidationException e = assertThrows(ValidationException.class, () -> service.run(request(ratings, results)));

        assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("Duplicate player name: Arthur Dent")));
        assertFalse(Files.exists(out));
    }

    @Test
    void malformedResults_writesNothing() throws IOException {
        Files.writeString(results, SampleFiles.TOWEL_DAY_TOU.replace("450 +1", "450 +3"));

        assertThrows(FormatException.class, () -> service.run(request(ratings, results)));
        assertFalse(Files.exists(out));
    }

    @Test
    void failedRun_leavesExistingOutputsAndNoTemporaryFiles() throws IOException {
        Files.createDirectories(out);
        Files.writeString(out.resolve("ratings-report.txt"), "previous report");
        output.setTableFile("ratings.xlsx");

        assertThrows(FormatException.class, () -> service.run(request(ratings, results)));

        assertEquals("previous report", Files.readString(out.resolve("ratings-report.txt")));
        try (Stream<Path> files = Files.list(out)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void failedMoveRestoresOutputsAlreadyReplaced() throws IOException {
        Files.createDirectories(out.resolve("ratings.csv"));
        Files.writeString(out.resolve("ratings.csv").resolve("keep.txt"), "in the way");
        Files.writeString(out.resolve("ratings-report.txt"), "previous report");

        assertThrows(UncheckedIOException.class, () -> service.run(request(ratings, results)));

        assertEquals("previous report", Files.readString(out.resolve("ratings-report.txt")));
        try (Stream<Path> files = Files.list(out)) {
            assertEquals(List.of("ratings-report.txt", "ratings.csv"),
                    files.map(p -> p.getFileName().toString()).sorted().toList());
        }
    }

    @Test
    void failedMoveRemovesOutputsThatDidNotExistBefore() throws IOException {
        Files.createDirectories(out.resolve("ratings.csv"));
        Files.writeString(out.resolve("ratings.csv").resolve("keep.txt"), "in the way");

        assertThrows(UncheckedIOException.class, () -> service.run(request(ratings, results)));

        assertFalse(Files.exists(out.resolve("ratings-report.txt")));
    }

    @Test
    void rerunReplacesOutputsAndLeavesNoBackups() throws IOException {
        Files.createDirectories(out);
        Files.writeString(out.resolve("ratings-report.txt"), "previous report");

        service.run(request(ratings, results));

        assertTrue(Files.readString(out.resolve("ratings-report.txt")).contains("Glorious Towel Day Tournament"));
        try (Stream<Path> files = Files.list(out)) {
            assertEquals(2, files.count());
        }
    }

    @Test
    void writesFixedWidthRatingListByExtension() throws IOException {
        output.setRatingListFile("rating-new.dat");

        service.run(request(ratings, results));

        RatingList updated = new DatRatingListReader(input).read(out.resolve("rating-new.dat"));
        assertEquals(5, updated.size());
        assertEquals(1607, updated.asMap().get("Arthur Dent").getPriorRating());
        assertEquals(LocalDate.of(2020, 5, 25), updated.asMap().get("Arthur Dent").getLastPlayed());
        assertEquals(LocalDate.of(2018, 7, 4), updated.asMap().get("Marvin").getLastPlayed());
    }

    @Test
    void inactivePlayersAreDroppedFromTheUpdatedList() {
        output.setRatingListFile("ratings-new.csv");
        output.setInactiveAfterDays(365);

        service.run(request(ratings, results));

        RatingList updated = new CsvRatingListReader(SampleFiles.csvMapper(), input).read(out.resolve("ratings-new.csv"));
        assertEquals(4, updated.size());
        assertFalse(updated.asMap().containsKey("Marvin"));
        assertTrue(updated.asMap().containsKey("Obelix"));
    }

    @Test
    void csvResultsAreConvertedToTou() throws IOException {
        Path csv = dir.resolve("results.csv");
        Files.writeString(csv, """
                Submitted On,Round,Winner,Score,Opponent,Score
                2020-05-25 10:00,1,Arthur Dent,500,Bertie Wooster,450
                2020-05-25 11:00,2,Bertie Wooster,420,Arthur Dent,420
                """);
        output.setResultsFile("towel.tou");

        service.run(new RunRequest(ratings, csv, "Towel Day Rapid", LocalDate.of(2020, 5, 25), out));

        TournamentResults converted;
        try (BufferedReader reader = Files.newBufferedReader(out.resolve("towel.tou"))) {
            converted = new TouResultReader(input).parse(reader, "towel.tou", null);
        }
        assertEquals("Towel Day Rapid", converted.info().name());
        assertEquals(2, converted.games().size());
        assertEquals(LocalDate.of(2020, 5, 25), converted.info().date());
    }

    @Test
    void csvResultsNeedNameAndDate() throws IOException {
        Path csv = dir.resolve("results.csv");
        Files.writeString(csv, """
                Submitted On,Round,Winner,Score,Opponent,Score
                2020-05-25 10:00,1,Arthur Dent,500,Bertie Wooster,450
                """);

        assertThrows(ConfigException.class, () -> service.run(request(ratings, csv)));

        RunResult result = service.run(
                new RunRequest(ratings, csv, "Towel Day Rapid", LocalDate.of(2020, 5, 25), out));
        assertEquals("Towel Day Rapid", result.getInfo().name());
        assertEquals(1605, result.getChanges().get("Arthur Dent").getNewRating());
    }

    @Test
    void missingInputFile_isAConfigError() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> service.run(request(dir.resolve("missing.dat"), results)));
        assertTrue(e.getMessage().contains("missing.dat"));
    }

    @Test
    void unratedPlayerWithoutGamesHasNoNewRating() throws IOException {
        Files.writeString(ratings, SampleFiles.towelDayRatingList()
                + SampleFiles.datRow("Newcomer", 0, 0, "20200101"));

        RunResult result = service.run(request(ratings, results));

        assertNull(result.getChanges().get("Newcomer").getNewRating());
    }
}
