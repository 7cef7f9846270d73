package com.ratings.adapter.format;

import com.ratings.adapter.SampleFiles;
import com.ratings.adapter.config.RatingInputProperties;
import com.ratings.adapter.exception.ConfigException;
import com.ratings.adapter.exception.FormatException;
import com.ratings.engine.model.GameOutcome;
import com.ratings.engine.model.GameResult;
import com.ratings.engine.model.TournamentInfo;
import com.ratings.engine.model.TournamentResults;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvResultReaderTest {

    private static final String RESULTS = """
            Submitted On,Round,Winner,Score,Opponent,Score
            2021-06-01 10:02,1,Ann Able,420,Ben Baker,380
            2021-06-01 10:05,1,Cal Cole,390,Dee Dunn,355
            2021-06-01 11:40,2,Ben Baker,400,Cal Cole,400
            2021-06-01 11:45,2,Dee Dunn,512,Bye,0
            """;

    private static final TournamentInfo INFO = new TournamentInfo("Summer Open", LocalDate.of(2021, 6, 1));

    private final CsvResultReader reader = new CsvResultReader(SampleFiles.csvMapper(), new RatingInputProperties());

    @Test
    void parsesOneGamePerRowAndSkipsHeader() throws IOException {
        List<GameResult> games = reader.parse(new StringReader(RESULTS), "results.csv");

        assertEquals(3, games.size());
        GameResult first = games.get(0);
        assertEquals(1, first.round());
        assertEquals("Ann Able", first.playerA());
        assertEquals("Ben Baker", first.playerB());
        assertEquals(GameOutcome.A_WINS, first.outcome());
        assertEquals(40, first.spreadFor("Ann Able"));
    }

    @Test
    void equalScoresAreADraw() throws IOException {
        List<GameResult> games = reader.parse(new StringReader(RESULTS), "results.csv");

        assertEquals(GameOutcome.DRAW, games.get(2).outcome());
    }

    @Test
    void outcomeFollowsScoresNotColumnOrder() throws IOException {
        String csv = """
                Submitted On,Round,Winner,Score,Opponent,Score
                2021-06-01 10:02,1,Ann Able,300,Ben Baker,410
                """;

        GameResult game = reader.parse(new StringReader(csv), "results.csv").get(0);

        assertEquals(GameOutcome.B_WINS, game.outcome());
    }

    @Test
    void byeGamesAreSkipped() throws IOException {
        List<GameResult> games = reader.parse(new StringReader(RESULTS), "results.csv");

        assertFalse(games.stream().anyMatch(g -> g.involves("Bye")));
    }

    @Test
    void shortRow_failsWithLineNumber() {
        String csv = """
                Submitted On,Round,Winner,Score,Opponent,Score
                2021-06-01 10:02,1,Ann Able,420,Ben Baker
                """;

        FormatException e = assertThrows(FormatException.class,
                () -> reader.parse(new StringReader(csv), "results.csv"));
        assertEquals(2, e.getLine());
    }

    @Test
    void nonNumericScore_fails() {
        String csv = """
                Submitted On,Round,Winner,Score,Opponent,Score
                2021-06-01 10:02,1,Ann Able,lots,Ben Baker,380
                """;

        FormatException e = assertThrows(FormatException.class,
                () -> reader.parse(new StringReader(csv), "results.csv"));
        assertTrue(e.getMessage().contains("Invalid score 'lots'"));
    }

    @Test
    void read_usesSuppliedNameAndDate(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("results.csv");
        Files.writeString(file, RESULTS);

        TournamentResults results = reader.read(file, INFO);

        assertEquals(INFO, results.info());
        assertEquals(3, results.games().size());
    }

    @Test
    void read_withoutName_failsBeforeParsing(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("results.csv");
        Files.writeString(file, "not,a,results,file");

        assertThrows(ConfigException.class,
                () -> reader.read(file, new TournamentInfo(null, LocalDate.of(2021, 6, 1))));
    }

    @Test
    void read_withoutDate_fails(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("results.csv");
        Files.writeString(file, RESULTS);

        assertThrows(ConfigException.class, () -> reader.read(file, new TournamentInfo("Summer Open", null)));
        assertThrows(ConfigException.class, () -> reader.read(file, null));
    }

    @Test
    void doesNotCarryTournamentInfo() {
        assertFalse(reader.carriesTournamentInfo());
    }
}
