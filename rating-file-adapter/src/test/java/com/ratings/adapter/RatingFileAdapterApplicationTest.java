package com.ratings.adapter;

import com.ratings.adapter.cli.RatingCommandLineRunner;
import com.ratings.adapter.format.FormatRegistry;
import com.ratings.adapter.format.TouResultReader;
import com.ratings.adapter.service.RatingRunService;
import com.ratings.adapter.service.RunRequest;
import com.ratings.adapter.service.RunResult;
import com.ratings.engine.engine.RatingEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.io.IOException;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = {
        "rating.engine.rounding=HALF_UP",
        "rating.input.bye-names=Zz Bye"
})
class RatingFileAdapterApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private RatingEngine engine;

    @Autowired
    private FormatRegistry formats;

    @Autowired
    private RatingRunService runService;

    @Test
    void bindsEngineSettingsFromProperties() {
        assertEquals(RoundingMode.HALF_UP, engine.getConfig().getRounding());
        assertEquals(1500, engine.getConfig().getDefaultRating());
    }

    @Test
    void commandLineRunnerIsDisabledInTests() {
        assertTrue(context.getBeansOfType(RatingCommandLineRunner.class).isEmpty());
    }

    @Test
    void registersEveryFormat() {
        assertInstanceOf(TouResultReader.class, formats.resultReaderFor(Path.of("event.tou")));
    }

    @Test
    void runsTheSampleTournamentEndToEnd(@TempDir Path dir) throws IOException {
        Path ratings = dir.resolve("rating.dat");
        Path results = dir.resolve("towel.tou");
        Files.writeString(ratings, SampleFiles.towelDayRatingList());
        Files.writeString(results, SampleFiles.TOWEL_DAY_TOU);

        RunResult result = runService.run(new RunRequest(ratings, results, null, null, dir));

        assertEquals(2, result.getWrittenFiles().size());
        assertTrue(Files.exists(dir.resolve("ratings-report.txt")));
        assertEquals(1607, result.getChanges().get("Arthur Dent").getNewRating());
    }
}
