package com.ratings.adapter.service;

import com.ratings.adapter.config.RatingInputProperties;
import com.ratings.adapter.config.RatingOutputProperties;
import com.ratings.adapter.exception.ConfigException;
import com.ratings.adapter.format.FormatRegistry;
import com.ratings.adapter.format.RatingListReader;
import com.ratings.adapter.format.RatingListWriter;
import com.ratings.adapter.format.RatingReport;
import com.ratings.adapter.format.ReportWriter;
import com.ratings.adapter.format.ResultReader;
import com.ratings.adapter.format.ResultWriter;
import com.ratings.engine.engine.RatingEngine;
import com.ratings.engine.model.Player;
import com.ratings.engine.model.RatingChange;
import com.ratings.engine.model.RatingList;
import com.ratings.engine.model.TournamentInfo;
import com.ratings.engine.model.TournamentRecord;
import com.ratings.engine.model.TournamentResults;
import com.ratings.engine.stats.RatingHistogram;
import com.ratings.engine.stats.Standing;
import com.ratings.engine.stats.Standings;
import com.ratings.engine.stats.TournamentSummary;
import com.ratings.engine.validation.TournamentValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs one tournament through the pipeline: read the rating list and results,
 * validate, rate, and write the outputs.
 * <p>
 * Outputs are rendered in memory and only written once every render has
 * succeeded. They are then committed together: if moving any of them into place
 * fails, the ones already moved are removed and the files they replaced restored.
 */
@Service
public class RatingRunService {

    private static final Logger log = LoggerFactory.getLogger(RatingRunService.class);

    private final FormatRegistry formats;
    private final TournamentValidator validator;
    private final RatingEngine engine;
    private final RatingInputProperties inputProperties;
    private final RatingOutputProperties outputProperties;

    public RatingRunService(
            FormatRegistry formats,
            TournamentValidator validator,
            RatingEngine engine,
            RatingInputProperties inputProperties,
            RatingOutputProperties outputProperties
    ) {
        this.formats = formats;
        this.validator = validator;
        this.engine = engine;
        this.inputProperties = inputProperties;
        this.outputProperties = outputProperties;
    }

    public RunResult run(RunRequest request) {
        requireFile(request.ratingsFile(), "Rating list");
        requireFile(request.resultsFile(), "Result file");

        // Resolve every format up front so an unsupported extension fails before any work
        RatingListReader listReader = formats.ratingListReaderFor(request.ratingsFile());
        ResultReader resultReader = formats.resultReaderFor(request.resultsFile());
        Path outputDirectory = request.outputDirectory() != null
                ? request.outputDirectory()
                : Path.of(outputProperties.getDirectory());
        Path reportFile = outputDirectory.resolve(outputProperties.getReportFile());
        Path tableFile = outputDirectory.resolve(outputProperties.getTableFile());
        ReportWriter reportWriter = formats.reportWriterFor(reportFile);
        ReportWriter tableWriter = formats.reportWriterFor(tableFile);
        Path listFile = outputProperties.isRatingListEnabled()
                ? outputDirectory.resolve(outputProperties.getRatingListFile())
                : null;
        RatingListWriter listWriter = listFile != null ? formats.ratingListWriterFor(listFile) : null;
        Path convertedFile = outputProperties.isResultsFileEnabled()
                ? outputDirectory.resolve(outputProperties.getResultsFile())
                : null;
        ResultWriter resultWriter = convertedFile != null ? formats.resultWriterFor(convertedFile) : null;

        if (!resultReader.carriesTournamentInfo()) {
            requireTournamentInfo(request);
        }

        // ============ READ ============

        RatingList ratingList = withoutByes(listReader.read(request.ratingsFile()));
        TournamentInfo supplied = new TournamentInfo(request.tournamentName(), request.tournamentDate());
        TournamentResults results = resultReader.read(request.resultsFile(), supplied);
        TournamentInfo info = results.info();

        RatingList extended = ratingList.withUnratedEntrants(results.playerNames());
        int entrants = extended.size() - ratingList.size();
        if (entrants > 0) {
            log.info("{} players not on the rating list enter as unrated", entrants);
        }

        // ============ RATE ============

        validator.validate(extended, results.games());
        Map<String, RatingChange> changes = engine.computeNewRatings(extended.asMap(), results.games());

        Map<String, RatingChange> participants = new TreeMap<>();
        changes.forEach((name, change) -> {
            if (change.getGamesPlayed() > 0) {
                participants.put(name, change);
            }
        });
        TournamentRecord record = TournamentRecord.of(info, participants.keySet(), results.games());
        List<Standing> standings = Standings.rank(record, participants);
        RatingReport report = new RatingReport(
                info,
                standings,
                TournamentSummary.of(participants.values(), results.games().size()),
                RatingHistogram.of(participants.values(), outputProperties.getHistogramBin()));

        // ============ WRITE ============

        Map<Path, String> outputs = new LinkedHashMap<>();
        outputs.put(reportFile, render(reportWriter, report));
        outputs.put(tableFile, render(tableWriter, report));
        if (listWriter != null) {
            outputs.put(listFile, render(listWriter, nextRatingList(extended, changes, info)));
        }
        if (resultWriter != null) {
            outputs.put(convertedFile, render(resultWriter, results));
        }
        List<Path> written = writeAll(outputDirectory, outputs);

        RunResult result = new RunResult(info, changes, results.games().size(), written);
        log.info(result.getMessage());
        return result;
    }

    // ============ HELPER METHODS ============

    private RatingList withoutByes(RatingList ratingList) {
        List<String> byes = ratingList.getPlayers().stream()
                .map(Player::getName)
                .filter(inputProperties::isBye)
                .toList();
        if (byes.isEmpty()) {
            return ratingList;
        }
        log.debug("Dropping bye entries {} from the rating list", byes);
        return ratingList.without(byes);
    }

    private static String render(ReportWriter writer, RatingReport report) {
        StringWriter out = new StringWriter();
        try {
            writer.write(report, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render " + writer.getClass().getSimpleName(), e);
        }
        return out.toString();
    }

    /**
     * The updated list: new ratings for those who played, and when a cutoff is
     * configured, only players active within that many days of the tournament.
     */
    private RatingList nextRatingList(RatingList ratingList, Map<String, RatingChange> changes, TournamentInfo info) {
        RatingList next = ratingList.afterTournament(changes, info.date());
        int inactiveAfterDays = outputProperties.getInactiveAfterDays();
        if (inactiveAfterDays <= 0) {
            return next;
        }
        RatingList active = next.activeSince(info.date().minusDays(inactiveAfterDays));
        log.info("Dropped {} players idle for more than {} days from the rating list",
                next.size() - active.size(), inactiveAfterDays);
        return active;
    }

    private static String render(RatingListWriter writer, RatingList ratingList) {
        StringWriter out = new StringWriter();
        try {
            writer.write(ratingList, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render the updated rating list", e);
        }
        return out.toString();
    }

    private static String render(ResultWriter writer, TournamentResults results) {
        StringWriter out = new StringWriter();
        try {
            writer.write(results, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render the converted results", e);
        }
        return out.toString();
    }

    /**
     * Stages every output in a temporary sibling, then moves them into place one
     * by one. Existing targets are first moved aside to a backup. On failure every
     * target moved so far is removed and its backup restored.
     */
    private List<Path> writeAll(Path outputDirectory, Map<Path, String> outputs) {
        Map<Path, Path> staged = new LinkedHashMap<>();
        Map<Path, Path> backups = new LinkedHashMap<>();
        List<Path> committed = new ArrayList<>();
        boolean done = false;
        try {
            Files.createDirectories(outputDirectory);
            for (Map.Entry<Path, String> output : outputs.entrySet()) {
                Path target = output.getKey();
                Path temp = Files.createTempFile(outputDirectory, "." + target.getFileName(), ".tmp");
                staged.put(target, temp);
                Files.writeString(temp, output.getValue(), inputProperties.getEncoding());
            }
            for (Map.Entry<Path, Path> entry : staged.entrySet()) {
                Path target = entry.getKey();
                if (Files.isRegularFile(target)) {
                    Path backup = Files.createTempFile(outputDirectory, "." + target.getFileName(), ".bak");
                    move(target, backup);
                    backups.put(target, backup);
                }
                move(entry.getValue(), target);
                committed.add(target);
            }
            done = true;
            committed.forEach(target -> log.info("Wrote {}", target));
            return committed;
        } catch (IOException e) {
            UncheckedIOException failure = new UncheckedIOException("Failed to write outputs to " + outputDirectory, e);
            rollBack(committed, backups, failure);
            throw failure;
        } finally {
            staged.values().forEach(RatingRunService::deleteQuietly);
            if (done) {
                backups.values().forEach(RatingRunService::deleteQuietly);
            }
        }
    }

    /**
     * Undoes a partial commit. A backup that cannot be restored is left in place and logged.
     */
    private static void rollBack(List<Path> committed, Map<Path, Path> backups, Exception failure) {
        for (Path target : committed) {
            try {
                Files.deleteIfExists(target);
            } catch (IOException e) {
                failure.addSuppressed(e);
            }
        }
        for (Map.Entry<Path, Path> backup : backups.entrySet()) {
            try {
                move(backup.getValue(), backup.getKey());
            } catch (IOException e) {
                log.error("Could not restore {} from {}", backup.getKey(), backup.getValue(), e);
                failure.addSuppressed(e);
            }
        }
        log.warn("Rolled back {} written outputs", committed.size());
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }

    private static void requireFile(Path file, String what) {
        if (file == null) {
            throw new ConfigException(what + " is required");
        }
        if (!Files.isRegularFile(file)) {
            throw new ConfigException(what + " not found: " + file);
        }
    }

    private static void requireTournamentInfo(RunRequest request) {
        if (request.tournamentName() == null || request.tournamentName().isBlank()) {
            throw new ConfigException("A tournament name is required for " + request.resultsFile() + " (use --name)");
        }
        if (request.tournamentDate() == null) {
            throw new ConfigException("A tournament date is required for " + request.resultsFile() + " (use --date)");
        }
    }
}
