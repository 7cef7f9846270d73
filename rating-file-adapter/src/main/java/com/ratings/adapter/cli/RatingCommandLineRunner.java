package com.ratings.adapter.cli;

import com.ratings.adapter.exception.ConfigException;
import com.ratings.adapter.service.RatingRunService;
import com.ratings.adapter.service.RunRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Command-line entry point:
 * <pre>
 * --ratings=rating.dat --results=event.tou [--name="Club Open"] [--date=2020-05-25] [--output-dir=out]
 * </pre>
 */
@Component
@ConditionalOnProperty(prefix = "rating.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RatingCommandLineRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RatingCommandLineRunner.class);

    static final String USAGE = "Usage: --ratings=<rating list> --results=<result file> "
            + "[--name=<tournament name>] [--date=<yyyy-MM-dd>] [--output-dir=<dir>]";

    private final RatingRunService runService;

    public RatingCommandLineRunner(RatingRunService runService) {
        this.runService = runService;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunRequest request = toRequest(args);
        log.info("Rating {} against {}", request.resultsFile(), request.ratingsFile());
        runService.run(request);
    }

    static RunRequest toRequest(ApplicationArguments args) {
        String ratings = required(args, "ratings");
        String results = required(args, "results");
        String name = optional(args, "name");
        String date = optional(args, "date");
        String outputDir = optional(args, "output-dir");

        return new RunRequest(
                Path.of(ratings),
                Path.of(results),
                name,
                date != null ? parseDate(date) : null,
                outputDir != null ? Path.of(outputDir) : null);
    }

    private static String required(ApplicationArguments args, String option) {
        String value = optional(args, option);
        if (value == null) {
            throw new ConfigException("Missing --" + option + ". " + USAGE);
        }
        return value;
    }

    private static String optional(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static LocalDate parseDate(String date) {
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new ConfigException("Invalid --date '" + date + "', expected yyyy-MM-dd", e);
        }
    }
}
