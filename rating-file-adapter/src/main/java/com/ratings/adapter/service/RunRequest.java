package com.ratings.adapter.service;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Input files and tournament details for one rating run.
 *
 * @param ratingsFile     prior rating list
 * @param resultsFile     tournament results
 * @param tournamentName  required when the result format does not name the tournament, else optional
 * @param tournamentDate  required when the result format does not date the tournament, else optional
 * @param outputDirectory where outputs go; null for the configured directory
 */
public record RunRequest(
        Path ratingsFile,
        Path resultsFile,
        String tournamentName,
        LocalDate tournamentDate,
        Path outputDirectory
) {
}
