package com.ratings.adapter.format;

import com.ratings.engine.model.TournamentInfo;
import com.ratings.engine.model.TournamentResults;

import java.nio.file.Path;
import java.util.Set;

/**
 * Reads a tournament result file into the canonical model.
 */
public interface ResultReader {

    /**
     * Lower-case file extensions handled, without the dot.
     */
    Set<String> extensions();

    /**
     * Whether the file itself names and dates the tournament. When it does not,
     * {@link #read} needs both supplied by the caller.
     */
    boolean carriesTournamentInfo();

    /**
     * @param supplied name and date given on the command line; either may be null
     */
    TournamentResults read(Path file, TournamentInfo supplied);
}
