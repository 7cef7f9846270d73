package com.ratings.adapter.format;

import com.ratings.engine.model.TournamentResults;

import java.io.IOException;
import java.io.Writer;
import java.util.Set;

/**
 * Writes tournament results, used to convert one result format into another.
 */
public interface ResultWriter {

    /**
     * Lower-case file extensions handled, without the dot.
     */
    Set<String> extensions();

    void write(TournamentResults results, Writer out) throws IOException;
}
