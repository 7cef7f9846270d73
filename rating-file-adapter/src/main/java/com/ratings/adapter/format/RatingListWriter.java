package com.ratings.adapter.format;

import com.ratings.engine.model.RatingList;

import java.io.IOException;
import java.io.Writer;
import java.util.Set;

/**
 * Writes a rating list in a format the matching {@link RatingListReader} reads back.
 */
public interface RatingListWriter {

    /**
     * Lower-case file extensions handled, without the dot.
     */
    Set<String> extensions();

    void write(RatingList ratingList, Writer out) throws IOException;
}
