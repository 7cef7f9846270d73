package com.ratings.adapter.format;

import java.io.IOException;
import java.io.Writer;
import java.util.Set;

/**
 * Renders the rated tournament into one output format.
 */
public interface ReportWriter {

    /**
     * Lower-case file extensions handled, without the dot.
     */
    Set<String> extensions();

    void write(RatingReport report, Writer out) throws IOException;
}
