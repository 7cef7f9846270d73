package com.ratings.adapter.format;

import com.ratings.adapter.exception.FormatException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Picks the reader or writer for a file by its extension.
 */
@Component
public class FormatRegistry {

    private final Map<String, RatingListReader> ratingListReaders;
    private final Map<String, ResultReader> resultReaders;
    private final Map<String, ReportWriter> reportWriters;
    private final Map<String, RatingListWriter> ratingListWriters;
    private final Map<String, ResultWriter> resultWriters;

    public FormatRegistry(
            List<RatingListReader> ratingListReaders,
            List<ResultReader> resultReaders,
            List<ReportWriter> reportWriters,
            List<RatingListWriter> ratingListWriters,
            List<ResultWriter> resultWriters
    ) {
        this.ratingListReaders = index(ratingListReaders, RatingListReader::extensions);
        this.resultReaders = index(resultReaders, ResultReader::extensions);
        this.reportWriters = index(reportWriters, ReportWriter::extensions);
        this.ratingListWriters = index(ratingListWriters, RatingListWriter::extensions);
        this.resultWriters = index(resultWriters, ResultWriter::extensions);
    }

    public RatingListReader ratingListReaderFor(Path file) {
        return lookup(ratingListReaders, file, "rating list");
    }

    public ResultReader resultReaderFor(Path file) {
        return lookup(resultReaders, file, "result");
    }

    public ReportWriter reportWriterFor(Path file) {
        return lookup(reportWriters, file, "output");
    }

    public RatingListWriter ratingListWriterFor(Path file) {
        return lookup(ratingListWriters, file, "rating list output");
    }

    public ResultWriter resultWriterFor(Path file) {
        return lookup(resultWriters, file, "result output");
    }

    /**
     * Lower-case extension without the dot, or an empty string when there is none.
     */
    public static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static <T> T lookup(Map<String, T> formats, Path file, String kind) {
        T format = formats.get(extensionOf(file));
        if (format == null) {
            throw new FormatException(String.format("Unsupported %s format '.%s' (supported: %s)",
                    kind, extensionOf(file), formats.keySet()), file);
        }
        return format;
    }

    private static <T> Map<String, T> index(List<T> formats, Function<T, Set<String>> extensions) {
        Map<String, T> byExtension = new TreeMap<>();
        for (T format : formats) {
            for (String extension : extensions.apply(format)) {
                T previous = byExtension.put(extension.toLowerCase(Locale.ROOT), format);
                if (previous != null) {
                    throw new IllegalStateException(String.format("Extension .%s claimed by both %s and %s",
                            extension, previous.getClass().getSimpleName(), format.getClass().getSimpleName()));
                }
            }
        }
        return Collections.unmodifiableMap(byExtension);
    }
}
