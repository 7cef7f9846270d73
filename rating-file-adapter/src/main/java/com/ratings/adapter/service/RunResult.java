package com.ratings.adapter.service;

import com.ratings.engine.model.RatingChange;
import com.ratings.engine.model.TournamentInfo;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a successful rating run.
 */
public class RunResult {

    private final TournamentInfo info;
    private final Map<String, RatingChange> changes;
    private final int games;
    private final List<Path> writtenFiles;

    public RunResult(TournamentInfo info, Map<String, RatingChange> changes, int games, List<Path> writtenFiles) {
        this.info = info;
        this.changes = changes;
        this.games = games;
        this.writtenFiles = List.copyOf(writtenFiles);
    }

    public TournamentInfo getInfo() { return info; }

    /**
     * Every player on the rating list, keyed by name.
     */
    public Map<String, RatingChange> getChanges() { return changes; }

    public int getGames() { return games; }

    public List<Path> getWrittenFiles() { return writtenFiles; }

    public String getMessage() {
        return String.format("Rated %d games of '%s', wrote %d files", games, info.name(), writtenFiles.size());
    }
}
