package com.ratings.engine.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Games of a tournament grouped per player.
 */
public final class TournamentRecord {

    private final TournamentInfo info;
    private final Map<String, PlayerRecord> records;

    private TournamentRecord(TournamentInfo info, Map<String, PlayerRecord> records) {
        this.info = info;
        this.records = Collections.unmodifiableMap(records);
    }

    /**
     * Group games per player. Every name in {@code players} gets a record, even with no games.
     */
    public static TournamentRecord of(TournamentInfo info, Collection<String> players, List<GameResult> games) {
        Map<String, List<GameResult>> byPlayer = new LinkedHashMap<>();
        for (String name : players) {
            byPlayer.put(name, new ArrayList<>());
        }
        for (GameResult game : games) {
            byPlayer.computeIfAbsent(game.playerA(), k -> new ArrayList<>()).add(game);
            byPlayer.computeIfAbsent(game.playerB(), k -> new ArrayList<>()).add(game);
        }

        Map<String, PlayerRecord> records = new LinkedHashMap<>();
        byPlayer.forEach((name, playerGames) -> records.put(name, new PlayerRecord(name, playerGames)));
        return new TournamentRecord(info, records);
    }

    public TournamentInfo getInfo() { return info; }

    public Map<String, PlayerRecord> getRecords() { return records; }

    public PlayerRecord get(String name) {
        PlayerRecord record = records.get(name);
        return record != null ? record : new PlayerRecord(name, List.of());
    }
}
