package com.ratings.engine.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prior rating list in file order. Duplicate names are kept as read so that
 * validation can report them; {@link #asMap()} keeps the first entry of each name.
 */
public final class RatingList {

    private final List<Player> players;

    public RatingList(List<Player> players) {
        this.players = List.copyOf(players);
    }

    public List<Player> getPlayers() {
        return players;
    }

    public int size() {
        return players.size();
    }

    /**
     * Players keyed by name, in list order.
     */
    public Map<String, Player> asMap() {
        Map<String, Player> byName = new LinkedHashMap<>();
        for (Player player : players) {
            byName.putIfAbsent(player.getName(), player);
        }
        return Collections.unmodifiableMap(byName);
    }

    /**
     * A new list with an unrated entry appended for every name not already on this list.
     */
    public RatingList withUnratedEntrants(Collection<String> names) {
        List<Player> extended = new ArrayList<>(players);
        Map<String, Player> known = asMap();
        for (String name : names) {
            if (!known.containsKey(name) && extended.stream().noneMatch(p -> p.getName().equals(name))) {
                extended.add(Player.unrated(name));
            }
        }
        return new RatingList(extended);
    }

    /**
     * A new list without the given names.
     */
    public RatingList without(Collection<String> names) {
        return new RatingList(players.stream().filter(p -> !names.contains(p.getName())).toList());
    }

    /**
     * The list for the next tournament: players who played carry their new rating,
     * lifetime games and the tournament date; everyone else is unchanged. Sorted by
     * rating, highest first, with unrated players last. Own rating floors are kept.
     *
     * @param changes rating changes keyed by player name
     * @param played  tournament date
     */
    public RatingList afterTournament(Map<String, RatingChange> changes, LocalDate played) {
        List<Player> next = new ArrayList<>();
        for (Player player : asMap().values()) {
            RatingChange change = changes.get(player.getName());
            if (change == null || change.getGamesPlayed() == 0) {
                next.add(player);
                continue;
            }
            next.add(Player.builder()
                    .name(player.getName())
                    .priorRating(change.getNewRating())
                    .gamesPlayedLifetime(change.getLifetimeGames())
                    .ratingFloor(player.getRatingFloor())
                    .lastPlayed(played)
                    .build());
        }
        next.sort(Comparator
                .comparing(Player::getPriorRating, Comparator.nullsLast(Comparator.reverseOrder()))
                .thenComparing(Player::getName));
        return new RatingList(next);
    }

    /**
     * A new list without players whose last game was before {@code cutoff}.
     * Players with no recorded last game count as inactive.
     */
    public RatingList activeSince(LocalDate cutoff) {
        return new RatingList(players.stream()
                .filter(p -> p.getLastPlayed() != null && !p.getLastPlayed().isBefore(cutoff))
                .toList());
    }
}
