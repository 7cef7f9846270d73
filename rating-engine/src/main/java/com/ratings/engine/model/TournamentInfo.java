package com.ratings.engine.model;

import java.time.LocalDate;

/**
 * Tournament name and date. Used for output provenance only.
 */
public record TournamentInfo(String name, LocalDate date) {
}
