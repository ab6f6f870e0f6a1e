package com.scorebook.core.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Pasa intacto al partido armado. */
public record GameMetadata(
        String gameId,
        LocalDate date,
        String awayTeam,
        String homeTeam,
        String venue,
        String weather,
        Integer attendance,
        Map<String, List<String>> startingLineups,
        Map<String, String> startingPitchers
) {
    public GameMetadata {
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(awayTeam, "awayTeam");
        Objects.requireNonNull(homeTeam, "homeTeam");
        startingLineups = startingLineups == null ? Map.of() : Map.copyOf(startingLineups);
        startingPitchers = startingPitchers == null ? Map.of() : Map.copyOf(startingPitchers);
    }

    public static GameMetadata of(String gameId, String awayTeam, String homeTeam) {
        return new GameMetadata(gameId, null, awayTeam, homeTeam, null, null, null, null, null);
    }

    public String battingTeam(Half half) { return half == Half.TOP ? awayTeam : homeTeam; }

    public String fieldingTeam(Half half) { return half == Half.TOP ? homeTeam : awayTeam; }
}
