package com.scorebook.core.model;

public record FinalScore(String awayTeam, int awayRuns, String homeTeam, int homeRuns) {
    /** Null si hay empate. */
    public String winner() {
        if (awayRuns == homeRuns) return null;
        return awayRuns > homeRuns ? awayTeam : homeTeam;
    }
}
