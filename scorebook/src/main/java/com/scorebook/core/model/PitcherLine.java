package com.scorebook.core.model;

public record PitcherLine(
        String pitcherId,
        String name,
        String team,
        int battersFaced,
        int outs,
        int pitches,
        int hits,
        int walks,
        int strikeouts,
        int runs,
        int earnedRuns
) {
    /** Entradas lanzadas como en la planilla: 17 outs = "5.2". */
    public String inningsPitched() { return outs / 3 + "." + outs % 3; }
}
