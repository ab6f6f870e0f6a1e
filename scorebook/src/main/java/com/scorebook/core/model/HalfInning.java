package com.scorebook.core.model;

import java.util.List;
import java.util.Map;

public record HalfInning(
        int inning,
        Half half,
        String battingTeam,
        String fieldingTeam,
        BaseState startState,
        List<PlateAppearanceRecord> plays,
        int outs,
        int runs,
        int earnedRuns,
        int hits,
        int errors,
        int leftOnBase,
        List<RunAttribution> attributions,
        Map<String, Integer> earnedRunsByPitcher,
        Map<String, List<String>> runnersByPitcher    // pitcher -> corredores que puso en base, en orden
) {
    public HalfInning {
        plays = List.copyOf(plays);
        attributions = List.copyOf(attributions);
        earnedRunsByPitcher = Map.copyOf(earnedRunsByPitcher);
        runnersByPitcher = Map.copyOf(runnersByPitcher);
    }

    public int unearnedRuns() { return runs - earnedRuns; }

    public boolean startedWithGhost() { return startState.hasGhost(); }

    public String label() { return half.label() + inning; }
}
