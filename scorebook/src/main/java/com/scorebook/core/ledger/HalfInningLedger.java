package com.scorebook.core.ledger;

import com.scorebook.core.model.RunAttribution;

import java.util.List;
import java.util.Map;

/**
 * Cuentas de carreras limpias de una media entrada. {@code ambiguities} lista reconstrucciones dudosas
 * (fallas superpuestas, un error que hubiera cerrado la entrada) para reportar.
 */
public record HalfInningLedger(
        List<RunAttribution> runs,
        int totalRuns,
        int earnedRuns,
        Map<String, Integer> earnedRunsByPitcher,
        Map<String, Integer> runsByPitcher,
        Map<String, List<String>> runnersByPitcher,
        List<String> ambiguities
) {
    public HalfInningLedger {
        runs = List.copyOf(runs);
        earnedRunsByPitcher = Map.copyOf(earnedRunsByPitcher);
        runsByPitcher = Map.copyOf(runsByPitcher);
        runnersByPitcher = Map.copyOf(runnersByPitcher);
        ambiguities = List.copyOf(ambiguities);
    }

    public int unearnedRuns() { return totalRuns - earnedRuns; }
}
