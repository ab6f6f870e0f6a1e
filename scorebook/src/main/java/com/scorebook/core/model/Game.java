package com.scorebook.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Partido reconstruido que se entrega al render: entradas, box score, resultado final y cada
 * anomalía de la que se recuperó el pipeline.
 */
public record Game(
        GameMetadata metadata,
        List<Inning> innings,
        BoxScore boxScore,
        FinalScore finalScore,
        List<Anomaly> anomalies
) {
    public Game {
        innings = List.copyOf(innings);
        anomalies = List.copyOf(anomalies);
    }

    public List<HalfInning> halfInnings() {
        List<HalfInning> out = new ArrayList<>();
        for (Inning i : innings) {
            out.add(i.top());
            if (i.bottom() != null) out.add(i.bottom());
        }
        return out;
    }

    public List<PlateAppearanceRecord> plays() {
        List<PlateAppearanceRecord> out = new ArrayList<>();
        for (HalfInning h : halfInnings()) out.addAll(h.plays());
        return out;
    }

    public List<PlateAppearanceRecord> keyPlays() {
        return plays().stream().filter(PlateAppearanceRecord::keyPlay).toList();
    }
}
