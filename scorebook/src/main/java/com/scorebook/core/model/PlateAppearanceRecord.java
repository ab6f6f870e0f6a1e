package com.scorebook.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Una jugada resuelta del timeline. Los eventos entre lanzamientos (robos, wild pitch) se registran igual;
 * {@link PlayEvent#endsPlateAppearance()} los distingue.
 */
public record PlateAppearanceRecord(
        int index,                     // posición en la lista de jugadas del partido
        int inning,
        Half half,
        String batterId,
        String batterName,
        String pitcherId,
        String pitcherName,
        List<PitchCall> pitches,
        PlayEvent event,
        BaseState before,
        BaseState after,
        int outsBefore,
        int outsAfter,
        List<ScoredRunner> scored,
        Double winProbabilityBefore,
        Double winProbabilityAfter,
        boolean keyPlay,
        boolean flagged
) {
    public PlateAppearanceRecord {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
        pitches = List.copyOf(pitches);
        scored = List.copyOf(scored);
    }

    public int runsScored() { return scored.size(); }

    public int outsRecorded() { return outsAfter - outsBefore; }

    /** Cuenta en la que se tiró el lanzamiento decisivo, p.ej. "3-2". */
    public String count() {
        int balls = 0, strikes = 0;
        for (PitchCall p : pitches.subList(0, Math.max(0, pitches.size() - 1))) {
            switch (p) {
                case BALL -> balls = Math.min(4, balls + 1);
                case STRIKE -> strikes = Math.min(3, strikes + 1);
                case FOUL -> strikes = strikes < 2 ? strikes + 1 : strikes;
                case IN_PLAY -> { }
            }
        }
        return balls + "-" + strikes;
    }
}
