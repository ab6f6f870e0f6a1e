package com.scorebook.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Una jugada tal como llega del lado de adquisición. Probabilidades de victoria del local, 0..1,
 * null si el feed no las trae.
 */
public record RawPlay(
        int inning,
        Half half,
        String batterId,
        String batterName,
        String pitcherId,
        String pitcherName,
        String description,
        List<PitchCall> pitches,
        int runsScored,
        int outsRecorded,
        Double winProbabilityBefore,
        Double winProbabilityAfter
) {
    public RawPlay {
        if (inning < 1) throw new IllegalArgumentException("inning must be >= 1: " + inning);
        Objects.requireNonNull(half, "half");
        Objects.requireNonNull(batterId, "batterId");
        Objects.requireNonNull(pitcherId, "pitcherId");
        if (runsScored < 0 || outsRecorded < 0) throw new IllegalArgumentException("negative runs/outs");
        if (batterName == null) batterName = batterId;
        if (pitcherName == null) pitcherName = pitcherId;
        if (description == null) description = "";
        pitches = pitches == null ? List.of() : List.copyOf(pitches);
    }

    /** Ctor corto para jugadas sin lanzamientos ni probabilidades. */
    public RawPlay(int inning, Half half, String batterId, String batterName, String pitcherId, String description) {
        this(inning, half, batterId, batterName, pitcherId, null, description, List.of(), 0, 0, null, null);
    }

    public String label() { return half.label() + inning; }
}
