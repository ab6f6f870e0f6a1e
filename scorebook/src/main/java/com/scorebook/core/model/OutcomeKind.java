package com.scorebook.core.model;

import java.util.EnumSet;
import java.util.Set;

/** Resultado canónico de una descripción de jugada. */
public enum OutcomeKind {
    STRIKEOUT,
    WALK,
    HIT_BY_PITCH,
    SINGLE,
    DOUBLE,
    TRIPLE,
    HOME_RUN,
    GROUND_OUT,
    FLY_OUT,
    FIELDERS_CHOICE,
    DOUBLE_PLAY,
    TRIPLE_PLAY,
    SACRIFICE_FLY,
    SACRIFICE_BUNT,
    ERROR,
    CATCHER_INTERFERENCE,
    STOLEN_BASE,
    CAUGHT_STEALING,
    WILD_PITCH,
    PASSED_BALL,
    BALK,
    GENERIC_OUT;

    private static final Set<OutcomeKind> HITS = EnumSet.of(SINGLE, DOUBLE, TRIPLE, HOME_RUN);
    private static final Set<OutcomeKind> RETIRES_BATTER =
            EnumSet.of(STRIKEOUT, GROUND_OUT, FLY_OUT, SACRIFICE_FLY, SACRIFICE_BUNT, GENERIC_OUT);
    private static final Set<OutcomeKind> BETWEEN_PITCHES =
            EnumSet.of(STOLEN_BASE, CAUGHT_STEALING, WILD_PITCH, PASSED_BALL, BALK);

    public boolean isHit() { return HITS.contains(this); }

    /** False para eventos con el bateador todavía en el plato. */
    public boolean endsPlateAppearance() { return !BETWEEN_PITCHES.contains(this); }

    /** El bateador llegó sólo por una falla defensiva. */
    public boolean reachesOnMisplay() { return this == ERROR || this == CATCHER_INTERFERENCE; }

    /** Resultados que sacan out al bateador salvo falla defensiva (tercer strike caído, tiro errado). */
    public boolean retiresBatter() { return RETIRES_BATTER.contains(this); }

    public boolean isWalk() { return this == WALK; }
}
