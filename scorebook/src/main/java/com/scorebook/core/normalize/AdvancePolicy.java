package com.scorebook.core.normalize;

/** Movimiento por defecto de corredores cuando la descripción no los detalla. */
public enum AdvancePolicy {
    HOLD,
    FORCED,
    PLUS_ONE,
    PLUS_TWO,
    SCORE_ALL,
    SAC_FLY,            // anota el de tercera, el resto se queda
    FORCE_OUT_LEAD,     // out al corredor forzado de punta, el resto avanza
    DOUBLE_PLAY,        // out al de primera (o al de punta)
    LINE_DOUBLE_PLAY,   // doblado el corredor de punta
    TRIPLE_PLAY,        // out a los dos corredores de atrás
    STEAL,              // el de punta toma la base siguiente
    CAUGHT_STEALING     // out al corredor de punta
}
