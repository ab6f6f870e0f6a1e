package com.scorebook.core.model;

import java.util.Objects;

/**
 * Jugador en base. {@code responsiblePitcher} se fija cuando llega a base y no se reasigna nunca.
 */
public record Runner(
        String playerId,
        String name,
        String responsiblePitcher,
        Base base,
        boolean ghost,
        boolean reachedOnMisplay
) {
    public Runner {
        Objects.requireNonNull(playerId, "playerId");
        Objects.requireNonNull(responsiblePitcher, "responsiblePitcher");
        Objects.requireNonNull(base, "base");
        if (base == Base.HOME) throw new IllegalArgumentException("A runner cannot stand on home plate");
        if (name == null) name = playerId;
    }

    public static Runner batter(String playerId, String name, String pitcher, Base base, boolean onMisplay) {
        return new Runner(playerId, name, pitcher, base, false, onMisplay);
    }

    public static Runner ghost(String playerId, String name, String pitcher) {
        return new Runner(playerId, name, pitcher, Base.SECOND, true, false);
    }

    public Runner at(Base to) {
        return new Runner(playerId, name, responsiblePitcher, to, ghost, reachedOnMisplay);
    }

    /** Corredor fantasma o que llegó por error/interferencia: nunca genera carrera limpia. */
    public boolean unearnedByReach() { return ghost || reachedOnMisplay; }
}
