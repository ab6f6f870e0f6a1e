package com.scorebook.core.model;

import java.util.Objects;

/**
 * Dónde termina un corredor tras la jugada. {@code to} es null si lo sacan out;
 * {@code to == from} significa que se quedó.
 */
public record RunnerAdvance(String runnerId, Base from, Base to, boolean onMisplay) {

    public RunnerAdvance {
        Objects.requireNonNull(runnerId, "runnerId");
        Objects.requireNonNull(from, "from");
    }

    public static RunnerAdvance hold(Runner r) { return new RunnerAdvance(r.playerId(), r.base(), r.base(), false); }

    public static RunnerAdvance to(Runner r, Base to, boolean onMisplay) {
        return new RunnerAdvance(r.playerId(), r.base(), to, onMisplay);
    }

    public static RunnerAdvance out(Runner r) { return new RunnerAdvance(r.playerId(), r.base(), null, false); }

    public boolean out() { return to == null; }

    public boolean scores() { return to == Base.HOME; }

    public boolean held() { return to == from; }
}
