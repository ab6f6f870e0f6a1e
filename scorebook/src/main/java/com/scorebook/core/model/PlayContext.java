package com.scorebook.core.model;

import java.util.Objects;

/** Situación contra la que se resuelve una jugada. */
public record PlayContext(int outsBefore, BaseState baseState) {
    public PlayContext {
        if (outsBefore < 0 || outsBefore > 3) throw new IllegalArgumentException("outsBefore " + outsBefore);
        Objects.requireNonNull(baseState, "baseState");
    }

    public static PlayContext start() { return new PlayContext(0, BaseState.empty()); }
}
