package com.scorebook.core.model;

/** Algo de lo que el pipeline se recuperó; {@code playIndex} es -1 si aplica a toda la media entrada. */
public record Anomaly(
        AnomalyKind kind,
        int inning,
        Half half,
        int playIndex,
        String description,
        String message,
        String recovery
) {
    public String location() { return half.label() + inning + (playIndex >= 0 ? "#" + playIndex : ""); }
}
