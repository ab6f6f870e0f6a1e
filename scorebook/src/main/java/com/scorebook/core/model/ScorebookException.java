package com.scorebook.core.model;

/** Base de todas las fallas que reporta el pipeline; cada una mapea a un {@link AnomalyKind}. */
public abstract class ScorebookException extends RuntimeException {
    private final AnomalyKind kind;

    protected ScorebookException(AnomalyKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AnomalyKind kind() { return kind; }
}
