package com.scorebook.core.model;

/** Corredor que anotó, y si el último avance fue por una falla defensiva. */
public record ScoredRunner(Runner runner, boolean onMisplay) {}
