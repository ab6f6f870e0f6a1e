package com.scorebook.core.model;

/** {@code bottom} es null si el local no necesitó batear. */
public record Inning(int number, HalfInning top, HalfInning bottom) {}
