package com.scorebook.core.model;

import java.util.Locale;

/** Bases que puede ocupar un corredor, más HOME para el que anota. */
public enum Base {
    FIRST(1), SECOND(2), THIRD(3), HOME(4);

    private final int number;

    Base(int number) { this.number = number; }

    public int number() { return number; }

    /** Avanza {@code bases} bases, nunca más allá de HOME. */
    public Base plus(int bases) {
        return of(Math.min(HOME.number, number + bases));
    }

    public static Base of(int number) {
        return switch (number) {
            case 1 -> FIRST;
            case 2 -> SECOND;
            case 3 -> THIRD;
            case 4 -> HOME;
            default -> throw new IllegalArgumentException("No base numbered " + number);
        };
    }

    /** Acepta "1st", "2nd", "3rd", "home", "first", "second", "third", "FIRST"... */
    public static Base parse(String text) {
        String t = text.trim().toLowerCase(Locale.ROOT);
        return switch (t) {
            case "1st", "first", "1" -> FIRST;
            case "2nd", "second", "2" -> SECOND;
            case "3rd", "third", "3" -> THIRD;
            case "home", "home plate", "4" -> HOME;
            default -> throw new IllegalArgumentException("Unknown base: " + text);
        };
    }
}
