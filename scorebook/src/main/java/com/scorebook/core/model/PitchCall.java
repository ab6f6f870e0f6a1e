package com.scorebook.core.model;

import java.util.ArrayList;
import java.util.List;

public enum PitchCall {
    BALL('B'),
    STRIKE('S'),
    FOUL('F'),
    IN_PLAY('X');

    private final char code;

    PitchCall(char code) { this.code = code; }

    public char code() { return code; }

    public static PitchCall fromCode(char c) {
        return switch (Character.toUpperCase(c)) {
            case 'B', 'I', 'P', 'V' -> BALL;       // bola, intencional, pitchout, bola automática
            case 'S', 'C', 'K', 'W', 'M', 'Q' -> STRIKE;
            case 'F', 'T', 'L', 'R' -> FOUL;
            case 'X', 'H' -> IN_PLAY;              // golpeado: cierra la secuencia como pelota en juego
            default -> throw new IllegalArgumentException("Unknown pitch code: " + c);
        };
    }

    /** Parsea una secuencia compacta tipo {@code "BSFBX"}. Ignora separadores y blancos. */
    public static List<PitchCall> parseSequence(String codes) {
        List<PitchCall> out = new ArrayList<>();
        if (codes == null) return out;
        for (char c : codes.toCharArray()) {
            if (Character.isLetter(c)) out.add(fromCode(c));
        }
        return out;
    }
}
