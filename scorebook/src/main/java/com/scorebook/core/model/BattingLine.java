package com.scorebook.core.model;

import java.util.List;

/** Fila de la planilla: totales más la notación de cada turno, p.ej. "3:1B". */
public record BattingLine(
        String batterId,
        String name,
        String team,
        int plateAppearances,
        int hits,
        int walks,
        int strikeouts,
        int rbi,
        List<String> notations
) {
    public BattingLine {
        notations = List.copyOf(notations);
    }
}
