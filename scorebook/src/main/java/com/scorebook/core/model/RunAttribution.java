package com.scorebook.core.model;

/**
 * Cómo se carga una carrera. {@code earned} es la clasificación del equipo; {@code earnedToPitcher} aplica la
 * regla del relevista: no se beneficia de outs que la defensa falló antes de que entrara.
 */
public record RunAttribution(
        String runnerId,
        String runnerName,
        String chargedPitcher,
        int playIndex,
        boolean earned,
        boolean earnedToPitcher,
        boolean ghost
) {}
