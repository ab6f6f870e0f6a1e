package com.scorebook.core.model;

import java.util.List;

/** Una fila del linescore. */
public record TeamLine(String team, List<Integer> runsByInning, int runs, int hits, int errors, int leftOnBase) {
    public TeamLine {
        runsByInning = List.copyOf(runsByInning);
    }
}
