package com.scorebook.core.normalize;

import com.scorebook.core.model.Base;

/**
 * Un movimiento detallado: {@code name} avanza a {@code base}, o es out ahí si {@code out}.
 */
record RunnerClause(String name, Base base, boolean out, boolean onMisplay) {

    RunnerClause withMisplay() { return new RunnerClause(name, base, out, true); }
}
