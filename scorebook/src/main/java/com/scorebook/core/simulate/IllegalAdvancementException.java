package com.scorebook.core.simulate;

import com.scorebook.core.model.AnomalyKind;
import com.scorebook.core.model.ScorebookException;

import java.util.List;

/**
 * El evento resuelto mueve un corredor hacia atrás o a una base ocupada, o nombra a alguien que no está en base.
 * {@link #bestEffort()} es el estado con el que el simulador sigue.
 */
public class IllegalAdvancementException extends ScorebookException {
    private final List<String> violations;
    private final AdvanceResult bestEffort;

    public IllegalAdvancementException(List<String> violations, AdvanceResult bestEffort) {
        super(AnomalyKind.ILLEGAL_ADVANCEMENT, String.join("; ", violations));
        this.violations = List.copyOf(violations);
        this.bestEffort = bestEffort;
    }

    public List<String> violations() { return violations; }

    public AdvanceResult bestEffort() { return bestEffort; }
}
