package com.scorebook.core.simulate;

import com.scorebook.core.model.BaseState;
import com.scorebook.core.model.Runner;
import com.scorebook.core.model.ScoredRunner;

import java.util.List;

/** Resultado de aplicar un evento a un estado de bases. */
public record AdvanceResult(BaseState state, List<ScoredRunner> scored, List<Runner> putOut, int outs) {
    public AdvanceResult {
        scored = List.copyOf(scored);
        putOut = List.copyOf(putOut);
    }

    public int runs() { return scored.size(); }
}
