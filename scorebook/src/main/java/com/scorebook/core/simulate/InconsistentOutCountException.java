package com.scorebook.core.simulate;

import com.scorebook.core.model.AnomalyKind;
import com.scorebook.core.model.ScorebookException;

/** La media entrada pasaría de tres outs; se topea en {@link #cappedOuts()}. */
public class InconsistentOutCountException extends ScorebookException {
    private final int attemptedOuts;

    public InconsistentOutCountException(int outsBefore, int recorded) {
        super(AnomalyKind.INCONSISTENT_OUT_COUNT,
                "Play records " + recorded + " out(s) with " + outsBefore + " already recorded");
        this.attemptedOuts = outsBefore + recorded;
    }

    public int attemptedOuts() { return attemptedOuts; }

    public int cappedOuts() { return BaseStateSimulator.MAX_OUTS; }
}
