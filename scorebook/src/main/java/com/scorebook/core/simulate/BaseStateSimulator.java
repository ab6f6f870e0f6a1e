package com.scorebook.core.simulate;

import com.scorebook.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Aplica eventos resueltos a estados de bases. Sin estado; cada llamada devuelve valores nuevos.
 */
public class BaseStateSimulator {
    private static final Logger log = LoggerFactory.getLogger(BaseStateSimulator.class);

    public static final int MAX_OUTS = 3;

    private final int regulationInnings;

    public BaseStateSimulator(int regulationInnings) {
        if (regulationInnings < 1) throw new IllegalArgumentException("regulationInnings " + regulationInnings);
        this.regulationInnings = regulationInnings;
    }

    /**
     * Estado antes del primer turno de la media entrada. Pasadas las entradas reglamentarias, con bases vacías
     * se pone un corredor fantasma en segunda, a cargo del pitcher que abre la media entrada.
     */
    public BaseState openHalfInning(int inning, BaseState carried, String ghostId, String ghostName, String startingPitcher) {
        BaseState state = carried == null ? BaseState.empty() : carried;
        if (inning <= regulationInnings || !state.isEmpty()) return state;
        Runner ghost = Runner.ghost(ghostId, ghostName, startingPitcher);
        log.debug("Inning {}: placing ghost runner {} on second", inning, ghostId);
        return state.with(ghost);
    }

    /**
     * Mueve cada corredor a su destino, saca a los out y a los que anotan, y ubica al bateador.
     *
     * @throws IllegalAdvancementException si el evento no se puede aplicar tal cual; trae el resultado
     *         best-effort
     */
    public AdvanceResult advance(BaseState state, PlayEvent event, String pitcher) {
        List<String> violations = new ArrayList<>();
        Map<String, RunnerAdvance> byRunner = new HashMap<>();
        for (RunnerAdvance a : event.advances()) {
            Optional<Runner> on = state.find(a.runnerId());
            if (on.isEmpty()) {
                violations.add("runner " + a.runnerId() + " is not on base");
            } else if (on.get().base() != a.from()) {
                violations.add("runner " + a.runnerId() + " is on " + on.get().base() + ", not " + a.from());
            } else {
                byRunner.put(a.runnerId(), a);
            }
        }

        List<ScoredRunner> scored = new ArrayList<>();
        List<Runner> putOut = new ArrayList<>();
        BaseState next = BaseState.empty();

        // primero los de adelante: un corredor de atrás nunca desplaza al que va adelante
        for (Runner r : state.runnersLeadFirst()) {
            RunnerAdvance a = byRunner.get(r.playerId());
            if (a == null) a = RunnerAdvance.hold(r);
            if (a.out()) {
                putOut.add(r);
                continue;
            }
            Base to = a.to();
            if (to.number() < r.base().number()) {
                violations.add("runner " + r.playerId() + " moves backward from " + r.base() + " to " + to);
                to = r.base();
            }
            if (to == Base.HOME) {
                scored.add(new ScoredRunner(r, a.onMisplay()));
                continue;
            }
            if (next.occupied(to)) {
                violations.add("runner " + r.playerId() + " moves to occupied " + to);
                to = firstFreeFrom(next, to);
                if (to == Base.HOME) {
                    scored.add(new ScoredRunner(r, a.onMisplay()));
                    continue;
                }
            }
            next = next.with(r.at(to));
        }

        if (event.batterReaches()) {
            Runner batter = Runner.batter(event.batterId(), event.batterName(), pitcher,
                    Base.FIRST, event.batterOnMisplay());
            Base to = event.batterDestination();
            if (to == Base.HOME) {
                scored.add(new ScoredRunner(batter, event.batterOnMisplay()));
            } else {
                if (next.occupied(to)) {
                    violations.add("batter " + event.batterId() + " reaches occupied " + to);
                    to = firstFreeFrom(next, to);
                }
                if (to == Base.HOME) scored.add(new ScoredRunner(batter, event.batterOnMisplay()));
                else next = next.with(batter.at(to));
            }
        }

        int outs = putOut.size() + (event.batterOut() ? 1 : 0);
        AdvanceResult result = new AdvanceResult(next, scored, putOut, outs);
        if (!violations.isEmpty()) throw new IllegalAdvancementException(violations, result);
        return result;
    }

    /** @throws InconsistentOutCountException si la jugada pasa la media entrada de tres outs */
    public int recordOuts(int outsBefore, int recorded) {
        int total = outsBefore + recorded;
        if (total > MAX_OUTS) throw new InconsistentOutCountException(outsBefore, recorded);
        return total;
    }

    private static Base firstFreeFrom(BaseState s, Base from) {
        Base b = from;
        while (b != Base.HOME && s.occupied(b)) b = b.plus(1);
        return b;
    }
}
