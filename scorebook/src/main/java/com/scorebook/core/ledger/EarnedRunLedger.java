package com.scorebook.core.ledger;

import com.scorebook.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Separa carreras limpias de sucias repitiendo la media entrada como si cada falla defensiva hubiera
 * sido un out.
 * <p>
 * Corren dos contadores contrafácticos de outs: uno del equipo, desde cero, y uno por pitcher, desde los
 * outs reales al momento de entrar. El relevista nunca se beneficia de outs que la defensa no hizo antes
 * de que entrara: una carrera puede ser sucia para el equipo y limpia para él.
 * <p>
 * La carrera es sucia si el corredor llegó por falla (error, interferencia del receptor, corredor fantasma),
 * si el último avance fue por falla, si el contador ya estaba en tres, o si el out fallado de la propia
 * jugada lleva el contador a tres. Se carga al pitcher responsable del corredor.
 */
public class EarnedRunLedger {
    private static final Logger log = LoggerFactory.getLogger(EarnedRunLedger.class);

    public HalfInningLedger attributeRuns(List<PlateAppearanceRecord> halfInning) {
        int teamOuts = 0;
        Map<String, Integer> pitcherOuts = new LinkedHashMap<>();
        Map<String, List<String>> runnersByPitcher = new LinkedHashMap<>();
        Map<String, Integer> earnedByPitcher = new LinkedHashMap<>();
        Map<String, Integer> runsByPitcher = new LinkedHashMap<>();
        List<RunAttribution> runs = new ArrayList<>();
        List<String> ambiguities = new ArrayList<>();

        int misplays = 0;
        boolean inningEndingMisplay = false;

        for (PlateAppearanceRecord pa : halfInning) {
            PlayEvent e = pa.event();
            pitcherOuts.putIfAbsent(pa.pitcherId(), pa.outsBefore());

            int realOuts = pa.outsRecorded();
            int wouldBeOuts = wouldBeOut(e) ? 1 : 0;
            boolean misplayOnPlay = wouldBeOuts > 0
                    || e.advances().stream().anyMatch(RunnerAdvance::onMisplay)
                    || (e.batterReaches() && e.batterOnMisplay());
            if (misplayOnPlay) misplays++;
            if (wouldBeOuts > 0 && teamOuts + realOuts + wouldBeOuts >= 3 && teamOuts < 3) {
                inningEndingMisplay = true;
            }

            for (ScoredRunner s : pa.scored()) {
                Runner r = s.runner();
                String charged = r.responsiblePitcher();
                int chargedOuts = pitcherOuts.getOrDefault(charged, teamOuts);
                boolean earned = isEarned(r, s.onMisplay(), teamOuts, realOuts, wouldBeOuts);
                boolean earnedToPitcher = isEarned(r, s.onMisplay(), chargedOuts, realOuts, wouldBeOuts);
                runs.add(new RunAttribution(r.playerId(), r.name(), charged, pa.index(), earned, earnedToPitcher, r.ghost()));
                runsByPitcher.merge(charged, 1, Integer::sum);
                earnedByPitcher.merge(charged, earnedToPitcher ? 1 : 0, Integer::sum);
            }

            // corredores que puso en base este pitcher, en orden; el bateador es suyo si llega y se queda
            if (e.batterReaches() && e.batterDestination() != Base.HOME) {
                runnersByPitcher.computeIfAbsent(pa.pitcherId(), k -> new ArrayList<>()).add(e.batterId());
            }

            teamOuts += realOuts + wouldBeOuts;
            for (var en : pitcherOuts.entrySet()) en.setValue(en.getValue() + realOuts + wouldBeOuts);
        }

        // el fantasma es del pitcher que abrió la media entrada
        if (!halfInning.isEmpty()) {
            for (Runner g : halfInning.get(0).before().runners()) {
                if (!g.ghost()) continue;
                List<String> list = runnersByPitcher.computeIfAbsent(g.responsiblePitcher(), k -> new ArrayList<>());
                list.add(0, g.playerId());
            }
        }

        int earned = (int) runs.stream().filter(RunAttribution::earned).count();
        if (!runs.isEmpty() && misplays > 1) {
            ambiguities.add(misplays + " misplays in one half-inning; earned runs follow the order they occurred");
        }
        if (!runs.isEmpty() && inningEndingMisplay) {
            ambiguities.add("a misplay would have ended the inning; later runs are unearned");
        }
        if (!ambiguities.isEmpty()) log.debug("Earned-run ambiguities: {}", ambiguities);

        return new HalfInningLedger(runs, runs.size(), earned, earnedByPitcher, runsByPitcher, runnersByPitcher, ambiguities);
    }

    /** El bateador llegó a base sólo porque la defensa falló un out (error, interferencia, passed ball en el tercer strike). */
    private static boolean wouldBeOut(PlayEvent e) {
        if (!e.batterReaches()) return false;
        return e.kind().reachesOnMisplay() || (e.kind().retiresBatter() && e.batterOnMisplay());
    }

    private static boolean isEarned(Runner r, boolean scoredOnMisplay, int outsBefore, int realOuts, int wouldBeOuts) {
        if (r.unearnedByReach() || scoredOnMisplay) return false;
        if (outsBefore >= 3) return false;
        return !(wouldBeOuts > 0 && outsBefore + realOuts + wouldBeOuts >= 3);
    }
}
