package com.scorebook.core.assemble;

import com.scorebook.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Arma el {@link Game} a partir de las medias entradas terminadas: entradas, linescore, líneas de pitchers y
 * bateadores, resultado final. También el último chequeo estructural: toda media entrada salvo un walk-off
 * termina con tres outs.
 */
public class TimelineAssembler {
    private static final Logger log = LoggerFactory.getLogger(TimelineAssembler.class);

    private final int regulationInnings;

    public TimelineAssembler(int regulationInnings) {
        this.regulationInnings = regulationInnings;
    }

    public Game assemble(GameMetadata metadata, List<HalfInning> halves, List<Anomaly> anomalies) {
        validate(metadata, halves);

        List<Inning> innings = new ArrayList<>();
        for (int i = 0; i < halves.size(); i += 2) {
            HalfInning top = halves.get(i);
            HalfInning bottom = i + 1 < halves.size() ? halves.get(i + 1) : null;
            innings.add(new Inning(top.inning(), top, bottom));
        }

        TeamLine away = teamLine(metadata.awayTeam(), Half.TOP, halves);
        TeamLine home = teamLine(metadata.homeTeam(), Half.BOTTOM, halves);
        BoxScore box = new BoxScore(away, home, pitcherLines(halves), battingLines(halves));
        FinalScore score = new FinalScore(metadata.awayTeam(), away.runs(), metadata.homeTeam(), home.runs());

        log.info("Game {} assembled: {} {} - {} {} over {} innings, {} anomalies",
                metadata.gameId(), metadata.awayTeam(), away.runs(), metadata.homeTeam(), home.runs(),
                innings.size(), anomalies.size());
        return new Game(metadata, innings, box, score, anomalies);
    }

    // ===== Validación =====

    private void validate(GameMetadata metadata, List<HalfInning> halves) {
        String id = metadata.gameId();
        if (halves.isEmpty()) throw new IncompleteGameDataException(id, "no plays");

        for (int i = 0; i < halves.size(); i++) {
            HalfInning h = halves.get(i);
            int inning = i / 2 + 1;
            Half half = i % 2 == 0 ? Half.TOP : Half.BOTTOM;
            if (h.inning() != inning || h.half() != half) {
                throw new IncompleteGameDataException(id, "expected " + half.label() + inning + " but found " + h.label());
            }
        }

        for (int i = 0; i < halves.size() - 1; i++) {
            HalfInning h = halves.get(i);
            if (h.outs() < 3) {
                throw new IncompleteGameDataException(id, h.label() + " ends with " + h.outs() + " out(s)");
            }
        }

        HalfInning last = halves.get(halves.size() - 1);
        if (last.outs() < 3) {
            int awayRuns = 0, homeRuns = 0;
            for (HalfInning h : halves) {
                if (h.half() == Half.TOP) awayRuns += h.runs(); else homeRuns += h.runs();
            }
            boolean walkOff = last.half() == Half.BOTTOM && last.inning() >= regulationInnings && homeRuns > awayRuns;
            if (!walkOff) {
                throw new IncompleteGameDataException(id,
                        "final half-inning " + last.label() + " ends with " + last.outs() + " out(s) and no walk-off");
            }
        }
    }

    // ===== Box score =====

    private static TeamLine teamLine(String team, Half batting, List<HalfInning> halves) {
        List<Integer> byInning = new ArrayList<>();
        int runs = 0, hits = 0, errors = 0, lob = 0;
        for (HalfInning h : halves) {
            if (h.half() == batting) {
                byInning.add(h.runs());
                runs += h.runs();
                hits += h.hits();
                lob += h.leftOnBase();
            } else {
                errors += h.errors();   // se cargan a la defensa
            }
        }
        return new TeamLine(team, byInning, runs, hits, errors, lob);
    }

    private static List<PitcherLine> pitcherLines(List<HalfInning> halves) {
        Map<String, PitcherTally> tallies = new LinkedHashMap<>();
        for (HalfInning h : halves) {
            for (PlateAppearanceRecord pa : h.plays()) {
                PitcherTally t = tallies.computeIfAbsent(pa.pitcherId(),
                        k -> new PitcherTally(pa.pitcherId(), pa.pitcherName(), h.fieldingTeam()));
                PlayEvent e = pa.event();
                if (e.endsPlateAppearance()) t.battersFaced++;
                t.outs += pa.outsRecorded();
                t.pitches += pa.pitches().size();
                if (e.kind().isHit()) t.hits++;
                if (e.kind().isWalk()) t.walks++;
                if (e.kind() == OutcomeKind.STRIKEOUT) t.strikeouts++;
            }
            for (RunAttribution run : h.attributions()) {
                PitcherTally t = tallies.computeIfAbsent(run.chargedPitcher(),
                        k -> new PitcherTally(run.chargedPitcher(), run.chargedPitcher(), h.fieldingTeam()));
                t.runs++;
                if (run.earnedToPitcher()) t.earnedRuns++;
            }
        }
        List<PitcherLine> out = new ArrayList<>();
        for (PitcherTally t : tallies.values()) out.add(t.toLine());
        return out;
    }

    private static List<BattingLine> battingLines(List<HalfInning> halves) {
        Map<String, BatterTally> tallies = new LinkedHashMap<>();
        for (HalfInning h : halves) {
            for (PlateAppearanceRecord pa : h.plays()) {
                PlayEvent e = pa.event();
                if (!e.endsPlateAppearance()) continue;
                BatterTally t = tallies.computeIfAbsent(pa.batterId(),
                        k -> new BatterTally(pa.batterId(), pa.batterName(), h.battingTeam()));
                t.pa++;
                if (e.kind().isHit()) t.hits++;
                if (e.kind().isWalk()) t.walks++;
                if (e.kind() == OutcomeKind.STRIKEOUT) t.strikeouts++;
                t.rbi += e.rbi();
                t.notations.add(pa.inning() + ":" + e.notation());
            }
        }
        List<BattingLine> out = new ArrayList<>();
        for (BatterTally t : tallies.values()) {
            out.add(new BattingLine(t.id, t.name, t.team, t.pa, t.hits, t.walks, t.strikeouts, t.rbi, t.notations));
        }
        return out;
    }

    private static final class PitcherTally {
        final String id, name, team;
        int battersFaced, outs, pitches, hits, walks, strikeouts, runs, earnedRuns;
        PitcherTally(String id, String name, String team){ this.id=id; this.name=name; this.team=team; }
        PitcherLine toLine() {
            return new PitcherLine(id, name, team, battersFaced, outs, pitches, hits, walks, strikeouts, runs, earnedRuns);
        }
    }

    private static final class BatterTally {
        final String id, name, team;
        int pa, hits, walks, strikeouts, rbi;
        final List<String> notations = new ArrayList<>();
        BatterTally(String id, String name, String team){ this.id=id; this.name=name; this.team=team; }
    }
}
