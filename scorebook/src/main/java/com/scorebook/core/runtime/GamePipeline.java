package com.scorebook.core.runtime;

import com.scorebook.config.ScorebookConfig;
import com.scorebook.core.assemble.TimelineAssembler;
import com.scorebook.core.keyplay.KeyPlayDetector;
import com.scorebook.core.ledger.EarnedRunLedger;
import com.scorebook.core.ledger.HalfInningLedger;
import com.scorebook.core.model.*;
import com.scorebook.core.normalize.RuleTablePlayNormalizer;
import com.scorebook.core.normalize.UnrecognizedPlayPatternException;
import com.scorebook.core.simulate.AdvanceResult;
import com.scorebook.core.simulate.BaseStateSimulator;
import com.scorebook.core.simulate.IllegalAdvancementException;
import com.scorebook.core.simulate.InconsistentOutCountException;
import com.scorebook.core.spi.AnomalyListener;
import com.scorebook.core.spi.PlayNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Pasa un partido por normalizar, simular, atribuir y armar. Las fallas por jugada se recuperan y quedan
 * como anomalías; sólo se escapa {@code IncompleteGameDataException}.
 * <p>
 * No guarda estado por partido: una instancia sirve a varios hilos.
 */
public class GamePipeline {
    private static final Logger log = LoggerFactory.getLogger(GamePipeline.class);

    private final PlayNormalizer normalizer;
    private final BaseStateSimulator simulator;
    private final EarnedRunLedger ledger;
    private final KeyPlayDetector keyPlays;
    private final TimelineAssembler assembler;

    private volatile AnomalyListener listener = a -> {};

    public GamePipeline(ScorebookConfig config) {
        this(RuleTablePlayNormalizer.fromConfig(config),
                new BaseStateSimulator(config.regulationInnings),
                new EarnedRunLedger(),
                new KeyPlayDetector(config.keyPlayThreshold),
                new TimelineAssembler(config.regulationInnings));
    }

    public GamePipeline(PlayNormalizer normalizer, BaseStateSimulator simulator, EarnedRunLedger ledger,
                        KeyPlayDetector keyPlays, TimelineAssembler assembler) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.simulator = Objects.requireNonNull(simulator, "simulator");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.keyPlays = Objects.requireNonNull(keyPlays, "keyPlays");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
    }

    public GamePipeline setListener(AnomalyListener l) { this.listener = (l != null) ? l : (a -> {}); return this; }

    public Game process(GameFeed feed) {
        return process(feed.metadata(), feed.plays());
    }

    public Game process(GameMetadata metadata, List<RawPlay> plays) {
        Objects.requireNonNull(metadata, "metadata");
        log.info("Game {} started: {} at {}, {} plays", metadata.gameId(), metadata.awayTeam(), metadata.homeTeam(), plays.size());

        List<Anomaly> anomalies = new ArrayList<>();
        List<HalfInning> halves = new ArrayList<>();
        Map<Half, RawPlay> lastBatter = new EnumMap<>(Half.class);

        int index = 0;
        for (List<RawPlay> group : groupByHalfInning(plays)) {
            halves.add(playHalfInning(metadata, group, index, lastBatter, anomalies));
            index += group.size();
        }
        return assembler.assemble(metadata, halves, anomalies);
    }

    // ===== Una media entrada =====

    private HalfInning playHalfInning(GameMetadata md, List<RawPlay> group, int firstIndex,
                                      Map<Half, RawPlay> lastBatter, List<Anomaly> anomalies) {
        RawPlay first = group.get(0);
        int inning = first.inning();
        Half half = first.half();

        // el fantasma es quien bateó último en la media entrada anterior de este equipo
        RawPlay previous = lastBatter.get(half);
        String ghostId = previous != null ? previous.batterId() : "ghost-" + inning + "-" + half.label();
        String ghostName = previous != null ? previous.batterName() : ghostId;
        BaseState start = simulator.openHalfInning(inning, null, ghostId, ghostName, first.pitcherId());

        BaseState state = start;
        int outs = 0;
        int hits = 0, errors = 0;
        List<PlateAppearanceRecord> records = new ArrayList<>();

        for (int i = 0; i < group.size(); i++) {
            RawPlay raw = group.get(i);
            int index = firstIndex + i;
            boolean flagged = false;

            PlayEvent event;
            try {
                event = normalizer.normalize(raw, new PlayContext(outs, state));
            } catch (UnrecognizedPlayPatternException ex) {
                event = ex.fallback();
                flagged = true;
                report(anomalies, ex.kind(), raw, index, ex.getMessage(), "recorded as a generic out, runners hold");
            }

            AdvanceResult result;
            try {
                result = simulator.advance(state, event, raw.pitcherId());
            } catch (IllegalAdvancementException ex) {
                result = ex.bestEffort();
                flagged = true;
                report(anomalies, ex.kind(), raw, index, ex.getMessage(), "runners placed on the nearest open base");
            }

            int outsAfter;
            try {
                outsAfter = simulator.recordOuts(outs, result.outs());
            } catch (InconsistentOutCountException ex) {
                outsAfter = ex.cappedOuts();
                flagged = true;
                report(anomalies, ex.kind(), raw, index, ex.getMessage(), "outs capped at " + ex.cappedOuts());
            }

            if (metadataDisagrees(raw, result.runs(), outsAfter - outs)) {
                flagged = true;
                report(anomalies, AnomalyKind.METADATA_MISMATCH, raw, index,
                        "feed says " + raw.runsScored() + " run(s), " + raw.outsRecorded() + " out(s); play resolves to "
                                + result.runs() + " run(s), " + (outsAfter - outs) + " out(s)",
                        "simulated values kept");
            }

            boolean key = keyPlays.isKeyPlay(event, raw.winProbabilityBefore(), raw.winProbabilityAfter());
            records.add(new PlateAppearanceRecord(index, inning, half,
                    raw.batterId(), raw.batterName(), raw.pitcherId(), raw.pitcherName(), raw.pitches(),
                    event, state, result.state(), outs, outsAfter, result.scored(),
                    raw.winProbabilityBefore(), raw.winProbabilityAfter(), key, flagged));

            if (event.kind().isHit()) hits++;
            errors += event.errors();
            if (event.endsPlateAppearance()) lastBatter.put(half, raw);
            state = result.state();
            outs = outsAfter;
        }

        HalfInningLedger runs = ledger.attributeRuns(records);
        for (String ambiguity : runs.ambiguities()) {
            Anomaly a = new Anomaly(AnomalyKind.EARNED_RUN_AMBIGUITY, inning, half, -1, null, ambiguity,
                    "earned runs follow the order of play");
            anomalies.add(a);
            log.warn("{} at {}: {}", a.kind(), a.location(), a.message());
            listener.onAnomaly(a);
        }

        return new HalfInning(inning, half, md.battingTeam(half), md.fieldingTeam(half), start, records,
                outs, runs.totalRuns(), runs.earnedRuns(), hits, errors, state.count(),
                runs.runs(), runs.earnedRunsByPitcher(), runs.runnersByPitcher());
    }

    /** Cero carreras y cero outs es como llegan los feeds sin conteos; ese par no se compara. */
    private static boolean metadataDisagrees(RawPlay raw, int runs, int outs) {
        if (raw.runsScored() == 0 && raw.outsRecorded() == 0) return false;
        return raw.runsScored() != runs || raw.outsRecorded() != outs;
    }

    private void report(List<Anomaly> anomalies, AnomalyKind kind, RawPlay raw, int index, String message, String recovery) {
        Anomaly a = new Anomaly(kind, raw.inning(), raw.half(), index, raw.description(), message, recovery);
        anomalies.add(a);
        log.warn("{} at {}: {} ({})", kind, a.location(), message, recovery);
        listener.onAnomaly(a);
    }

    static List<List<RawPlay>> groupByHalfInning(List<RawPlay> plays) {
        List<List<RawPlay>> groups = new ArrayList<>();
        List<RawPlay> current = null;
        for (RawPlay p : plays) {
            if (current == null || current.get(0).inning() != p.inning() || current.get(0).half() != p.half()) {
                current = new ArrayList<>();
                groups.add(current);
            }
            current.add(p);
        }
        return groups;
    }
}
