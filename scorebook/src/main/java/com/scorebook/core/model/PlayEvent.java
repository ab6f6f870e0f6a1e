package com.scorebook.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resultado resuelto de una jugada cruda: el avance completo de cada corredor que estaba en base,
 * el destino del bateador, los fielders en orden y la notación de planilla.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PlayEvent {
    // --- obligatorios ---
    private final OutcomeKind kind;
    private final String batterId;
    private final String batterName;

    // --- bateador ---
    private final Base batterDestination;     // null: out o sigue bateando
    private final boolean batterOut;
    private final boolean batterOnMisplay;    // llegó por error / passed ball

    // --- corredores y defensa ---
    private final List<RunnerAdvance> advances;
    private final List<Integer> fielders;     // posiciones 1-9 en orden del relay
    private final Integer errorFielder;
    private final int errors;

    // --- anotación ---
    private final int rbi;
    private final boolean cleanOuts;          // todos los outs de la jugada sin error

    // --- origen ---
    private final String ruleId;
    private final double confidence;
    private final boolean fallback;
    private final String notation;
    private final String description;

    private PlayEvent(Builder b) {
        this.kind = Objects.requireNonNull(b.kind, "kind");
        this.batterId = Objects.requireNonNull(b.batterId, "batterId");
        this.batterName = b.batterName != null ? b.batterName : b.batterId;
        this.batterDestination = b.batterDestination;
        this.batterOut = b.batterOut;
        this.batterOnMisplay = b.batterOnMisplay;
        if (batterOut && batterDestination != null) {
            throw new IllegalArgumentException("Batter cannot be both out and on base");
        }
        this.advances = List.copyOf(b.advances);
        this.fielders = List.copyOf(b.fielders);
        this.errorFielder = b.errorFielder;
        this.errors = b.errors;
        this.rbi = b.rbi;
        this.cleanOuts = b.cleanOuts;
        this.ruleId = b.ruleId;
        this.confidence = b.confidence;
        this.fallback = b.fallback;
        this.notation = b.notation != null ? b.notation : "-";
        this.description = b.description;
    }

    public OutcomeKind kind() { return kind; }
    public String batterId() { return batterId; }
    public String batterName() { return batterName; }
    public Base batterDestination() { return batterDestination; }
    public boolean batterOut() { return batterOut; }
    public boolean batterOnMisplay() { return batterOnMisplay; }
    public List<RunnerAdvance> advances() { return advances; }
    public List<Integer> fielders() { return fielders; }
    public Integer errorFielder() { return errorFielder; }
    public int errors() { return errors; }
    public int rbi() { return rbi; }
    public boolean cleanOuts() { return cleanOuts; }
    public String ruleId() { return ruleId; }
    public double confidence() { return confidence; }
    public boolean fallback() { return fallback; }
    public String notation() { return notation; }
    public String description() { return description; }

    public boolean batterReaches() { return batterDestination != null; }

    public boolean endsPlateAppearance() { return kind.endsPlateAppearance(); }

    /** Outs que registra la jugada (bateador más corredores). */
    public int outs() {
        int n = batterOut ? 1 : 0;
        for (RunnerAdvance a : advances) if (a.out()) n++;
        return n;
    }

    /** Carreras que anota la jugada, bateador incluido. */
    public int runs() {
        int n = batterDestination == Base.HOME ? 1 : 0;
        for (RunnerAdvance a : advances) if (a.scores()) n++;
        return n;
    }

    @Override public String toString() {
        return kind + "(" + notation + ", batter=" + batterId + " -> "
                + (batterOut ? "OUT" : String.valueOf(batterDestination)) + ", advances=" + advances + ")";
    }

    // --- builder ---
    public static Builder builder() { return new Builder(); }
    public static final class Builder {
        private OutcomeKind kind;
        private String batterId;
        private String batterName;
        private Base batterDestination;
        private boolean batterOut;
        private boolean batterOnMisplay;
        private List<RunnerAdvance> advances = new ArrayList<>();
        private List<Integer> fielders = new ArrayList<>();
        private Integer errorFielder;
        private int errors;
        private int rbi;
        private boolean cleanOuts = true;
        private String ruleId;
        private double confidence = 1.0;
        private boolean fallback;
        private String notation;
        private String description;

        public Builder kind(OutcomeKind k){ this.kind = k; return this; }
        public Builder batter(String id, String name){ this.batterId = id; this.batterName = name; return this; }
        public Builder batterDestination(Base b){ this.batterDestination = b; return this; }
        public Builder batterOut(boolean o){ this.batterOut = o; return this; }
        public Builder batterOnMisplay(boolean m){ this.batterOnMisplay = m; return this; }
        public Builder advance(RunnerAdvance a){ this.advances.add(a); return this; }
        public Builder advances(List<RunnerAdvance> a){ this.advances = new ArrayList<>(a); return this; }
        public Builder fielders(List<Integer> f){ this.fielders = new ArrayList<>(f); return this; }
        public Builder errorFielder(Integer f){ this.errorFielder = f; return this; }
        public Builder errors(int e){ this.errors = e; return this; }
        public Builder rbi(int r){ this.rbi = r; return this; }
        public Builder cleanOuts(boolean c){ this.cleanOuts = c; return this; }
        public Builder ruleId(String id){ this.ruleId = id; return this; }
        public Builder confidence(double c){ this.confidence = c; return this; }
        public Builder fallback(boolean f){ this.fallback = f; return this; }
        public Builder notation(String n){ this.notation = n; return this; }
        public Builder description(String d){ this.description = d; return this; }

        public PlayEvent build() { return new PlayEvent(this); }
    }
}
