package com.scorebook.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ocupación de las tres bases. Inmutable; cada transición produce un valor nuevo.
 */
public record BaseState(Runner first, Runner second, Runner third) {

    private static final BaseState EMPTY = new BaseState(null, null, null);

    public BaseState {
        check(first, Base.FIRST);
        check(second, Base.SECOND);
        check(third, Base.THIRD);
        if (same(first, second) || same(first, third) || same(second, third)) {
            throw new IllegalArgumentException("The same player cannot occupy two bases");
        }
    }

    public static BaseState empty() { return EMPTY; }

    /** Arma el estado con cada corredor en la base que trae. */
    public static BaseState of(Runner... runners) {
        BaseState s = EMPTY;
        for (Runner r : runners) s = s.with(r);
        return s;
    }

    public Optional<Runner> runnerOn(Base base) {
        return Optional.ofNullable(slot(base));
    }

    public boolean occupied(Base base) { return slot(base) != null; }

    /** Ubica {@code runner} en su base; la base tiene que estar libre. */
    public BaseState with(Runner runner) {
        if (occupied(runner.base())) {
            throw new IllegalStateException(runner.base() + " already occupied by " + slot(runner.base()).playerId());
        }
        return switch (runner.base()) {
            case FIRST -> new BaseState(runner, second, third);
            case SECOND -> new BaseState(first, runner, third);
            case THIRD -> new BaseState(first, second, runner);
            case HOME -> throw new IllegalArgumentException("Cannot place a runner on home");
        };
    }

    public BaseState without(Base base) {
        return switch (base) {
            case FIRST -> new BaseState(null, second, third);
            case SECOND -> new BaseState(first, null, third);
            case THIRD -> new BaseState(first, second, null);
            case HOME -> this;
        };
    }

    /** Corredores de primera a tercera. */
    public List<Runner> runners() {
        List<Runner> out = new ArrayList<>(3);
        if (first != null) out.add(first);
        if (second != null) out.add(second);
        if (third != null) out.add(third);
        return Collections.unmodifiableList(out);
    }

    /** Corredores de tercera a primera. */
    public List<Runner> runnersLeadFirst() {
        List<Runner> out = new ArrayList<>(runners());
        Collections.reverse(out);
        return out;
    }

    public Optional<Runner> find(String playerId) {
        return runners().stream().filter(r -> r.playerId().equals(playerId)).findFirst();
    }

    public int count() { return runners().size(); }

    public boolean isEmpty() { return first == null && second == null && third == null; }

    public boolean hasGhost() { return runners().stream().anyMatch(Runner::ghost); }

    @Override public String toString() {
        return "[" + label(first) + "|" + label(second) + "|" + label(third) + "]";
    }

    private Runner slot(Base base) {
        return switch (base) {
            case FIRST -> first;
            case SECOND -> second;
            case THIRD -> third;
            case HOME -> null;
        };
    }

    private static void check(Runner r, Base expected) {
        if (r != null && r.base() != expected) {
            throw new IllegalArgumentException("Runner " + r.playerId() + " is on " + r.base() + ", not " + expected);
        }
    }

    private static boolean same(Runner a, Runner b) {
        return a != null && b != null && a.playerId().equals(b.playerId());
    }

    private static String label(Runner r) { return r == null ? "-" : r.playerId(); }
}
