package com.scorebook.core.simulate;

import com.scorebook.core.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BaseStateSimulatorTest {

    private BaseStateSimulator simulator;

    private static final Runner A = new Runner("a", "Runner A", "p1", Base.FIRST, false, false);
    private static final Runner B = new Runner("b", "Runner B", "p1", Base.SECOND, false, false);
    private static final Runner C = new Runner("c", "Runner C", "p1", Base.THIRD, false, false);

    @BeforeEach
    void setUp() {
        simulator = new BaseStateSimulator(9);
    }

    private static PlayEvent.Builder event(OutcomeKind kind) {
        return PlayEvent.builder().kind(kind).batter("bat", "Batter").notation("-");
    }

    @Test
    void grandSlamClearsTheBases() {
        BaseState loaded = BaseState.of(A, B, C);
        PlayEvent hr = event(OutcomeKind.HOME_RUN).batterDestination(Base.HOME)
                .advances(List.of(RunnerAdvance.to(A, Base.HOME, false), RunnerAdvance.to(B, Base.HOME, false),
                        RunnerAdvance.to(C, Base.HOME, false)))
                .build();
        AdvanceResult r = simulator.advance(loaded, hr, "p2");
        assertTrue(r.state().isEmpty());
        assertEquals(4, r.runs());
        assertEquals(0, r.outs());
        // primero cruza el de adelante, el bateador último
        assertEquals(List.of("c", "b", "a", "bat"), r.scored().stream().map(s -> s.runner().playerId()).toList());
        assertEquals("p2", r.scored().get(3).runner().responsiblePitcher());
        assertEquals("p1", r.scored().get(0).runner().responsiblePitcher());
    }

    @Test
    void batterTakesBaseWithResponsiblePitcher() {
        PlayEvent single = event(OutcomeKind.SINGLE).batterDestination(Base.FIRST).build();
        AdvanceResult r = simulator.advance(BaseState.empty(), single, "p7");
        Runner on = r.state().runnerOn(Base.FIRST).orElseThrow();
        assertEquals("bat", on.playerId());
        assertEquals("p7", on.responsiblePitcher());
        assertFalse(on.reachedOnMisplay());
    }

    @Test
    void runnersPutOutLeaveTheState() {
        PlayEvent dp = event(OutcomeKind.DOUBLE_PLAY).batterOut(true)
                .advances(List.of(RunnerAdvance.out(A), RunnerAdvance.to(C, Base.HOME, false)))
                .build();
        AdvanceResult r = simulator.advance(BaseState.of(A, C), dp, "p1");
        assertEquals(2, r.outs());
        assertEquals(1, r.runs());
        assertEquals(List.of("a"), r.putOut().stream().map(Runner::playerId).toList());
        assertTrue(r.state().isEmpty());
    }

    @Test
    void unmentionedRunnersHold() {
        PlayEvent k = event(OutcomeKind.STRIKEOUT).batterOut(true).build();
        AdvanceResult r = simulator.advance(BaseState.of(B), k, "p1");
        assertEquals(BaseState.of(B), r.state());
    }

    @Test
    void backwardMoveIsIllegalWithBestEffort() {
        PlayEvent bad = event(OutcomeKind.SINGLE).batterDestination(Base.FIRST)
                .advances(List.of(RunnerAdvance.to(C, Base.SECOND, false)))
                .build();
        IllegalAdvancementException ex = assertThrows(IllegalAdvancementException.class,
                () -> simulator.advance(BaseState.of(C), bad, "p1"));
        assertEquals(AnomalyKind.ILLEGAL_ADVANCEMENT, ex.kind());
        BaseState best = ex.bestEffort().state();
        assertEquals("c", best.runnerOn(Base.THIRD).orElseThrow().playerId(), "el corredor queda donde estaba");
        assertEquals("bat", best.runnerOn(Base.FIRST).orElseThrow().playerId());
    }

    @Test
    void movingOntoOccupiedBaseIsIllegal() {
        // bateador a primera mientras al corredor de ahí se le dice que se quede
        PlayEvent bad = event(OutcomeKind.SINGLE).batterDestination(Base.FIRST)
                .advances(List.of(RunnerAdvance.hold(A)))
                .build();
        IllegalAdvancementException ex = assertThrows(IllegalAdvancementException.class,
                () -> simulator.advance(BaseState.of(A), bad, "p1"));
        BaseState best = ex.bestEffort().state();
        assertEquals("a", best.runnerOn(Base.FIRST).orElseThrow().playerId());
        assertEquals("bat", best.runnerOn(Base.SECOND).orElseThrow().playerId(), "el bateador pasa a la siguiente base libre");
    }

    @Test
    void unknownRunnerIsIllegal() {
        PlayEvent bad = event(OutcomeKind.STOLEN_BASE)
                .advances(List.of(new RunnerAdvance("ghost", Base.FIRST, Base.SECOND, false)))
                .build();
        assertThrows(IllegalAdvancementException.class, () -> simulator.advance(BaseState.empty(), bad, "p1"));
    }

    @Test
    void fourthOutIsRejected() {
        assertEquals(3, simulator.recordOuts(1, 2));
        InconsistentOutCountException ex = assertThrows(InconsistentOutCountException.class,
                () -> simulator.recordOuts(2, 2));
        assertEquals(4, ex.attemptedOuts());
        assertEquals(3, ex.cappedOuts());
    }

    @Test
    void ghostRunnerOnlyInExtraInningsOnEmptyBases() {
        assertTrue(simulator.openHalfInning(9, null, "g", "G", "p1").isEmpty(), "sin fantasma en entradas reglamentarias");

        BaseState tenth = simulator.openHalfInning(10, null, "g", "G", "p1");
        Runner ghost = tenth.runnerOn(Base.SECOND).orElseThrow();
        assertTrue(ghost.ghost());
        assertEquals("p1", ghost.responsiblePitcher());
        assertEquals(1, tenth.count());

        BaseState occupied = BaseState.of(A);
        assertSame(occupied, simulator.openHalfInning(10, occupied, "g", "G", "p1"), "con bases ocupadas no hay fantasma");
    }

    @Test
    void regulationLengthIsConfigurable() {
        BaseStateSimulator seven = new BaseStateSimulator(7);
        assertTrue(seven.openHalfInning(8, null, "g", "G", "p1").hasGhost());
        assertThrows(IllegalArgumentException.class, () -> new BaseStateSimulator(0));
    }
}
