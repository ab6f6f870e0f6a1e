package com.scorebook.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BaseStateTest {

    private static Runner on(String id, Base base) {
        return new Runner(id, id, "p1", base, false, false);
    }

    @Test
    void placesRunnersOnTheirBases() {
        BaseState s = BaseState.of(on("a", Base.FIRST), on("c", Base.THIRD));
        assertTrue(s.occupied(Base.FIRST));
        assertFalse(s.occupied(Base.SECOND));
        assertEquals("c", s.runnerOn(Base.THIRD).orElseThrow().playerId());
        assertEquals(2, s.count());
        assertEquals("[a|-|c]", s.toString());
    }

    @Test
    void ordersRunnersBothWays() {
        BaseState s = BaseState.of(on("a", Base.FIRST), on("b", Base.SECOND), on("c", Base.THIRD));
        assertEquals(List.of("a", "b", "c"), s.runners().stream().map(Runner::playerId).toList());
        assertEquals(List.of("c", "b", "a"), s.runnersLeadFirst().stream().map(Runner::playerId).toList());
    }

    @Test
    void refusesTwoRunnersOnOneBase() {
        BaseState s = BaseState.of(on("a", Base.FIRST));
        assertThrows(IllegalStateException.class, () -> s.with(on("b", Base.FIRST)));
    }

    @Test
    void refusesTheSamePlayerTwice() {
        assertThrows(IllegalArgumentException.class,
                () -> new BaseState(on("a", Base.FIRST), on("a", Base.SECOND), null));
    }

    @Test
    void refusesRunnerOnHome() {
        assertThrows(IllegalArgumentException.class, () -> on("a", Base.HOME));
    }

    @Test
    void withoutIsANewValue() {
        BaseState s = BaseState.of(on("a", Base.FIRST));
        BaseState t = s.without(Base.FIRST);
        assertTrue(t.isEmpty());
        assertEquals(1, s.count(), "el estado original no se toca");
    }

    @Test
    void detectsGhost() {
        assertTrue(BaseState.of(Runner.ghost("g", "g", "p1")).hasGhost());
        assertFalse(BaseState.of(on("a", Base.SECOND)).hasGhost());
    }

    @Test
    void parsesPitchSequences() {
        assertEquals(List.of(PitchCall.BALL, PitchCall.STRIKE, PitchCall.FOUL, PitchCall.IN_PLAY),
                PitchCall.parseSequence("B S-F X"));
        assertThrows(IllegalArgumentException.class, () -> PitchCall.fromCode('Z'));
    }

    @Test
    void parsesBases() {
        assertEquals(Base.THIRD, Base.parse("3rd"));
        assertEquals(Base.HOME, Base.parse("home"));
        assertEquals(Base.HOME, Base.THIRD.plus(2));
    }
}
