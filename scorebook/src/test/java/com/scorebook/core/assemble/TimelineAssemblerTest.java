package com.scorebook.core.assemble;

import com.scorebook.core.model.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TimelineAssemblerTest {

    private final TimelineAssembler assembler = new TimelineAssembler(9);
    private final GameMetadata md = GameMetadata.of("g-7", "NYY", "BOS");

    private HalfInning half(int inning, Half half, int outs, int runs, int hits, int errors) {
        return new HalfInning(inning, half, md.battingTeam(half), md.fieldingTeam(half), BaseState.empty(), List.of(),
                outs, runs, runs, hits, errors, 0, List.of(), Map.of(), Map.of());
    }

    /** Entradas completas 1..n con las carreras dadas por entrada para cada lado. */
    private List<HalfInning> innings(int[] away, int[] home) {
        List<HalfInning> out = new ArrayList<>();
        for (int i = 0; i < away.length; i++) {
            out.add(half(i + 1, Half.TOP, 3, away[i], away[i], 0));
            if (i < home.length) out.add(half(i + 1, Half.BOTTOM, 3, home[i], home[i], 1));
        }
        return out;
    }

    @Test
    void buildsLinescoreAndFinalScore() {
        List<HalfInning> halves = innings(new int[]{0, 2, 0, 0, 0, 0, 0, 1, 0}, new int[]{1, 0, 0, 0, 0, 0, 0, 0, 0});
        Game g = assembler.assemble(md, halves, List.of());

        assertEquals(9, g.innings().size());
        TeamLine away = g.boxScore().away();
        assertEquals(List.of(0, 2, 0, 0, 0, 0, 0, 1, 0), away.runsByInning());
        assertEquals(3, away.runs());
        assertEquals(3, away.hits());
        assertEquals(9, away.errors(), "los errores de las bajas son de la defensa visitante");
        assertEquals(0, g.boxScore().home().errors());
        assertEquals(1, g.boxScore().home().runs());
        assertEquals(new FinalScore("NYY", 3, "BOS", 1), g.finalScore());
        assertEquals("NYY", g.finalScore().winner());
    }

    @Test
    void homeTeamNeedNotBatWhenAhead() {
        List<HalfInning> halves = innings(new int[]{0, 0, 0, 0, 0, 0, 0, 0, 0}, new int[]{0, 0, 1, 0, 0, 0, 0, 0});
        Game g = assembler.assemble(md, halves, List.of());
        assertNull(g.innings().get(8).bottom());
        assertEquals(8, g.boxScore().home().runsByInning().size());
        assertEquals(17, g.halfInnings().size());
    }

    @Test
    void walkOffMayEndWithFewerThanThreeOuts() {
        List<HalfInning> halves = innings(new int[]{0, 0, 0, 0, 0, 0, 0, 0, 1}, new int[]{0, 0, 0, 0, 0, 0, 0, 0});
        halves.add(half(9, Half.BOTTOM, 1, 2, 2, 0));
        Game g = assembler.assemble(md, halves, List.of());
        assertEquals("BOS", g.finalScore().winner());
    }

    @Test
    void shortFinalHalfWithoutWalkOffIsIncomplete() {
        List<HalfInning> halves = innings(new int[]{0, 0, 0, 0, 0, 0, 0, 0, 1}, new int[]{0, 0, 0, 0, 0, 0, 0, 0});
        halves.add(half(9, Half.BOTTOM, 2, 1, 1, 0));   // empatado, sigue bateando
        assertThrows(IncompleteGameDataException.class, () -> assembler.assemble(md, halves, List.of()));
    }

    @Test
    void shortTopHalfIsIncomplete() {
        List<HalfInning> halves = innings(new int[]{0, 0}, new int[]{0});
        halves.set(2, half(2, Half.TOP, 1, 5, 5, 0));
        IncompleteGameDataException ex = assertThrows(IncompleteGameDataException.class,
                () -> assembler.assemble(md, halves, List.of()));
        assertEquals(AnomalyKind.INCOMPLETE_GAME_DATA, ex.kind());
        assertEquals("g-7", ex.gameId());
    }

    @Test
    void middleHalfWithFewerThanThreeOutsIsIncomplete() {
        List<HalfInning> halves = innings(new int[]{0, 0, 0}, new int[]{0, 0, 0});
        halves.set(2, half(2, Half.TOP, 2, 0, 0, 0));
        assertThrows(IncompleteGameDataException.class, () -> assembler.assemble(md, halves, List.of()));
    }

    @Test
    void outOfOrderHalvesAreIncomplete() {
        List<HalfInning> halves = new ArrayList<>(List.of(
                half(1, Half.TOP, 3, 0, 0, 0),
                half(2, Half.TOP, 3, 0, 0, 0)));
        IncompleteGameDataException ex = assertThrows(IncompleteGameDataException.class,
                () -> assembler.assemble(md, halves, List.of()));
        assertTrue(ex.getMessage().contains("b1"), ex.getMessage());
    }

    @Test
    void anomaliesArePassedThrough() {
        Anomaly a = new Anomaly(AnomalyKind.METADATA_MISMATCH, 1, Half.TOP, 0, "x", "y", "z");
        Game g = assembler.assemble(md, innings(new int[]{0}, new int[]{0}), List.of(a));
        assertEquals(List.of(a), g.anomalies());
    }
}
