package com.scorebook.plugins.feed;

import com.scorebook.config.ScorebookConfig;
import com.scorebook.core.model.*;
import com.scorebook.core.runtime.GamePipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonGameFeedReaderTest {

    private static final String SAMPLE = "feeds/sample-game.json";

    private JsonGameFeedReader reader;

    @BeforeEach
    void setUp() {
        reader = new JsonGameFeedReader();
    }

    private GameFeed sample() throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(SAMPLE)) {
            assertNotNull(in, "falta el recurso de test " + SAMPLE);
            return reader.read(in);
        }
    }

    private static InputStream json(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void readsMetadataUnchanged() throws Exception {
        GameMetadata md = sample().metadata();
        assertEquals("2024-10-01-HOU-LAD", md.gameId());
        assertEquals(LocalDate.of(2024, 10, 1), md.date());
        assertEquals("Dodger Stadium", md.venue());
        assertEquals(Integer.valueOf(52011), md.attendance());
        assertEquals("glasnow31", md.startingPitchers().get("LAD"));
        assertEquals(7, md.startingLineups().get("LAD").size());
    }

    @Test
    void acceptsEveryInningForm() throws Exception {
        List<RawPlay> plays = sample().plays();
        assertEquals(13, plays.size());
        assertEquals("t1", plays.get(0).label());
        assertEquals("t1", plays.get(1).label());
        assertEquals("t1", plays.get(2).label());
        assertEquals("b1", plays.get(3).label());
        assertEquals("t2", plays.get(7).label());
        assertEquals("t2", plays.get(8).label());
        assertEquals("b2", plays.get(12).label());
    }

    @Test
    void readsPitchStringsAndArrays() throws Exception {
        List<RawPlay> plays = sample().plays();
        assertEquals(List.of(PitchCall.BALL, PitchCall.IN_PLAY), plays.get(0).pitches());
        assertEquals(List.of(PitchCall.BALL, PitchCall.STRIKE, PitchCall.IN_PLAY), plays.get(1).pitches());
        assertEquals(2, plays.get(1).outsRecorded());
        assertEquals(0.46, plays.get(0).winProbabilityBefore(), 1e-9);
        assertNull(plays.get(4).winProbabilityBefore());
    }

    @Test
    void parsesInningLabels() {
        assertEquals(new JsonGameFeedReader.InningLabel(3, Half.TOP), JsonGameFeedReader.parseInningLabel("top of the 3"));
        assertEquals(new JsonGameFeedReader.InningLabel(10, Half.BOTTOM), JsonGameFeedReader.parseInningLabel("Bottom of the 10th"));
        assertEquals(new JsonGameFeedReader.InningLabel(7, Half.BOTTOM), JsonGameFeedReader.parseInningLabel("b7"));
        assertThrows(IllegalArgumentException.class, () -> JsonGameFeedReader.parseInningLabel("middle of the 5"));
    }

    @Test
    void playWithoutInningIsRejected() {
        String doc = "{\"metadata\":{\"gameId\":\"x\",\"awayTeam\":\"A\",\"homeTeam\":\"H\"},"
                + "\"plays\":[{\"batterId\":\"b\",\"pitcherId\":\"p\",\"description\":\"b walks.\"}]}";
        IOException ex = assertThrows(IOException.class, () -> reader.read(json(doc)));
        assertTrue(ex.getMessage().contains("play 0"), ex.getMessage());
    }

    @Test
    void missingMetadataIsRejected() {
        assertThrows(IOException.class, () -> reader.read(json("{\"plays\":[]}")));
    }

    @Test
    void readsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("game.json");
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(SAMPLE)) {
            Files.copy(in, file);
        }
        assertEquals(13, reader.read(file).plays().size());
    }

    @Test
    void sampleGameRunsThroughThePipeline() throws Exception {
        Game g = new GamePipeline(ScorebookConfig.defaults()).process(sample());

        assertEquals(2, g.innings().size());
        assertEquals(0, g.finalScore().awayRuns());
        assertEquals(1, g.finalScore().homeRuns());
        assertEquals("LAD", g.finalScore().winner());
        assertTrue(g.anomalies().isEmpty(), g.anomalies().toString());
        assertEquals(1, g.keyPlays().size());
        assertEquals("betts", g.keyPlays().get(0).batterId());
        assertEquals("Dodger Stadium", g.metadata().venue());

        List<String> notations = g.plays().stream().map(pa -> pa.event().notation()).toList();
        assertEquals(List.of("1B", "DP", "K", "HR", "F8", "P6", "Ʞ", "BB", "K", "DP", "GO4-3", "K", "F7"), notations);
        assertEquals("3-0", g.plays().get(7).count());
        assertEquals(0, g.boxScore().away().leftOnBase(), "los dos corredores se borraron en doble play");
        assertEquals(1, g.boxScore().away().hits());
    }
}
