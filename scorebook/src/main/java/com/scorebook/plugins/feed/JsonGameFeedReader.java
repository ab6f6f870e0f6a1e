package com.scorebook.plugins.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.scorebook.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lee el feed del partido que entrega el lado de adquisición: {@code {"metadata": {...}, "plays": [...]}}.
 * La entrada puede venir como número más half o como etiqueta tipo "top of the 3" o "b10".
 */
public class JsonGameFeedReader {
    private static final Logger log = LoggerFactory.getLogger(JsonGameFeedReader.class);

    private static final Pattern LONG_LABEL = Pattern.compile("\\b(top|bottom)\\s+of\\s+the\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SHORT_LABEL = Pattern.compile("^\\s*([tb])\\s*(\\d+)\\s*$", Pattern.CASE_INSENSITIVE);

    public GameFeed read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public GameFeed read(InputStream in) throws IOException {
        FeedDocument doc = JsonSupport.fromStream(in, FeedDocument.class);
        if (doc == null || doc.metadata == null) throw new IOException("Game feed has no metadata");
        GameMetadata md = toMetadata(doc.metadata);

        List<RawPlay> plays = new ArrayList<>();
        if (doc.plays != null) {
            for (int i = 0; i < doc.plays.size(); i++) {
                try {
                    plays.add(toRawPlay(doc.plays.get(i)));
                } catch (IllegalArgumentException | NullPointerException e) {
                    throw new IOException("Game " + md.gameId() + ", play " + i + ": " + e.getMessage(), e);
                }
            }
        }
        log.debug("Read game {} with {} plays", md.gameId(), plays.size());
        return new GameFeed(md, plays);
    }

    private static GameMetadata toMetadata(FeedDocument.FeedMetadata m) {
        return new GameMetadata(m.gameId, m.date, m.awayTeam, m.homeTeam, m.venue, m.weather, m.attendance,
                m.startingLineups, m.startingPitchers);
    }

    static RawPlay toRawPlay(FeedDocument.FeedPlay p) {
        int inning;
        Half half;
        if (p.inning != null && p.half != null) {
            inning = p.inning;
            half = parseHalf(p.half);
        } else if (p.inningLabel != null) {
            InningLabel label = parseInningLabel(p.inningLabel);
            inning = label.inning();
            half = label.half();
        } else {
            throw new IllegalArgumentException("play has neither inning/half nor inningLabel");
        }
        return new RawPlay(inning, half, p.batterId, p.batterName, p.pitcherId, p.pitcherName, p.description,
                parsePitches(p.pitches), p.runsScored, p.outsRecorded, p.winProbabilityBefore, p.winProbabilityAfter);
    }

    public record InningLabel(int inning, Half half) {}

    /** Acepta "top of the 3", "Bottom of the 10th" y las formas cortas "t3", "b10". */
    public static InningLabel parseInningLabel(String label) {
        Matcher m = LONG_LABEL.matcher(label);
        if (m.find()) {
            return new InningLabel(Integer.parseInt(m.group(2)), parseHalf(m.group(1)));
        }
        m = SHORT_LABEL.matcher(label);
        if (m.matches()) {
            return new InningLabel(Integer.parseInt(m.group(2)), parseHalf(m.group(1)));
        }
        throw new IllegalArgumentException("Unrecognized inning label: " + label);
    }

    static Half parseHalf(String s) {
        switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "t": case "top": return Half.TOP;
            case "b": case "bot": case "bottom": return Half.BOTTOM;
            default: throw new IllegalArgumentException("Unrecognized half: " + s);
        }
    }

    static List<PitchCall> parsePitches(JsonNode node) {
        if (node == null || node.isNull()) return List.of();
        if (node.isTextual()) return PitchCall.parseSequence(node.asText());
        List<PitchCall> out = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode n : node) out.addAll(PitchCall.parseSequence(n.asText()));
            return out;
        }
        throw new IllegalArgumentException("pitches must be a string or an array, was " + node.getNodeType());
    }
}
