package com.scorebook.plugins.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/** Forma del documento de feed de un partido. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FeedDocument {
    public FeedMetadata metadata;
    public List<FeedPlay> plays;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FeedMetadata {
        public String gameId;
        public LocalDate date;
        public String awayTeam;
        public String homeTeam;
        public String venue;
        public String weather;
        public Integer attendance;
        public Map<String, List<String>> startingLineups;
        public Map<String, String> startingPitchers;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FeedPlay {
        public Integer inning;
        public String half;                  // "top" | "bottom" | "t" | "b"
        public String inningLabel;           // "top of the 3", "t3"; se usa si faltan inning/half
        public String batterId;
        public String batterName;
        public String pitcherId;
        public String pitcherName;
        public String description;
        public JsonNode pitches;             // "BSFX" o ["B","S","F","X"]
        public int runsScored;
        public int outsRecorded;
        public Double winProbabilityBefore;
        public Double winProbabilityAfter;
    }
}
