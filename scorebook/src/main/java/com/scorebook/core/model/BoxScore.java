package com.scorebook.core.model;

import java.util.List;

public record BoxScore(
        TeamLine away,
        TeamLine home,
        List<PitcherLine> pitchers,
        List<BattingLine> batters
) {
    public BoxScore {
        pitchers = List.copyOf(pitchers);
        batters = List.copyOf(batters);
    }
}
