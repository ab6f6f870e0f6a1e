package com.scorebook.core.model;

import java.util.List;
import java.util.Objects;

/** Entrada de un partido: metadata más la lista ordenada de jugadas. */
public record GameFeed(GameMetadata metadata, List<RawPlay> plays) {
    public GameFeed {
        Objects.requireNonNull(metadata, "metadata");
        plays = List.copyOf(plays);
    }

    public String gameId() { return metadata.gameId(); }
}
