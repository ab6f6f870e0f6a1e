package com.scorebook.core.normalize;

import com.scorebook.core.model.AnomalyKind;
import com.scorebook.core.model.PlayEvent;
import com.scorebook.core.model.ScorebookException;

/** Ninguna regla reconoció la descripción; {@link #fallback()} es el out genérico para seguir. */
public class UnrecognizedPlayPatternException extends ScorebookException {
    private final String description;
    private final PlayEvent fallback;

    public UnrecognizedPlayPatternException(String description, String detail, PlayEvent fallback) {
        super(AnomalyKind.UNRECOGNIZED_PLAY_PATTERN, "Unrecognized play: \"" + description + "\"" + (detail == null ? "" : " (" + detail + ")"));
        this.description = description;
        this.fallback = fallback;
    }

    public String description() { return description; }

    public PlayEvent fallback() { return fallback; }
}
