package com.scorebook.core.model;

public enum AnomalyKind {
    UNRECOGNIZED_PLAY_PATTERN,
    ILLEGAL_ADVANCEMENT,
    INCONSISTENT_OUT_COUNT,
    INCOMPLETE_GAME_DATA,
    METADATA_MISMATCH,       // carreras/outs simulados no coinciden con los del feed
    EARNED_RUN_AMBIGUITY
}
