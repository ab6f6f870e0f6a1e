package com.scorebook.core.model;

public enum Half {
    TOP,     // batea el visitante
    BOTTOM;  // batea el local

    public String label() { return this == TOP ? "t" : "b"; }
}
