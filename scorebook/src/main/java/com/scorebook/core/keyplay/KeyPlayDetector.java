package com.scorebook.core.keyplay;

import com.scorebook.core.model.PlayEvent;

import java.util.Objects;

/** Marca las jugadas cuya variación de probabilidad de victoria llega al umbral. */
public class KeyPlayDetector {
    // absorbe redondeo binario, p.ej. 0.60 - 0.50 = 0.0999...
    private static final double EPSILON = 1e-9;

    private final double defaultThreshold;

    public KeyPlayDetector(double defaultThreshold) {
        checkThreshold(defaultThreshold);
        this.defaultThreshold = defaultThreshold;
    }

    public boolean isKeyPlay(PlayEvent event, Double wpBefore, Double wpAfter) {
        return isKeyPlay(event, wpBefore, wpAfter, defaultThreshold);
    }

    /** False si falta alguna de las probabilidades. */
    public boolean isKeyPlay(PlayEvent event, Double wpBefore, Double wpAfter, double threshold) {
        Objects.requireNonNull(event, "event");
        checkThreshold(threshold);
        if (wpBefore == null || wpAfter == null) return false;
        return Math.abs(wpAfter - wpBefore) + EPSILON >= threshold;
    }

    private static void checkThreshold(double t) {
        if (Double.isNaN(t) || t < 0.0 || t > 1.0) throw new IllegalArgumentException("threshold must be within [0,1]: " + t);
    }
}
