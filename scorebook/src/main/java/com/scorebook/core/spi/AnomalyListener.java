package com.scorebook.core.spi;

import com.scorebook.core.model.Anomaly;

@FunctionalInterface
public interface AnomalyListener {
    void onAnomaly(Anomaly anomaly);
}
