package com.thermoadvisor.domain.model.engine;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

// Estadísticas de aprendizaje de una unidad
@Value
@Builder
public class UnitStatistics {
    String unitId;
    long totalRecommendations;
    long successfulRecommendations;
    double successRate;        // porcentaje, dos decimales
    double personalizedBias;
    int exploredContexts;
    double currentEpsilon;
    Instant lastUpdate;
    boolean monitoringActive;
}
