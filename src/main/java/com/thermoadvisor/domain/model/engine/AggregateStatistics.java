package com.thermoadvisor.domain.model.engine;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

// Estadísticas globales sobre todas las unidades
@Value
@Builder
public class AggregateStatistics {
    int totalUnits;
    long totalRecommendations;
    long totalSuccessful;
    double overallSuccessRate; // porcentaje, dos decimales
    int exploredContexts;
    double currentEpsilon;
    Duration uptime;
}
