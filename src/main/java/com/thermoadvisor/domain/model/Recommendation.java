package com.thermoadvisor.domain.model;

import com.thermoadvisor.domain.model.learning.ContextKey;
import com.thermoadvisor.domain.model.learning.TemperatureAction;

import java.time.Instant;

/**
 * Recomendación de temperatura generada por el motor. Es efímera: solo se
 * conserva mientras está pendiente de aplicación o dentro de una ventana de monitoreo.
 */
public class Recommendation {
    private final String unitId;
    private final TemperatureAction action;
    private final double currentTemperature;
    private final double recommendedTemperature;
    private final double confidence;
    private final double energySavings; // porcentaje estimado, 0-30
    private final ContextKey context;   // null en las recomendaciones de fallback
    private final ExplorationReason explorationReason;
    private final Instant timestamp;

    public Recommendation(String unitId, TemperatureAction action, double currentTemperature,
                          double recommendedTemperature, double confidence, double energySavings,
                          ContextKey context, ExplorationReason explorationReason, Instant timestamp) {
        this.unitId = unitId;
        this.action = action;
        this.currentTemperature = currentTemperature;
        this.recommendedTemperature = recommendedTemperature;
        this.confidence = confidence;
        this.energySavings = energySavings;
        this.context = context;
        this.explorationReason = explorationReason;
        this.timestamp = timestamp;
    }

    public String getUnitId() { return unitId; }
    public TemperatureAction getAction() { return action; }
    public int getAdjustment() { return action.getAdjustment(); }
    public double getCurrentTemperature() { return currentTemperature; }
    public double getRecommendedTemperature() { return recommendedTemperature; }
    public double getConfidence() { return confidence; }
    public double getEnergySavings() { return energySavings; }
    public ContextKey getContext() { return context; }
    public ExplorationReason getExplorationReason() { return explorationReason; }
    public Instant getTimestamp() { return timestamp; }

    public boolean isFallback() {
        return explorationReason == ExplorationReason.FALLBACK;
    }

    @Override
    public String toString() {
        return "Recommendation{" +
                "unitId='" + unitId + '\'' +
                ", action=" + action +
                ", currentTemperature=" + currentTemperature +
                ", recommendedTemperature=" + recommendedTemperature +
                ", confidence=" + confidence +
                ", energySavings=" + energySavings +
                ", context=" + context +
                ", explorationReason=" + explorationReason +
                ", timestamp=" + timestamp +
                '}';
    }
}
