package com.thermoadvisor.domain.model.learning;

import java.time.Instant;

// Registro de una adaptación del sesgo personalizado tras aplicar una recompensa
public class AdaptationEvent {
    private final Instant timestamp;
    private final int adjustment;
    private final double reward;
    private final double newBias;

    public AdaptationEvent(Instant timestamp, int adjustment, double reward, double newBias) {
        this.timestamp = timestamp;
        this.adjustment = adjustment;
        this.reward = reward;
        this.newBias = newBias;
    }

    public Instant getTimestamp() { return timestamp; }
    public int getAdjustment() { return adjustment; }
    public double getReward() { return reward; }
    public double getNewBias() { return newBias; }

    @Override
    public String toString() {
        return "AdaptationEvent{" +
                "timestamp=" + timestamp +
                ", adjustment=" + adjustment +
                ", reward=" + reward +
                ", newBias=" + newBias +
                '}';
    }
}
