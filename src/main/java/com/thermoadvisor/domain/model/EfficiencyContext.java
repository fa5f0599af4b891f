package com.thermoadvisor.domain.model;

// Datos de eficiencia energética que acompañan a un pedido de recomendación (opcional)
public class EfficiencyContext {
    private final double efficiencyScore; // 0-100
    private final String level;           // ej. "excellent", "good", "poor"
    private final double powerConsumptionWatts;

    public EfficiencyContext(double efficiencyScore, String level, double powerConsumptionWatts) {
        this.efficiencyScore = efficiencyScore;
        this.level = level;
        this.powerConsumptionWatts = powerConsumptionWatts;
    }

    public double getEfficiencyScore() { return efficiencyScore; }
    public String getLevel() { return level; }
    public double getPowerConsumptionWatts() { return powerConsumptionWatts; }

    @Override
    public String toString() {
        return "EfficiencyContext{" +
                "efficiencyScore=" + efficiencyScore +
                ", level='" + level + '\'' +
                ", powerConsumptionWatts=" + powerConsumptionWatts +
                '}';
    }
}
