package com.thermoadvisor.domain.model.learning;

// Resultado de aplicar una recompensa: Q-value anterior y nuevo, y el sesgo resultante
public class QValueUpdate {
    private final double previousValue;
    private final double newValue;
    private final double personalizedBias;

    public QValueUpdate(double previousValue, double newValue, double personalizedBias) {
        this.previousValue = previousValue;
        this.newValue = newValue;
        this.personalizedBias = personalizedBias;
    }

    public double getPreviousValue() { return previousValue; }
    public double getNewValue() { return newValue; }
    public double getPersonalizedBias() { return personalizedBias; }
}
