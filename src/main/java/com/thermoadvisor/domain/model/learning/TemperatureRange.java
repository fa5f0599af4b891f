package com.thermoadvisor.domain.model.learning;

// Rango semiabierto [min, max) con una etiqueta estable
public class TemperatureRange {
    private final double min;
    private final double max;
    private final String label;

    public TemperatureRange(double min, double max, String label) {
        if (!(min < max)) {
            throw new IllegalArgumentException("Rango inválido [" + min + ", " + max + ") para " + label);
        }
        this.min = min;
        this.max = max;
        this.label = label;
    }

    public boolean contains(double temperature) {
        return temperature >= min && temperature < max;
    }

    public double getMin() { return min; }
    public double getMax() { return max; }
    public String getLabel() { return label; }

    @Override
    public String toString() {
        return "TemperatureRange{" +
                "[" + min + ", " + max + ")" +
                ", label='" + label + '\'' +
                '}';
    }
}
