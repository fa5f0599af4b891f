package com.thermoadvisor.domain.model.learning;

/**
 * Tasa de exploración (epsilon) compartida por todas las unidades.
 * Decae de forma multiplicativa tras cada recompensa aplicada, con un piso mínimo.
 */
public class ExplorationRate {

    public static final double DEFAULT_INITIAL = 0.1;
    public static final double DEFAULT_DECAY = 0.995;
    public static final double DEFAULT_MINIMUM = 0.01;

    private final double initial;
    private final double decay;
    private final double minimum;
    private double current;

    public ExplorationRate() {
        this(DEFAULT_INITIAL, DEFAULT_DECAY, DEFAULT_MINIMUM);
    }

    public ExplorationRate(double initial, double decay, double minimum) {
        if (initial < 0 || initial > 1 || decay <= 0 || decay > 1 || minimum < 0 || minimum > initial) {
            throw new IllegalArgumentException(
                    "Parámetros de exploración inválidos: initial=" + initial + ", decay=" + decay + ", min=" + minimum);
        }
        this.initial = initial;
        this.decay = decay;
        this.minimum = minimum;
        this.current = initial;
    }

    public synchronized double current() {
        return current;
    }

    /**
     * Aplica un paso de decaimiento y devuelve el nuevo valor.
     */
    public synchronized double decay() {
        current = Math.max(minimum, current * decay);
        return current;
    }

    public synchronized void reset() {
        current = initial;
    }

    // Restaura un valor persistido, acotado a [minimum, 1]
    public synchronized void restore(double value) {
        if (Double.isNaN(value)) {
            current = initial;
            return;
        }
        current = Math.max(minimum, Math.min(1.0, value));
    }

    public double getInitial() { return initial; }
    public double getDecay() { return decay; }
    public double getMinimum() { return minimum; }
}
