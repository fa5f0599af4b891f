package com.thermoadvisor.domain.model.learning;

/**
 * Espacio de acciones del bandit: ajustes sobre la temperatura objetivo.
 * El orden de declaración es estable y se usa para desempatar Q-values
 * y como índice en las tablas de aprendizaje.
 */
public enum TemperatureAction {
    DECREASE_2(-2, "decrease_2"),
    DECREASE_1(-1, "decrease_1"),
    MAINTAIN(0, "maintain"),
    INCREASE_1(1, "increase_1"),
    INCREASE_2(2, "increase_2");

    private final int adjustment;
    private final String label;

    TemperatureAction(int adjustment, String label) {
        this.adjustment = adjustment;
        this.label = label;
    }

    public int getAdjustment() {
        return adjustment;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Busca la acción por su etiqueta persistida (ej. "increase_1").
     *
     * @throws IllegalArgumentException si la etiqueta no existe
     */
    public static TemperatureAction fromLabel(String label) {
        for (TemperatureAction action : values()) {
            if (action.label.equals(label)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Acción desconocida: " + label);
    }

    public static TemperatureAction fromAdjustment(int adjustment) {
        for (TemperatureAction action : values()) {
            if (action.adjustment == adjustment) {
                return action;
            }
        }
        throw new IllegalArgumentException("Ajuste fuera del espacio de acciones: " + adjustment);
    }
}
