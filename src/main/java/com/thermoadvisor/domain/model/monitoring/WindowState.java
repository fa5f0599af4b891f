package com.thermoadvisor.domain.model.monitoring;

/**
 * Estados de una ventana de monitoreo.
 * ACTIVE es el único estado no terminal:
 * - ACCEPTED: venció la cuenta regresiva sin ajustes manuales (recompensa positiva)
 * - OVERRIDDEN: el usuario cambió la temperatura dentro de la ventana (recompensa negativa)
 * - DISCARDED: reemplazada por una nueva ventana o cancelada por un reset (sin recompensa)
 */
public enum WindowState {
    ACTIVE,
    ACCEPTED,
    OVERRIDDEN,
    DISCARDED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
