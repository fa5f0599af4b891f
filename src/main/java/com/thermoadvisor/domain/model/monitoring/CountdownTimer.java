package com.thermoadvisor.domain.model.monitoring;

import java.time.Duration;

/**
 * Abstracción de temporizador para las ventanas de monitoreo.
 * Cada cuenta regresiva programada devuelve su propio token de cancelación.
 */
public interface CountdownTimer {

    Cancellable schedule(Runnable task, Duration delay);

    // Libera los recursos del temporizador (threads, colas)
    default void shutdown() {
    }
}
