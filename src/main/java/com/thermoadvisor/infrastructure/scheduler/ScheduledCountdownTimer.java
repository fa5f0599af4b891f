package com.thermoadvisor.infrastructure.scheduler;

import com.thermoadvisor.domain.model.monitoring.Cancellable;
import com.thermoadvisor.domain.model.monitoring.CountdownTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Temporizador de las ventanas de monitoreo basado en un ScheduledThreadPoolExecutor.
 * Las tareas canceladas se quitan de la cola para no acumular ventanas viejas.
 */
public class ScheduledCountdownTimer implements CountdownTimer {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledCountdownTimer.class);

    private final ScheduledThreadPoolExecutor scheduler;

    public ScheduledCountdownTimer() {
        this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "monitoring-window-timer");
            t.setDaemon(true);
            return t;
        });
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Error al cerrar una ventana de monitoreo: {}", e.getMessage(), e);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    public int queuedCountdowns() {
        return scheduler.getQueue().size();
    }

    @Override
    public void shutdown() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("El temporizador de ventanas no terminó a tiempo");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
