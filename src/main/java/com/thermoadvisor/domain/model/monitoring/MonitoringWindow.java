package com.thermoadvisor.domain.model.monitoring;

import com.thermoadvisor.domain.model.Recommendation;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ventana de monitoreo de una recomendación aceptada.
 *
 * La resolución se hace con un compare-and-set desde ACTIVE: solo quien gana
 * el {@link #claim(WindowState)} puede aplicar la recompensa.
 */
public class MonitoringWindow {
    private final long id;
    private final String unitId;
    private final Recommendation recommendation;
    private final Instant armedAt;
    private final Instant deadline;
    private final AtomicReference<WindowState> state = new AtomicReference<>(WindowState.ACTIVE);
    private final AtomicReference<Cancellable> countdown = new AtomicReference<>();

    public MonitoringWindow(long id, String unitId, Recommendation recommendation, Instant armedAt, Duration duration) {
        this.id = id;
        this.unitId = unitId;
        this.recommendation = recommendation;
        this.armedAt = armedAt;
        this.deadline = armedAt.plus(duration);
    }

    /**
     * Intenta pasar de ACTIVE al estado terminal indicado.
     *
     * @return true solo para el único llamador que gana la transición
     */
    public boolean claim(WindowState target) {
        if (!target.isTerminal()) {
            throw new IllegalArgumentException("Una ventana solo puede resolverse a un estado terminal: " + target);
        }
        return state.compareAndSet(WindowState.ACTIVE, target);
    }

    void attachCountdown(Cancellable token) {
        countdown.set(token);
        // Si la ventana se resolvió antes de tener su token, cancelarlo ya
        if (state.get().isTerminal()) {
            token.cancel();
        }
    }

    void cancelCountdown() {
        Cancellable token = countdown.get();
        if (token != null) {
            token.cancel();
        }
    }

    public Duration elapsedAt(Instant instant) {
        return Duration.between(armedAt, instant);
    }

    public long getId() { return id; }
    public String getUnitId() { return unitId; }
    public Recommendation getRecommendation() { return recommendation; }
    public Instant getArmedAt() { return armedAt; }
    public Instant getDeadline() { return deadline; }
    public WindowState getState() { return state.get(); }
    public boolean isActive() { return state.get() == WindowState.ACTIVE; }

    @Override
    public String toString() {
        return "MonitoringWindow{" +
                "id=" + id +
                ", unitId='" + unitId + '\'' +
                ", armedAt=" + armedAt +
                ", deadline=" + deadline +
                ", state=" + state.get() +
                '}';
    }
}
