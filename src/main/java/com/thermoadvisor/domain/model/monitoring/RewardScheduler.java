package com.thermoadvisor.domain.model.monitoring;

import com.thermoadvisor.domain.model.Recommendation;
import com.thermoadvisor.domain.model.activity.ActivityLogger;
import com.thermoadvisor.domain.model.activity.ManualAdjustmentRecord;
import com.thermoadvisor.domain.model.activity.SuccessfulRecommendationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Administra las ventanas de monitoreo de recompensa diferida.
 *
 * Cuando una recomendación se aplica se arma una ventana de duración fija.
 * La ventana se resuelve una única vez:
 * - si vence la cuenta regresiva sin ajustes manuales: recompensa +0.5
 * - si llega un ajuste manual antes: recompensa -0.5
 *
 * Ambos caminos compiten por la ventana con un compare-and-set, así que
 * aunque el timeout y el ajuste manual lleguen a la vez se aplica una sola recompensa.
 */
public class RewardScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RewardScheduler.class);

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);
    public static final double ACCEPTED_REWARD = 0.5;
    public static final double OVERRIDE_REWARD = -0.5;

    private final Map<String, MonitoringWindow> activeWindows = new ConcurrentHashMap<>();
    private final AtomicLong windowSequence = new AtomicLong();

    private final AtomicLong acceptedWindows = new AtomicLong();
    private final AtomicLong overriddenWindows = new AtomicLong();
    private final AtomicLong supersededWindows = new AtomicLong();

    private final CountdownTimer timer;
    private final Duration windowDuration;
    private final RewardApplier rewardApplier;
    private final ActivityLogger activityLogger;
    private final Clock clock;

    public RewardScheduler(CountdownTimer timer, Duration windowDuration, RewardApplier rewardApplier,
                           ActivityLogger activityLogger, Clock clock) {
        if (windowDuration == null || windowDuration.isNegative() || windowDuration.isZero()) {
            throw new IllegalArgumentException("La duración de la ventana debe ser positiva: " + windowDuration);
        }
        this.timer = timer;
        this.windowDuration = windowDuration;
        this.rewardApplier = rewardApplier;
        this.activityLogger = activityLogger;
        this.clock = clock;
    }

    /**
     * Arma una ventana de monitoreo para la unidad. Si ya había una activa se
     * descarta explícitamente (se cancela su cuenta regresiva y no recibe recompensa).
     *
     * @return la ventana reemplazada, si la había
     */
    public Optional<MonitoringWindow> arm(String unitId, Recommendation recommendation) {
        MonitoringWindow window = new MonitoringWindow(
                windowSequence.incrementAndGet(), unitId, recommendation, clock.instant(), windowDuration);

        MonitoringWindow previous = activeWindows.put(unitId, window);
        Optional<MonitoringWindow> superseded = Optional.empty();
        if (previous != null && previous.claim(WindowState.DISCARDED)) {
            previous.cancelCountdown();
            supersededWindows.incrementAndGet();
            logger.warn("Ventana {} de la unidad {} reemplazada por una nueva recomendación; se descarta sin recompensa",
                    previous.getId(), unitId);
            superseded = Optional.of(previous);
        }

        window.attachCountdown(timer.schedule(() -> onCountdownExpired(window), windowDuration));
        logger.info("Ventana de monitoreo {} armada para la unidad {} (vence {})",
                window.getId(), unitId, window.getDeadline());
        return superseded;
    }

    /**
     * Procesa un cambio manual de temperatura. Si hay una ventana activa para
     * la unidad y este llamador gana el claim, aplica la recompensa negativa.
     *
     * @return true si este evento resolvió una ventana
     */
    public boolean onManualAdjustment(String unitId, double newTemperature, double previousTemperature, String changedBy) {
        MonitoringWindow window = activeWindows.get(unitId);
        if (window == null) {
            logger.debug("Ajuste manual en la unidad {} sin ventana de monitoreo activa", unitId);
            return false;
        }
        if (!window.claim(WindowState.OVERRIDDEN)) {
            logger.debug("La ventana {} ya estaba resuelta ({}); se ignora el ajuste manual", window.getId(), window.getState());
            return false;
        }
        window.cancelCountdown();
        activeWindows.remove(unitId, window);
        overriddenWindows.incrementAndGet();

        Instant now = clock.instant();
        Recommendation recommendation = window.getRecommendation();
        applyReward(window, OVERRIDE_REWARD);

        // Sin temperatura previa informada, se toma la que dejó la recomendación
        double previous = Double.isNaN(previousTemperature) ? recommendation.getRecommendedTemperature() : previousTemperature;

        notifySafely(() -> activityLogger.logManualAdjustment(ManualAdjustmentRecord.builder()
                .unitId(unitId)
                .recommendedTemp(recommendation.getRecommendedTemperature())
                .adjustedTemp(newTemperature)
                .previousTemp(previous)
                .adjustmentTimeMs(window.elapsedAt(now).toMillis())
                .changedBy(changedBy != null ? changedBy : "user")
                .adjustmentDirection(ManualAdjustmentRecord.directionOf(previous, newTemperature))
                .context(String.valueOf(recommendation.getContext()))
                .timestamp(now.toEpochMilli())
                .build()));

        logger.info("Recompensa negativa aplicada: ajuste manual en la unidad {} dentro de la ventana {}", unitId, window.getId());
        return true;
    }

    /**
     * Callback de la cuenta regresiva. Si gana el claim, aplica la recompensa positiva.
     *
     * @return true si este vencimiento resolvió la ventana
     */
    boolean onCountdownExpired(MonitoringWindow window) {
        if (!window.claim(WindowState.ACCEPTED)) {
            logger.debug("Cuenta regresiva de la ventana {} vencida pero ya estaba resuelta ({})",
                    window.getId(), window.getState());
            return false;
        }
        activeWindows.remove(window.getUnitId(), window);
        acceptedWindows.incrementAndGet();

        Recommendation recommendation = window.getRecommendation();
        applyReward(window, ACCEPTED_REWARD);

        notifySafely(() -> activityLogger.logSuccessfulRecommendation(SuccessfulRecommendationRecord.builder()
                .unitId(window.getUnitId())
                .recommendedTemp(recommendation.getRecommendedTemperature())
                .adjustment(recommendation.getAdjustment())
                .sustainedDurationMs(windowDuration.toMillis())
                .energySavings(recommendation.getEnergySavings())
                .context(String.valueOf(recommendation.getContext()))
                .timestamp(clock.instant().toEpochMilli())
                .build()));

        logger.info("Recompensa positiva aplicada: recomendación sostenida en la unidad {} (ventana {})",
                window.getUnitId(), window.getId());
        return true;
    }

    /**
     * Descarta la ventana activa de la unidad, cancelando su cuenta regresiva.
     */
    public boolean cancel(String unitId) {
        MonitoringWindow window = activeWindows.remove(unitId);
        if (window == null || !window.claim(WindowState.DISCARDED)) {
            return false;
        }
        window.cancelCountdown();
        logger.info("Ventana de monitoreo {} de la unidad {} cancelada", window.getId(), unitId);
        return true;
    }

    /**
     * Descarta todas las ventanas activas.
     *
     * @return cantidad de ventanas canceladas
     */
    public int cancelAll() {
        int cancelled = 0;
        for (String unitId : List.copyOf(activeWindows.keySet())) {
            if (cancel(unitId)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public void shutdown() {
        int cancelled = cancelAll();
        timer.shutdown();
        logger.info("RewardScheduler detenido ({} ventanas canceladas)", cancelled);
    }

    private void applyReward(MonitoringWindow window, double reward) {
        try {
            rewardApplier.applyReward(window.getUnitId(), window.getRecommendation(), reward);
        } catch (RuntimeException e) {
            logger.error("Error aplicando recompensa {} a la unidad {}: {}", reward, window.getUnitId(), e.getMessage(), e);
        }
    }

    private void notifySafely(Runnable notification) {
        if (activityLogger == null) {
            return;
        }
        try {
            notification.run();
        } catch (RuntimeException e) {
            logger.warn("No se pudo registrar la actividad: {}", e.getMessage());
        }
    }

    public Optional<MonitoringWindow> activeWindow(String unitId) {
        return Optional.ofNullable(activeWindows.get(unitId));
    }

    public int activeWindowCount() {
        return activeWindows.size();
    }

    public long getAcceptedWindows() { return acceptedWindows.get(); }
    public long getOverriddenWindows() { return overriddenWindows.get(); }
    public long getSupersededWindows() { return supersededWindows.get(); }
    public Duration getWindowDuration() { return windowDuration; }
}
