package com.thermoadvisor.domain.model.engine;

import com.thermoadvisor.domain.model.EfficiencyContext;
import com.thermoadvisor.domain.model.Recommendation;
import com.thermoadvisor.domain.model.activity.ActivityLogger;
import com.thermoadvisor.domain.model.activity.RecommendationApplicationRecord;
import com.thermoadvisor.domain.model.learning.ExplorationRate;
import com.thermoadvisor.domain.model.learning.LearningState;
import com.thermoadvisor.domain.model.learning.LearningStateStore;
import com.thermoadvisor.domain.model.learning.PolicyEngine;
import com.thermoadvisor.domain.model.monitoring.CountdownTimer;
import com.thermoadvisor.domain.model.monitoring.MonitoringWindow;
import com.thermoadvisor.domain.model.monitoring.RewardScheduler;
import com.thermoadvisor.domain.model.persistence.LearningSnapshot;
import com.thermoadvisor.domain.model.persistence.PersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Motor de recomendaciones de temperatura (bandit contextual epsilon-greedy).
 *
 * Es el punto de entrada del dominio: genera recomendaciones, recibe los eventos
 * de la aplicación (recomendación aplicada, cambio manual, unidad seleccionada)
 * y coordina la actualización del aprendizaje y su persistencia.
 *
 * Flujo:
 * 1. getRecommendation() → la recomendación queda pendiente para la unidad
 * 2. onRecommendationApplied() → se arma una ventana de monitoreo
 * 3. la ventana se resuelve una sola vez (timeout +0.5 / ajuste manual -0.5)
 * 4. se actualiza el store, decae epsilon y se guarda un snapshot (asíncrono)
 */
public class TemperatureRecommendationEngine {

    private static final Logger logger = LoggerFactory.getLogger(TemperatureRecommendationEngine.class);

    private final LearningStateStore store;
    private final ExplorationRate explorationRate;
    private final PolicyEngine policyEngine;
    private final RewardScheduler rewardScheduler;
    private final PersistenceGateway persistenceGateway;
    private final ActivityLogger activityLogger;
    private final Clock clock;

    private final Map<String, Recommendation> pendingRecommendations = new ConcurrentHashMap<>();
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicLong snapshotSequence = new AtomicLong();
    private volatile Instant startedAt;

    public TemperatureRecommendationEngine(LearningStateStore store,
                                           ExplorationRate explorationRate,
                                           PolicyEngine policyEngine,
                                           CountdownTimer countdownTimer,
                                           Duration monitoringWindow,
                                           PersistenceGateway persistenceGateway,
                                           ActivityLogger activityLogger,
                                           Clock clock) {
        this.store = store;
        this.explorationRate = explorationRate;
        this.policyEngine = policyEngine;
        this.persistenceGateway = persistenceGateway;
        this.activityLogger = activityLogger;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.rewardScheduler = new RewardScheduler(countdownTimer, monitoringWindow, this::applyReward, activityLogger, clock);
    }

    /**
     * Carga el aprendizaje persistido. Si falla, el motor queda vacío pero funcional.
     */
    public void initialize() {
        try {
            LearningSnapshot snapshot = persistenceGateway.load();
            if (snapshot != null) {
                store.restore(snapshot.getUnits());
                if (snapshot.getEpsilon() != null) {
                    explorationRate.restore(snapshot.getEpsilon());
                }
                snapshotSequence.set(Math.max(snapshotSequence.get(), snapshot.getSequence()));
            }
        } catch (RuntimeException e) {
            logger.warn("No se pudo cargar el aprendizaje persistido, se inicia vacío: {}", e.getMessage());
            store.clear();
            explorationRate.reset();
        }
        startedAt = clock.instant();
        initialized.set(true);
        logger.info("Motor de recomendaciones inicializado: {} unidades, epsilon {}", store.size(), explorationRate.current());
    }

    /**
     * Genera una recomendación. Nunca falla: ante errores devuelve un fallback.
     */
    public Recommendation getRecommendation(String unitId, double outdoorTemperature, double currentTarget,
                                            EfficiencyContext efficiencyContext) {
        Recommendation recommendation = policyEngine.recommend(unitId, outdoorTemperature, currentTarget, efficiencyContext);
        // Los fallbacks no tienen contexto aprendido, así que no se monitorean;
        // además invalidan la recomendación pendiente anterior de la unidad
        if (recommendation.isFallback()) {
            pendingRecommendations.remove(unitId);
        } else {
            pendingRecommendations.put(unitId, recommendation);
        }
        return recommendation;
    }

    /**
     * Evento "recommendation-applied": el usuario aceptó la última recomendación
     * de la unidad. Se registra la aplicación y se arma la ventana de monitoreo.
     *
     * @return true si había una recomendación pendiente y se armó la ventana
     */
    public boolean onRecommendationApplied(String unitId, double recommendedTemperature, String appliedBy) {
        if (unitId == null) {
            logger.warn("Evento recommendation-applied sin id de unidad");
            return false;
        }
        Recommendation recommendation = pendingRecommendations.remove(unitId);
        if (recommendation == null) {
            logger.warn("No hay recomendación pendiente para la unidad {}", unitId);
            return false;
        }

        notifySafely(() -> activityLogger.logRecommendationApplication(RecommendationApplicationRecord.builder()
                .unitId(unitId)
                .originalTemp(recommendation.getCurrentTemperature())
                .recommendedTemp(recommendedTemperature)
                .appliedBy(appliedBy != null ? appliedBy : "user")
                .confidence(recommendation.getConfidence())
                .context(String.valueOf(recommendation.getContext()))
                .energySavings(recommendation.getEnergySavings())
                .explorationReason(recommendation.getExplorationReason().name())
                .timestamp(clock.instant().toEpochMilli())
                .build()));

        Optional<MonitoringWindow> superseded = rewardScheduler.arm(unitId, recommendation);
        superseded.ifPresent(window -> logger.info(
                "La recomendación aplicada en {} reemplazó la ventana {} sin recompensa", unitId, window.getId()));
        return true;
    }

    /**
     * Evento "temperature-manually-changed".
     *
     * @return true si el cambio resolvió una ventana activa (recompensa negativa)
     */
    public boolean onTemperatureManuallyChanged(String unitId, double newTemperature, double previousTemperature,
                                                String changedBy) {
        if (unitId == null) {
            logger.warn("Evento temperature-manually-changed sin id de unidad");
            return false;
        }
        return rewardScheduler.onManualAdjustment(unitId, newTemperature, previousTemperature, changedBy);
    }

    /**
     * Evento "entity-selected": solo informativo.
     */
    public void onUnitSelected(String unitId) {
        logger.info("Unidad seleccionada: {}", unitId);
    }

    /**
     * Aplica una recompensa resuelta por el RewardScheduler.
     */
    void applyReward(String unitId, Recommendation recommendation, double reward) {
        store.update(unitId, recommendation.getContext(), recommendation.getAction(), reward);
        double epsilon = explorationRate.decay();
        logger.debug("Epsilon tras la recompensa: {}", epsilon);
        saveAsync();
    }

    public Optional<UnitStatistics> getStatistics(String unitId) {
        Optional<LearningState> found = store.find(unitId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        LearningState state = found.get();
        long total;
        long successful;
        double bias;
        int explored;
        Instant lastUpdate;
        synchronized (state) {
            total = state.getTotalRecommendations();
            successful = state.getSuccessfulRecommendations();
            bias = state.getPersonalizedBias();
            explored = state.getExploredContexts();
            lastUpdate = state.getLastUpdate();
        }
        return Optional.of(UnitStatistics.builder()
                .unitId(unitId)
                .totalRecommendations(total)
                .successfulRecommendations(successful)
                .successRate(percent(successful, total))
                .personalizedBias(round(bias, 2))
                .exploredContexts(explored)
                .currentEpsilon(explorationRate.current())
                .lastUpdate(lastUpdate)
                .monitoringActive(rewardScheduler.activeWindow(unitId).isPresent())
                .build());
    }

    public AggregateStatistics getStatistics() {
        long total = 0;
        long successful = 0;
        int explored = 0;
        int units = 0;
        for (String unitId : store.unitIds()) {
            Optional<LearningState> state = store.find(unitId);
            if (state.isPresent()) {
                units++;
                total += state.get().getTotalRecommendations();
                successful += state.get().getSuccessfulRecommendations();
                explored += state.get().getExploredContexts();
            }
        }
        return AggregateStatistics.builder()
                .totalUnits(units)
                .totalRecommendations(total)
                .totalSuccessful(successful)
                .overallSuccessRate(percent(successful, total))
                .exploredContexts(explored)
                .currentEpsilon(explorationRate.current())
                .uptime(Duration.between(startedAt, clock.instant()))
                .build();
    }

    /**
     * Borra el aprendizaje de una unidad. Antes cancela su ventana de monitoreo.
     */
    public void resetLearningData(String unitId) {
        boolean cancelled = rewardScheduler.cancel(unitId);
        pendingRecommendations.remove(unitId);
        boolean removed = store.remove(unitId);
        logger.info("Aprendizaje reiniciado para la unidad {} (estado previo: {}, ventana cancelada: {})",
                unitId, removed, cancelled);
        saveAsync();
    }

    /**
     * Borra todo el aprendizaje y restablece la tasa de exploración inicial.
     * Antes cancela todas las ventanas activas.
     */
    public void resetLearningData() {
        int cancelled = rewardScheduler.cancelAll();
        pendingRecommendations.clear();
        store.clear();
        explorationRate.reset();
        logger.info("Todo el aprendizaje fue reiniciado ({} ventanas canceladas)", cancelled);
        saveAsync();
    }

    public SystemStatus getSystemStatus() {
        return SystemStatus.builder()
                .initialized(initialized.get())
                .epsilon(explorationRate.current())
                .totalUnits(store.size())
                .pendingRecommendations(pendingRecommendations.size())
                .activeWindows(rewardScheduler.activeWindowCount())
                .acceptedWindows(rewardScheduler.getAcceptedWindows())
                .overriddenWindows(rewardScheduler.getOverriddenWindows())
                .supersededWindows(rewardScheduler.getSupersededWindows())
                .pendingSaves(persistenceGateway.pendingSaves())
                .droppedSaves(persistenceGateway.droppedSaves())
                .activityLoggerAvailable(activityLogger != null)
                .build();
    }

    public LearningSnapshot snapshot() {
        return LearningSnapshot.builder()
                .version(LearningSnapshot.CURRENT_VERSION)
                .epsilon(explorationRate.current())
                .timestamp(clock.instant().toEpochMilli())
                .sequence(snapshotSequence.incrementAndGet())
                .units(store.snapshot())
                .build();
    }

    /**
     * Cancela las ventanas activas (sin recompensa) y detiene el temporizador.
     */
    public void shutdown() {
        rewardScheduler.shutdown();
        initialized.set(false);
    }

    private void saveAsync() {
        try {
            persistenceGateway.save(snapshot());
        } catch (RuntimeException e) {
            logger.warn("No se pudo encolar el guardado del aprendizaje: {}", e.getMessage());
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

    private static double percent(long part, long total) {
        if (total == 0) {
            return 0.0;
        }
        return round((double) part / total * 100.0, 2);
    }

    private static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

    public boolean isInitialized() { return initialized.get(); }
    public RewardScheduler getRewardScheduler() { return rewardScheduler; }
    public LearningStateStore getStore() { return store; }
    public ExplorationRate getExplorationRate() { return explorationRate; }
    public Optional<Recommendation> pendingRecommendation(String unitId) {
        return Optional.ofNullable(pendingRecommendations.get(unitId));
    }
}
