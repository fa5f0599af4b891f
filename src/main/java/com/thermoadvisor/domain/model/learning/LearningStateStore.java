package com.thermoadvisor.domain.model.learning;

import com.thermoadvisor.domain.model.persistence.AdaptationEventSnapshot;
import com.thermoadvisor.domain.model.persistence.QEntrySnapshot;
import com.thermoadvisor.domain.model.persistence.UnitSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dueño exclusivo de los {@link LearningState} de todas las unidades.
 *
 * Las operaciones sobre una misma unidad se serializan en el monitor de su
 * estado; unidades distintas no comparten locks.
 */
public class LearningStateStore {

    private static final Logger logger = LoggerFactory.getLogger(LearningStateStore.class);

    public static final double DEFAULT_LEARNING_RATE = 0.1;

    private final Map<String, LearningState> states = new ConcurrentHashMap<>();
    private final double learningRate;
    private final Clock clock;

    public LearningStateStore() {
        this(DEFAULT_LEARNING_RATE, Clock.systemUTC());
    }

    public LearningStateStore(double learningRate, Clock clock) {
        if (learningRate <= 0 || learningRate > 1) {
            throw new IllegalArgumentException("Learning rate fuera de rango: " + learningRate);
        }
        this.learningRate = learningRate;
        this.clock = clock;
    }

    public LearningState getOrCreate(String unitId) {
        return states.computeIfAbsent(unitId, id -> {
            logger.debug("Creando estado de aprendizaje para la unidad {}", id);
            return new LearningState(id, clock.instant());
        });
    }

    public Optional<LearningState> find(String unitId) {
        return Optional.ofNullable(states.get(unitId));
    }

    /**
     * Q-values de todas las acciones para el contexto, en el orden de
     * {@link TemperatureAction}. Inicializa las entradas nuevas con 0.5.
     */
    public double[] qValues(String unitId, ContextKey context) {
        return getOrCreate(unitId).qValues(context);
    }

    public QValueUpdate update(String unitId, ContextKey context, TemperatureAction action, double reward) {
        QValueUpdate result = getOrCreate(unitId).applyReward(context, action, reward, learningRate, clock.instant());
        logger.info("Q-value actualizado para la unidad {} [{} / {}]: {} -> {} (recompensa {})",
                unitId, context, action.getLabel(), result.getPreviousValue(), result.getNewValue(), reward);
        return result;
    }

    public boolean remove(String unitId) {
        return states.remove(unitId) != null;
    }

    public void clear() {
        states.clear();
    }

    public Set<String> unitIds() {
        return Set.copyOf(states.keySet());
    }

    public int size() {
        return states.size();
    }

    public double getLearningRate() {
        return learningRate;
    }

    // --- Conversión al esquema persistido ---

    public Map<String, UnitSnapshot> snapshot() {
        Map<String, UnitSnapshot> units = new LinkedHashMap<>();
        for (LearningState state : states.values()) {
            units.put(state.getUnitId(), toSnapshot(state));
        }
        return units;
    }

    private UnitSnapshot toSnapshot(LearningState state) {
        // Se toma el monitor de la unidad para que la tabla y los contadores sean coherentes
        synchronized (state) {
            Map<ContextKey, int[]> visits = state.visitCountsCopy();
            List<QEntrySnapshot> entries = new ArrayList<>();
            state.qTableCopy().forEach((context, row) -> {
                int[] counts = visits.get(context);
                for (TemperatureAction action : TemperatureAction.values()) {
                    entries.add(QEntrySnapshot.builder()
                            .outdoorBand(context.getOutdoorBand())
                            .targetBand(context.getTargetBand())
                            .roomCategory(context.getRoomCategory())
                            .action(action.getLabel())
                            .value(row[action.ordinal()])
                            .visits(counts == null ? 0 : counts[action.ordinal()])
                            .build());
                }
            });

            List<AdaptationEventSnapshot> history = new ArrayList<>();
            for (AdaptationEvent event : state.getAdaptationHistory()) {
                history.add(AdaptationEventSnapshot.builder()
                        .timestamp(event.getTimestamp().toEpochMilli())
                        .adjustment(event.getAdjustment())
                        .reward(event.getReward())
                        .newBias(event.getNewBias())
                        .build());
            }

            return UnitSnapshot.builder()
                    .entries(entries)
                    .totalRecommendations(state.getTotalRecommendations())
                    .successfulRecommendations(state.getSuccessfulRecommendations())
                    .personalizedBias(state.getPersonalizedBias())
                    .lastUpdate(state.getLastUpdate() != null ? state.getLastUpdate().toEpochMilli() : null)
                    .adaptationHistory(history)
                    .build();
        }
    }

    /**
     * Reemplaza el contenido del store con las unidades de un snapshot.
     * Las entradas con acciones desconocidas se ignoran con un warning.
     */
    public void restore(Map<String, UnitSnapshot> units) {
        states.clear();
        if (units == null) {
            return;
        }
        units.forEach((unitId, unit) -> {
            if (unitId == null || unit == null) {
                return;
            }
            LearningState state = new LearningState(unitId, clock.instant());
            if (unit.getEntries() != null) {
                for (QEntrySnapshot entry : unit.getEntries()) {
                    try {
                        ContextKey context = new ContextKey(entry.getOutdoorBand(), entry.getTargetBand(), entry.getRoomCategory());
                        state.restoreEntry(context, TemperatureAction.fromLabel(entry.getAction()), entry.getValue(), entry.getVisits());
                    } catch (IllegalArgumentException | NullPointerException e) {
                        logger.warn("Entrada de tabla Q inválida para la unidad {}: {} ({})", unitId, entry, e.getMessage());
                    }
                }
            }
            List<AdaptationEvent> history = new ArrayList<>();
            if (unit.getAdaptationHistory() != null) {
                for (AdaptationEventSnapshot event : unit.getAdaptationHistory()) {
                    history.add(new AdaptationEvent(Instant.ofEpochMilli(event.getTimestamp()),
                            event.getAdjustment(), event.getReward(), event.getNewBias()));
                }
            }
            state.restoreCounters(
                    unit.getTotalRecommendations(),
                    unit.getSuccessfulRecommendations(),
                    unit.getPersonalizedBias(),
                    unit.getLastUpdate() != null ? Instant.ofEpochMilli(unit.getLastUpdate()) : null,
                    history);
            states.put(unitId, state);
        });
        logger.info("Estado de aprendizaje restaurado para {} unidades", states.size());
    }
}
