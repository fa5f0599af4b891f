package com.thermoadvisor.domain.model.learning;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Estado de aprendizaje de una unidad de aire acondicionado.
 *
 * Las tablas se indexan por {@link ContextKey} y por el ordinal de
 * {@link TemperatureAction}. Todos los accesos se sincronizan sobre la
 * propia instancia, de modo que las actualizaciones de una misma unidad
 * quedan serializadas mientras que unidades distintas avanzan en paralelo.
 */
public class LearningState {

    public static final double OPTIMISTIC_Q_VALUE = 0.5;
    public static final int MAX_HISTORY = 100;
    public static final double MAX_BIAS = 2.0;

    private static final int ACTION_COUNT = TemperatureAction.values().length;

    private final String unitId;
    private final Map<ContextKey, double[]> qTable = new LinkedHashMap<>();
    private final Map<ContextKey, int[]> visitCounts = new LinkedHashMap<>();
    private final Deque<AdaptationEvent> adaptationHistory = new ArrayDeque<>();

    private long totalRecommendations;
    private long successfulRecommendations;
    private double personalizedBias;
    private Instant lastUpdate;

    public LearningState(String unitId, Instant createdAt) {
        this.unitId = unitId;
        this.lastUpdate = createdAt;
    }

    /**
     * Devuelve una copia de los Q-values del contexto, inicializando con el valor
     * optimista las entradas que todavía no existen.
     */
    public synchronized double[] qValues(ContextKey context) {
        return Arrays.copyOf(qRow(context), ACTION_COUNT);
    }

    public synchronized int visitCount(ContextKey context, TemperatureAction action) {
        int[] counts = visitCounts.get(context);
        return counts == null ? 0 : counts[action.ordinal()];
    }

    /**
     * Regla de actualización del bandit: Q = Q + α·(r − Q), más contadores,
     * sesgo personalizado e historial de adaptación.
     */
    public synchronized QValueUpdate applyReward(ContextKey context, TemperatureAction action,
                                                 double reward, double learningRate, Instant now) {
        double[] row = qRow(context);
        int index = action.ordinal();
        double previous = row[index];
        double updated = previous + learningRate * (reward - previous);
        row[index] = updated;

        visitCounts.computeIfAbsent(context, k -> new int[ACTION_COUNT])[index]++;

        totalRecommendations++;
        if (reward > 0) {
            successfulRecommendations++;
            personalizedBias += action.getAdjustment() * 0.1;
        } else {
            personalizedBias -= action.getAdjustment() * 0.05;
        }
        personalizedBias = clamp(personalizedBias, -MAX_BIAS, MAX_BIAS);

        adaptationHistory.addLast(new AdaptationEvent(now, action.getAdjustment(), reward, personalizedBias));
        while (adaptationHistory.size() > MAX_HISTORY) {
            adaptationHistory.removeFirst();
        }
        lastUpdate = now;

        return new QValueUpdate(previous, updated, personalizedBias);
    }

    private double[] qRow(ContextKey context) {
        return qTable.computeIfAbsent(context, k -> {
            double[] row = new double[ACTION_COUNT];
            Arrays.fill(row, OPTIMISTIC_Q_VALUE);
            return row;
        });
    }

    // --- Restauración desde un snapshot persistido ---

    synchronized void restoreEntry(ContextKey context, TemperatureAction action, double qValue, int visits) {
        qRow(context)[action.ordinal()] = qValue;
        if (visits > 0) {
            visitCounts.computeIfAbsent(context, k -> new int[ACTION_COUNT])[action.ordinal()] = visits;
        }
    }

    synchronized void restoreCounters(long total, long successful, double bias, Instant lastUpdate,
                                      List<AdaptationEvent> history) {
        this.totalRecommendations = Math.max(0, total);
        this.successfulRecommendations = Math.max(0, Math.min(successful, this.totalRecommendations));
        this.personalizedBias = clamp(bias, -MAX_BIAS, MAX_BIAS);
        if (lastUpdate != null) {
            this.lastUpdate = lastUpdate;
        }
        adaptationHistory.clear();
        if (history != null) {
            int skip = Math.max(0, history.size() - MAX_HISTORY);
            history.stream().skip(skip).forEach(adaptationHistory::addLast);
        }
    }

    /**
     * Vista inmutable de la tabla: contexto → Q-values y visitas por acción.
     */
    public synchronized Map<ContextKey, double[]> qTableCopy() {
        Map<ContextKey, double[]> copy = new LinkedHashMap<>();
        qTable.forEach((key, row) -> copy.put(key, Arrays.copyOf(row, ACTION_COUNT)));
        return copy;
    }

    public synchronized Map<ContextKey, int[]> visitCountsCopy() {
        Map<ContextKey, int[]> copy = new LinkedHashMap<>();
        visitCounts.forEach((key, row) -> copy.put(key, Arrays.copyOf(row, ACTION_COUNT)));
        return copy;
    }

    public synchronized List<AdaptationEvent> getAdaptationHistory() {
        return new ArrayList<>(adaptationHistory);
    }

    public String getUnitId() { return unitId; }
    public synchronized long getTotalRecommendations() { return totalRecommendations; }
    public synchronized long getSuccessfulRecommendations() { return successfulRecommendations; }
    public synchronized double getPersonalizedBias() { return personalizedBias; }
    public synchronized Instant getLastUpdate() { return lastUpdate; }
    public synchronized int getExploredContexts() { return qTable.size(); }

    /**
     * Tasa de éxito en [0, 1]; 0.5 cuando todavía no hay historial.
     */
    public synchronized double successRate() {
        if (totalRecommendations == 0) {
            return 0.5;
        }
        return (double) successfulRecommendations / totalRecommendations;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
