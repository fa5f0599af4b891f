package com.thermoadvisor.domain.model.learning;

import com.thermoadvisor.domain.model.EfficiencyContext;
import com.thermoadvisor.domain.model.ExplorationReason;
import com.thermoadvisor.domain.model.Recommendation;
import com.thermoadvisor.domain.model.RoomCategoryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Random;

/**
 * Política epsilon-greedy del bandit contextual.
 *
 * Selecciona la acción para el contexto de una unidad, calcula la confianza
 * de la recomendación y una estimación de ahorro energético. Nunca lanza
 * excepciones hacia el llamador: ante datos inválidos o errores internos
 * devuelve una recomendación de fallback determinística.
 */
public class PolicyEngine {

    private static final Logger logger = LoggerFactory.getLogger(PolicyEngine.class);

    public static final double MIN_TEMPERATURE = 16.0;
    public static final double MAX_TEMPERATURE = 30.0;

    public static final double MIN_CONFIDENCE = 0.1;
    public static final double MAX_CONFIDENCE = 0.95;
    public static final double FALLBACK_CONFIDENCE = 0.3;
    public static final double FALLBACK_ENERGY_SAVINGS = 5.0;
    public static final double MAX_ENERGY_SAVINGS = 30.0;

    // Fallback: 5°C por encima de la temperatura exterior, dentro de la franja de confort
    private static final double FALLBACK_OUTDOOR_OFFSET = 5.0;
    private static final double FALLBACK_MIN = 22.0;
    private static final double FALLBACK_MAX = 26.0;

    private final ContextDiscretizer discretizer;
    private final LearningStateStore store;
    private final ExplorationRate explorationRate;
    private final RoomCategoryProvider roomCategoryProvider;
    private final Random random;
    private final Clock clock;

    public PolicyEngine(ContextDiscretizer discretizer, LearningStateStore store, ExplorationRate explorationRate,
                        RoomCategoryProvider roomCategoryProvider, Random random, Clock clock) {
        this.discretizer = discretizer;
        this.store = store;
        this.explorationRate = explorationRate;
        this.roomCategoryProvider = roomCategoryProvider != null ? roomCategoryProvider : RoomCategoryProvider.fixed();
        this.random = random;
        this.clock = clock;
    }

    /**
     * Genera una recomendación para la unidad. El resultado siempre tiene una
     * temperatura dentro de [16, 30] y un ajuste del espacio de acciones.
     */
    public Recommendation recommend(String unitId, double outdoorTemperature, double currentTarget,
                                    EfficiencyContext efficiencyContext) {
        try {
            validate(unitId, outdoorTemperature, currentTarget);

            ContextKey context = discretizer.discretize(outdoorTemperature, currentTarget, roomCategory(unitId));
            LearningState state = store.getOrCreate(unitId);
            double[] qValues = state.qValues(context);

            ActionChoice choice = choose(qValues, explorationRate.current());
            TemperatureAction action = choice.getAction();

            double recommended = clamp(currentTarget + action.getAdjustment(), MIN_TEMPERATURE, MAX_TEMPERATURE);
            double confidence = confidence(state, context, action);
            double savings = estimateEnergySavings(currentTarget, recommended, outdoorTemperature, efficiencyContext);

            Recommendation recommendation = new Recommendation(unitId, action, currentTarget, recommended,
                    confidence, savings, context, choice.getReason(), clock.instant());
            logger.debug("Recomendación generada: {}", recommendation);
            return recommendation;
        } catch (IllegalArgumentException e) {
            logger.warn("Pedido de recomendación inválido para la unidad {}: {}. Usando fallback.", unitId, e.getMessage());
            return fallback(unitId, currentTarget, outdoorTemperature);
        } catch (RuntimeException e) {
            logger.error("Error generando recomendación para la unidad {}: {}", unitId, e.getMessage(), e);
            return fallback(unitId, currentTarget, outdoorTemperature);
        }
    }

    /**
     * Epsilon-greedy: con probabilidad epsilon una acción uniforme al azar,
     * si no la de mayor Q-value (empates: la primera en el orden declarado).
     */
    public TemperatureAction selectAction(double[] qValues, double epsilon) {
        return choose(qValues, epsilon).getAction();
    }

    ActionChoice choose(double[] qValues, double epsilon) {
        TemperatureAction[] actions = TemperatureAction.values();
        if (qValues == null || qValues.length != actions.length) {
            throw new IllegalArgumentException("Se esperaban " + actions.length + " Q-values");
        }
        if (random.nextDouble() < epsilon) {
            return new ActionChoice(actions[random.nextInt(actions.length)], ExplorationReason.EXPLORATION);
        }
        return new ActionChoice(bestAction(qValues), ExplorationReason.EXPLOITATION);
    }

    static TemperatureAction bestAction(double[] qValues) {
        TemperatureAction[] actions = TemperatureAction.values();
        TemperatureAction best = actions[0];
        double bestValue = qValues[0];
        for (int i = 1; i < actions.length; i++) {
            // Estrictamente mayor: ante empate se queda la primera acción declarada
            if (qValues[i] > bestValue) {
                bestValue = qValues[i];
                best = actions[i];
            }
        }
        return best;
    }

    /**
     * Confianza basada en la experiencia con el par (contexto, acción) y en la
     * tasa de éxito general de la unidad.
     */
    public double confidence(LearningState state, ContextKey context, TemperatureAction action) {
        int visits = state.visitCount(context, action);
        double base = Math.min(0.9, visits * 0.1);
        double successRate = state.successRate();
        return clamp(base * (0.5 + successRate), MIN_CONFIDENCE, MAX_CONFIDENCE);
    }

    /**
     * Ahorro estimado (porcentaje) proporcional a cuánto se reduce la distancia
     * con la temperatura exterior. Cero si no hay datos de eficiencia o si la
     * distancia no se reduce; tope del 30%.
     */
    public double estimateEnergySavings(double currentTemperature, double recommendedTemperature,
                                        double outdoorTemperature, EfficiencyContext efficiencyContext) {
        if (efficiencyContext == null || currentTemperature == recommendedTemperature) {
            return 0.0;
        }
        double currentDiff = Math.abs(currentTemperature - outdoorTemperature);
        double recommendedDiff = Math.abs(recommendedTemperature - outdoorTemperature);
        if (recommendedDiff >= currentDiff) {
            return 0.0;
        }
        double savingsPercent = (currentDiff - recommendedDiff) / currentDiff * 100.0;
        return clamp(savingsPercent, 0.0, MAX_ENERGY_SAVINGS);
    }

    /**
     * Recomendación determinística cuando el bandit no puede decidir.
     */
    public Recommendation fallback(String unitId, double currentTarget, double outdoorTemperature) {
        double target = Double.isFinite(outdoorTemperature)
                ? clamp(outdoorTemperature + FALLBACK_OUTDOOR_OFFSET, FALLBACK_MIN, FALLBACK_MAX)
                : (FALLBACK_MIN + FALLBACK_MAX) / 2;
        return new Recommendation(unitId, TemperatureAction.MAINTAIN, currentTarget, target,
                FALLBACK_CONFIDENCE, FALLBACK_ENERGY_SAVINGS, null, ExplorationReason.FALLBACK, clock.instant());
    }

    private String roomCategory(String unitId) {
        try {
            String category = roomCategoryProvider.roomCategory(unitId);
            return category == null || category.isBlank() ? RoomCategoryProvider.DEFAULT_CATEGORY : category;
        } catch (RuntimeException e) {
            logger.warn("No se pudo obtener la categoría de habitación de {}: {}", unitId, e.getMessage());
            return RoomCategoryProvider.DEFAULT_CATEGORY;
        }
    }

    private static void validate(String unitId, double outdoorTemperature, double currentTarget) {
        if (unitId == null || unitId.isBlank()) {
            throw new IllegalArgumentException("El id de unidad es obligatorio");
        }
        if (!Double.isFinite(outdoorTemperature)) {
            throw new IllegalArgumentException("Temperatura exterior inválida: " + outdoorTemperature);
        }
        if (!Double.isFinite(currentTarget)) {
            throw new IllegalArgumentException("Temperatura objetivo inválida: " + currentTarget);
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public ExplorationRate getExplorationRate() {
        return explorationRate;
    }

    // Acción elegida y si fue por exploración o explotación
    static class ActionChoice {
        private final TemperatureAction action;
        private final ExplorationReason reason;

        ActionChoice(TemperatureAction action, ExplorationReason reason) {
            this.action = action;
            this.reason = reason;
        }

        TemperatureAction getAction() { return action; }
        ExplorationReason getReason() { return reason; }
    }
}
