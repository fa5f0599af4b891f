package com.thermoadvisor.unit.domain;

import com.thermoadvisor.domain.model.EfficiencyContext;
import com.thermoadvisor.domain.model.ExplorationReason;
import com.thermoadvisor.domain.model.Recommendation;
import com.thermoadvisor.domain.model.RoomCategoryProvider;
import com.thermoadvisor.domain.model.learning.ContextDiscretizer;
import com.thermoadvisor.domain.model.learning.ContextKey;
import com.thermoadvisor.domain.model.learning.ExplorationRate;
import com.thermoadvisor.domain.model.learning.LearningStateStore;
import com.thermoadvisor.domain.model.learning.PolicyEngine;
import com.thermoadvisor.domain.model.learning.TemperatureAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("PolicyEngine - Tests Unitarios")
class PolicyEngineTest {

    private MutableClock clock;
    private LearningStateStore store;
    private ExplorationRate explorationRate;
    private ContextDiscretizer discretizer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-07-01T12:00:00Z"));
        store = new LearningStateStore(0.1, clock);
        explorationRate = new ExplorationRate();
        discretizer = new ContextDiscretizer();
    }

    private PolicyEngine engineWith(Random random) {
        return new PolicyEngine(discretizer, store, explorationRate, RoomCategoryProvider.fixed(), random, clock);
    }

    // Random que nunca explora
    private static Random exploit() {
        return new Random() {
            @Override
            public double nextDouble() {
                return 0.99;
            }
        };
    }

    // Random que siempre explora y elige la acción indicada
    private static Random explore(TemperatureAction action) {
        return new Random() {
            @Override
            public double nextDouble() {
                return 0.0;
            }

            @Override
            public int nextInt(int bound) {
                return action.ordinal();
            }
        };
    }

    @Test
    @DisplayName("Contexto sin explorar: confianza mínima 0.1 y temperatura dentro de [16, 30]")
    void shouldUseConfidenceFloorForUnexploredContext() {
        // Arrange
        PolicyEngine policy = engineWith(new Random(42));

        // Act
        Recommendation recommendation = policy.recommend("unit-1", 32, 24, null);

        // Assert
        assertThat(recommendation.getConfidence()).isEqualTo(0.1);
        assertThat(recommendation.getRecommendedTemperature()).isBetween(16.0, 30.0);
        assertThat(recommendation.isFallback()).isFalse();
        assertThat(recommendation.getContext().getOutdoorBand()).isEqualTo("hot");
    }

    @Test
    @DisplayName("Con Q-values empatados, la explotación elige la primera acción declarada")
    void shouldBreakTiesByDeclarationOrder() {
        PolicyEngine policy = engineWith(exploit());

        Recommendation recommendation = policy.recommend("unit-1", 32, 22, null);

        assertThat(recommendation.getAction()).isEqualTo(TemperatureAction.DECREASE_2);
        assertThat(recommendation.getRecommendedTemperature()).isEqualTo(20.0);
        assertThat(recommendation.getExplorationReason()).isEqualTo(ExplorationReason.EXPLOITATION);
    }

    @Test
    @DisplayName("La explotación debe elegir la acción con mayor Q-value")
    void shouldExploitBestAction() {
        ContextKey context = discretizer.discretize(32, 22, RoomCategoryProvider.DEFAULT_CATEGORY);
        store.update("unit-1", context, TemperatureAction.DECREASE_2, -0.5);
        store.update("unit-1", context, TemperatureAction.INCREASE_1, 0.5);
        store.update("unit-1", context, TemperatureAction.INCREASE_1, 0.5);
        store.update("unit-1", context, TemperatureAction.DECREASE_1, -0.5);
        store.update("unit-1", context, TemperatureAction.MAINTAIN, -0.5);
        store.update("unit-1", context, TemperatureAction.INCREASE_2, -0.5);

        Recommendation recommendation = engineWith(exploit()).recommend("unit-1", 32, 22, null);

        assertThat(recommendation.getAction()).isEqualTo(TemperatureAction.INCREASE_1);
        assertThat(recommendation.getRecommendedTemperature()).isEqualTo(23.0);
    }

    @Test
    @DisplayName("La exploración debe marcarse como tal")
    void shouldReportExploration() {
        Recommendation recommendation = engineWith(explore(TemperatureAction.INCREASE_2)).recommend("unit-1", 20, 22, null);

        assertThat(recommendation.getAction()).isEqualTo(TemperatureAction.INCREASE_2);
        assertThat(recommendation.getExplorationReason()).isEqualTo(ExplorationReason.EXPLORATION);
    }

    @Test
    @DisplayName("La temperatura recomendada debe quedar acotada a [16, 30]")
    void shouldClampRecommendedTemperature() {
        Recommendation low = engineWith(explore(TemperatureAction.DECREASE_2)).recommend("unit-1", 20, 16.5, null);
        Recommendation high = engineWith(explore(TemperatureAction.INCREASE_2)).recommend("unit-1", 20, 29.5, null);

        assertThat(low.getRecommendedTemperature()).isEqualTo(16.0);
        assertThat(high.getRecommendedTemperature()).isEqualTo(30.0);
    }

    @Test
    @DisplayName("La confianza crece con las visitas y la tasa de éxito, con tope 0.95")
    void shouldGrowConfidenceWithExperience() {
        ContextKey context = discretizer.discretize(32, 22, RoomCategoryProvider.DEFAULT_CATEGORY);
        for (int i = 0; i < 3; i++) {
            store.update("unit-1", context, TemperatureAction.DECREASE_2, 0.5);
        }
        PolicyEngine policy = engineWith(exploit());

        // 3 visitas → 0.3 * (0.5 + 1.0)
        assertThat(policy.confidence(store.getOrCreate("unit-1"), context, TemperatureAction.DECREASE_2))
                .isCloseTo(0.45, within(1e-9));

        for (int i = 0; i < 20; i++) {
            store.update("unit-1", context, TemperatureAction.DECREASE_2, 0.5);
        }
        assertThat(policy.confidence(store.getOrCreate("unit-1"), context, TemperatureAction.DECREASE_2))
                .isEqualTo(0.95);
    }

    @Test
    @DisplayName("El ahorro estimado es cero sin datos de eficiencia y tiene tope del 30%")
    void shouldEstimateEnergySavings() {
        PolicyEngine policy = engineWith(exploit());
        EfficiencyContext efficiency = new EfficiencyContext(80, "good", 1200);

        assertThat(policy.estimateEnergySavings(22, 24, 32, null)).isZero();
        assertThat(policy.estimateEnergySavings(22, 22, 32, efficiency)).isZero();
        // Se aleja de la temperatura exterior: sin ahorro
        assertThat(policy.estimateEnergySavings(22, 20, 32, efficiency)).isZero();
        // 10 → 8 grados de diferencia: 20%
        assertThat(policy.estimateEnergySavings(22, 24, 32, efficiency)).isCloseTo(20.0, within(1e-9));
        // 4 → 2 grados: 50%, acotado a 30
        assertThat(policy.estimateEnergySavings(26, 28, 30, efficiency)).isEqualTo(30.0);
    }

    @Test
    @DisplayName("Entradas inválidas deben producir el fallback determinístico")
    void shouldFallbackOnInvalidInput() {
        PolicyEngine policy = engineWith(new Random(7));

        Recommendation nan = policy.recommend("unit-1", Double.NaN, 24, null);
        Recommendation noUnit = policy.recommend(null, 30, 24, null);
        Recommendation cold = policy.recommend("unit-1", 10, Double.POSITIVE_INFINITY, null);

        assertThat(nan.isFallback()).isTrue();
        assertThat(nan.getRecommendedTemperature()).isEqualTo(24.0);
        assertThat(nan.getConfidence()).isEqualTo(0.3);
        assertThat(nan.getEnergySavings()).isEqualTo(5.0);
        assertThat(nan.getAction()).isEqualTo(TemperatureAction.MAINTAIN);
        assertThat(nan.getExplorationReason()).isEqualTo(ExplorationReason.FALLBACK);

        assertThat(noUnit.isFallback()).isTrue();
        assertThat(noUnit.getRecommendedTemperature()).isEqualTo(26.0);
        assertThat(cold.getRecommendedTemperature()).isEqualTo(22.0);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Una falla del proveedor de categoría no debe impedir la recomendación")
    void shouldTolerateFailingRoomCategoryProvider() {
        RoomCategoryProvider failing = unitId -> {
            throw new IllegalStateException("sin configuración");
        };
        PolicyEngine policy = new PolicyEngine(discretizer, store, explorationRate, failing, exploit(), clock);

        Recommendation recommendation = policy.recommend("unit-1", 28, 22, null);

        assertThat(recommendation.isFallback()).isFalse();
        assertThat(recommendation.getContext().getRoomCategory()).isEqualTo("medium");
    }
}
