package com.thermoadvisor.unit.domain;

import com.thermoadvisor.domain.model.learning.ExplorationRate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ExplorationRate - Tests Unitarios")
class ExplorationRateTest {

    @Test
    @DisplayName("Debe decaer multiplicativamente sin bajar del mínimo")
    void shouldDecayDownToFloor() {
        ExplorationRate rate = new ExplorationRate();

        assertThat(rate.current()).isEqualTo(0.1);
        assertThat(rate.decay()).isCloseTo(0.0995, within(1e-12));

        for (int i = 0; i < 2000; i++) {
            rate.decay();
        }
        assertThat(rate.current()).isEqualTo(0.01);
    }

    @Test
    @DisplayName("Tras n recompensas epsilon vale max(mínimo, inicial · decay^n)")
    void shouldFollowGeometricDecayForIntermediateSteps() {
        ExplorationRate rate = new ExplorationRate();

        for (int i = 0; i < 50; i++) {
            rate.decay();
        }

        assertThat(rate.current()).isCloseTo(Math.max(0.01, 0.1 * Math.pow(0.995, 50)), within(1e-12));
        assertThat(rate.current()).isGreaterThan(0.01);
    }

    @Test
    @DisplayName("Debe volver al valor inicial con reset")
    void shouldResetToInitial() {
        ExplorationRate rate = new ExplorationRate(0.2, 0.9, 0.05);
        rate.decay();
        rate.decay();

        rate.reset();

        assertThat(rate.current()).isEqualTo(0.2);
    }

    @Test
    @DisplayName("Debe acotar los valores restaurados")
    void shouldBoundRestoredValues() {
        ExplorationRate rate = new ExplorationRate();

        rate.restore(0.001);
        assertThat(rate.current()).isEqualTo(0.01);

        rate.restore(Double.NaN);
        assertThat(rate.current()).isEqualTo(0.1);

        rate.restore(0.05);
        assertThat(rate.current()).isEqualTo(0.05);
    }

    @Test
    @DisplayName("Debe rechazar parámetros inválidos")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new ExplorationRate(0.01, 0.995, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
