package com.thermoadvisor.unit.domain;

import com.thermoadvisor.domain.model.ExplorationReason;
import com.thermoadvisor.domain.model.Recommendation;
import com.thermoadvisor.domain.model.activity.ActivityLogger;
import com.thermoadvisor.domain.model.activity.ManualAdjustmentRecord;
import com.thermoadvisor.domain.model.activity.SuccessfulRecommendationRecord;
import com.thermoadvisor.domain.model.learning.ContextKey;
import com.thermoadvisor.domain.model.learning.TemperatureAction;
import com.thermoadvisor.domain.model.monitoring.MonitoringWindow;
import com.thermoadvisor.domain.model.monitoring.RewardApplier;
import com.thermoadvisor.domain.model.monitoring.RewardScheduler;
import com.thermoadvisor.domain.model.monitoring.WindowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("RewardScheduler - Tests Unitarios")
class RewardSchedulerTest {

    private static final Duration WINDOW = Duration.ofHours(1);

    private MutableClock clock;
    private ManualCountdownTimer timer;
    private RewardApplier rewardApplier;
    private ActivityLogger activityLogger;
    private RewardScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-07-01T12:00:00Z"));
        timer = new ManualCountdownTimer();
        rewardApplier = mock(RewardApplier.class);
        activityLogger = mock(ActivityLogger.class);
        scheduler = new RewardScheduler(timer, WINDOW, rewardApplier, activityLogger, clock);
    }

    private Recommendation recommendation(String unitId) {
        return new Recommendation(unitId, TemperatureAction.INCREASE_1, 24, 25, 0.1, 10,
                new ContextKey("hot", "warm_indoor", "medium"), ExplorationReason.EXPLOITATION, clock.instant());
    }

    @Test
    @DisplayName("Al vencer la ventana sin ajustes debe aplicar +0.5 y registrar el éxito")
    void shouldRewardWhenWindowExpires() {
        // Arrange
        Recommendation recommendation = recommendation("unit-1");
        scheduler.arm("unit-1", recommendation);
        assertThat(timer.lastDelay()).isEqualTo(WINDOW);

        // Act
        clock.advance(WINDOW);
        timer.fireAll();

        // Assert
        verify(rewardApplier).applyReward("unit-1", recommendation, RewardScheduler.ACCEPTED_REWARD);
        ArgumentCaptor<SuccessfulRecommendationRecord> record = ArgumentCaptor.forClass(SuccessfulRecommendationRecord.class);
        verify(activityLogger).logSuccessfulRecommendation(record.capture());
        assertThat(record.getValue().getSustainedDurationMs()).isEqualTo(WINDOW.toMillis());
        assertThat(scheduler.activeWindow("unit-1")).isEmpty();
        assertThat(scheduler.getAcceptedWindows()).isEqualTo(1);
    }

    @Test
    @DisplayName("Un ajuste manual dentro de la ventana debe aplicar -0.5 y cancelar la cuenta regresiva")
    void shouldPenalizeManualAdjustment() {
        // Arrange
        Recommendation recommendation = recommendation("unit-1");
        scheduler.arm("unit-1", recommendation);
        clock.advance(Duration.ofMinutes(10));

        // Act
        boolean resolved = scheduler.onManualAdjustment("unit-1", 23, 25, "user");

        // Assert
        assertThat(resolved).isTrue();
        verify(rewardApplier).applyReward("unit-1", recommendation, RewardScheduler.OVERRIDE_REWARD);
        assertThat(timer.activeCount()).isZero();

        ArgumentCaptor<ManualAdjustmentRecord> record = ArgumentCaptor.forClass(ManualAdjustmentRecord.class);
        verify(activityLogger).logManualAdjustment(record.capture());
        assertThat(record.getValue().getAdjustmentTimeMs()).isEqualTo(Duration.ofMinutes(10).toMillis());
        assertThat(record.getValue().getAdjustmentDirection()).isEqualTo("decrease");

        // La cuenta regresiva ya no tiene efecto
        timer.fireAll();
        verify(rewardApplier, times(1)).applyReward(anyString(), any(), anyDouble());
    }

    @Test
    @DisplayName("Sin temperatura previa, la dirección se calcula contra la temperatura recomendada")
    void shouldUseRecommendedTemperatureWhenPreviousIsUnknown() {
        scheduler.arm("unit-1", recommendation("unit-1"));

        scheduler.onManualAdjustment("unit-1", 27, Double.NaN, null);

        ArgumentCaptor<ManualAdjustmentRecord> record = ArgumentCaptor.forClass(ManualAdjustmentRecord.class);
        verify(activityLogger).logManualAdjustment(record.capture());
        assertThat(record.getValue().getPreviousTemp()).isEqualTo(25.0);
        assertThat(record.getValue().getAdjustmentDirection()).isEqualTo("increase");
        assertThat(record.getValue().getChangedBy()).isEqualTo("user");
    }

    @Test
    @DisplayName("Un ajuste manual sin ventana activa no aplica recompensa")
    void shouldIgnoreAdjustmentWithoutWindow() {
        boolean resolved = scheduler.onManualAdjustment("unit-1", 23, 24, "user");

        assertThat(resolved).isFalse();
        verify(rewardApplier, never()).applyReward(anyString(), any(), anyDouble());
        verify(activityLogger, never()).logManualAdjustment(any());
    }

    @Test
    @DisplayName("Carrera: ajuste manual primero, luego el vencimiento → una sola recompensa (-0.5)")
    void shouldResolveOnceWhenAdjustmentWinsTheRace() {
        Recommendation recommendation = recommendation("unit-1");
        scheduler.arm("unit-1", recommendation);
        Runnable expiry = timer.taskAt(0);

        scheduler.onManualAdjustment("unit-1", 23, 25, "user");
        expiry.run();

        verify(rewardApplier, times(1)).applyReward(anyString(), any(), anyDouble());
        verify(rewardApplier).applyReward("unit-1", recommendation, RewardScheduler.OVERRIDE_REWARD);
        verify(activityLogger, never()).logSuccessfulRecommendation(any());
    }

    @Test
    @DisplayName("Carrera: vencimiento primero, luego el ajuste manual → una sola recompensa (+0.5)")
    void shouldResolveOnceWhenExpiryWinsTheRace() {
        Recommendation recommendation = recommendation("unit-1");
        scheduler.arm("unit-1", recommendation);

        timer.taskAt(0).run();
        boolean resolved = scheduler.onManualAdjustment("unit-1", 23, 25, "user");

        assertThat(resolved).isFalse();
        verify(rewardApplier, times(1)).applyReward(anyString(), any(), anyDouble());
        verify(rewardApplier).applyReward("unit-1", recommendation, RewardScheduler.ACCEPTED_REWARD);
    }

    @RepeatedTest(20)
    @DisplayName("Carrera concurrente: vencimiento y ajuste simultáneos aplican exactamente una recompensa")
    void shouldApplyExactlyOneRewardUnderConcurrency() throws Exception {
        scheduler.arm("unit-1", recommendation("unit-1"));
        Runnable expiry = timer.taskAt(0);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        Future<?> first = executor.submit(() -> {
            start.await();
            expiry.run();
            return null;
        });
        Future<?> second = executor.submit(() -> {
            start.await();
            scheduler.onManualAdjustment("unit-1", 23, 25, "user");
            return null;
        });
        start.countDown();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
        executor.shutdown();

        verify(rewardApplier, times(1)).applyReward(anyString(), any(), anyDouble());
        assertThat(scheduler.getAcceptedWindows() + scheduler.getOverriddenWindows()).isEqualTo(1);
    }

    @Test
    @DisplayName("Armar una ventana nueva descarta explícitamente la anterior, sin recompensa")
    void shouldSupersedePreviousWindow() {
        // Arrange
        Recommendation first = recommendation("unit-1");
        Recommendation second = recommendation("unit-1");
        scheduler.arm("unit-1", first);

        // Act
        Optional<MonitoringWindow> superseded = scheduler.arm("unit-1", second);

        // Assert
        assertThat(superseded).isPresent();
        assertThat(superseded.get().getState()).isEqualTo(WindowState.DISCARDED);
        assertThat(superseded.get().getRecommendation()).isSameAs(first);
        assertThat(scheduler.getSupersededWindows()).isEqualTo(1);
        assertThat(scheduler.activeWindowCount()).isEqualTo(1);
        assertThat(timer.activeCount()).isEqualTo(1);

        timer.fireAll();
        verify(rewardApplier, never()).applyReward("unit-1", first, RewardScheduler.ACCEPTED_REWARD);
        verify(rewardApplier).applyReward("unit-1", second, RewardScheduler.ACCEPTED_REWARD);
    }

    @Test
    @DisplayName("Las ventanas de unidades distintas son independientes")
    void shouldKeepWindowsPerUnit() {
        scheduler.arm("unit-1", recommendation("unit-1"));
        scheduler.arm("unit-2", recommendation("unit-2"));

        scheduler.onManualAdjustment("unit-1", 23, 25, "user");

        assertThat(scheduler.activeWindow("unit-1")).isEmpty();
        assertThat(scheduler.activeWindow("unit-2")).isPresent();
    }

    @Test
    @DisplayName("cancel y cancelAll descartan las ventanas sin aplicar recompensas")
    void shouldCancelWindows() {
        scheduler.arm("unit-1", recommendation("unit-1"));
        scheduler.arm("unit-2", recommendation("unit-2"));

        assertThat(scheduler.cancel("unit-1")).isTrue();
        assertThat(scheduler.cancel("unit-1")).isFalse();
        assertThat(scheduler.cancelAll()).isEqualTo(1);

        timer.fireAll();
        verify(rewardApplier, never()).applyReward(anyString(), any(), anyDouble());
        assertThat(scheduler.activeWindowCount()).isZero();
    }

    @Test
    @DisplayName("shutdown cancela las ventanas y detiene el temporizador")
    void shouldShutdownTimer() {
        scheduler.arm("unit-1", recommendation("unit-1"));

        scheduler.shutdown();

        assertThat(timer.isShutdown()).isTrue();
        assertThat(scheduler.activeWindowCount()).isZero();
    }

    @Test
    @DisplayName("Una falla del registro de actividad no debe impedir la recompensa")
    void shouldTolerateActivityLoggerFailures() {
        doThrow(new IllegalStateException("disco lleno")).when(activityLogger).logSuccessfulRecommendation(any());
        Recommendation recommendation = recommendation("unit-1");
        scheduler.arm("unit-1", recommendation);

        timer.fireAll();

        verify(rewardApplier).applyReward(eq("unit-1"), eq(recommendation), eq(RewardScheduler.ACCEPTED_REWARD));
        assertThat(scheduler.getAcceptedWindows()).isEqualTo(1);
    }
}
