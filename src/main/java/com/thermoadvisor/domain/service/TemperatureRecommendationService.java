package com.thermoadvisor.domain.service;

import com.thermoadvisor.domain.model.EfficiencyContext;
import com.thermoadvisor.domain.model.Recommendation;
import com.thermoadvisor.domain.model.api.dto.EventResponse;
import com.thermoadvisor.domain.model.api.dto.RecommendationAppliedRequest;
import com.thermoadvisor.domain.model.api.dto.RecommendationRequest;
import com.thermoadvisor.domain.model.api.dto.RecommendationResponse;
import com.thermoadvisor.domain.model.api.dto.StatisticsResponse;
import com.thermoadvisor.domain.model.api.dto.SystemStatusResponse;
import com.thermoadvisor.domain.model.api.dto.TemperatureChangedRequest;
import com.thermoadvisor.domain.model.api.dto.UnitSelectedRequest;
import com.thermoadvisor.domain.model.api.dto.UnitStatisticsResponse;
import com.thermoadvisor.domain.model.engine.AggregateStatistics;
import com.thermoadvisor.domain.model.engine.SystemStatus;
import com.thermoadvisor.domain.model.engine.TemperatureRecommendationEngine;
import com.thermoadvisor.domain.model.engine.UnitStatistics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Servicio que coordina el motor de recomendaciones.
 * Actúa como intermediario entre los adaptadores de entrada (REST, MQTT) y el
 * TemperatureRecommendationEngine: valida los pedidos y arma los DTOs de respuesta.
 */
@Service
public class TemperatureRecommendationService {

    private static final Logger logger = LoggerFactory.getLogger(TemperatureRecommendationService.class);

    private final TemperatureRecommendationEngine engine;

    public TemperatureRecommendationService(TemperatureRecommendationEngine engine) {
        this.engine = engine;
    }

    /**
     * Carga el aprendizaje persistido al inicio de la aplicación.
     */
    @PostConstruct
    public void initialize() {
        logger.info("Inicializando motor de recomendaciones...");
        engine.initialize();
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Deteniendo motor de recomendaciones");
        engine.shutdown();
    }

    /**
     * Genera una recomendación para la unidad pedida.
     *
     * @throws IllegalArgumentException si faltan la unidad o las temperaturas
     */
    public RecommendationResponse getRecommendation(RecommendationRequest request) {
        if (request == null || isBlank(request.getUnitId())) {
            throw new IllegalArgumentException("unit_id es obligatorio");
        }
        if (request.getOutdoorTemperature() == null || request.getCurrentTarget() == null) {
            throw new IllegalArgumentException("outdoor_temperature y current_target son obligatorios");
        }

        EfficiencyContext efficiency = null;
        if (request.getEfficiency() != null) {
            efficiency = new EfficiencyContext(
                    request.getEfficiency().getEfficiencyScore(),
                    request.getEfficiency().getLevel(),
                    request.getEfficiency().getPowerConsumptionWatts());
        }

        Recommendation recommendation = engine.getRecommendation(
                request.getUnitId(), request.getOutdoorTemperature(), request.getCurrentTarget(), efficiency);
        return toResponse(recommendation);
    }

    public EventResponse onRecommendationApplied(RecommendationAppliedRequest request) {
        if (request == null || isBlank(request.getUnitId())) {
            throw new IllegalArgumentException("unit_id es obligatorio");
        }
        boolean armed = engine.onRecommendationApplied(
                request.getUnitId(), request.getRecommendedTemperature(), request.getAppliedBy());
        return EventResponse.builder()
                .unitId(request.getUnitId())
                .handled(armed)
                .message(armed ? "Monitoreo iniciado" : "No hay una recomendación pendiente para la unidad")
                .build();
    }

    public EventResponse onTemperatureChanged(TemperatureChangedRequest request) {
        if (request == null || isBlank(request.getUnitId())) {
            throw new IllegalArgumentException("unit_id es obligatorio");
        }
        if (request.getNewTemperature() == null) {
            throw new IllegalArgumentException("new_temperature es obligatorio");
        }
        double previous = request.getPreviousTemperature() != null ? request.getPreviousTemperature() : Double.NaN;
        boolean resolved = engine.onTemperatureManuallyChanged(
                request.getUnitId(), request.getNewTemperature(), previous,
                request.getChangedBy() != null ? request.getChangedBy() : "user");
        return EventResponse.builder()
                .unitId(request.getUnitId())
                .handled(resolved)
                .message(resolved ? "Ajuste manual registrado sobre la recomendación" : "Sin ventana de monitoreo activa")
                .build();
    }

    public EventResponse onUnitSelected(UnitSelectedRequest request) {
        if (request == null || isBlank(request.getUnitId())) {
            throw new IllegalArgumentException("unit_id es obligatorio");
        }
        engine.onUnitSelected(request.getUnitId());
        return EventResponse.builder()
                .unitId(request.getUnitId())
                .handled(true)
                .message("Unidad seleccionada")
                .build();
    }

    public Optional<UnitStatisticsResponse> getUnitStatistics(String unitId) {
        return engine.getStatistics(unitId).map(this::toResponse);
    }

    public StatisticsResponse getStatistics() {
        AggregateStatistics stats = engine.getStatistics();
        return StatisticsResponse.builder()
                .totalUnits(stats.getTotalUnits())
                .totalRecommendations(stats.getTotalRecommendations())
                .totalSuccessful(stats.getTotalSuccessful())
                .overallSuccessRate(stats.getOverallSuccessRate())
                .exploredContexts(stats.getExploredContexts())
                .currentEpsilon(stats.getCurrentEpsilon())
                .uptimeSeconds(stats.getUptime().getSeconds())
                .build();
    }

    public EventResponse resetLearningData(String unitId) {
        engine.resetLearningData(unitId);
        return EventResponse.builder()
                .unitId(unitId)
                .handled(true)
                .message("Aprendizaje reiniciado")
                .build();
    }

    public EventResponse resetAllLearningData() {
        engine.resetLearningData();
        return EventResponse.builder()
                .handled(true)
                .message("Todo el aprendizaje fue reiniciado")
                .build();
    }

    public SystemStatusResponse getSystemStatus() {
        SystemStatus status = engine.getSystemStatus();
        return SystemStatusResponse.builder()
                .initialized(status.isInitialized())
                .epsilon(status.getEpsilon())
                .totalUnits(status.getTotalUnits())
                .pendingRecommendations(status.getPendingRecommendations())
                .activeWindows(status.getActiveWindows())
                .acceptedWindows(status.getAcceptedWindows())
                .overriddenWindows(status.getOverriddenWindows())
                .supersededWindows(status.getSupersededWindows())
                .pendingSaves(status.getPendingSaves())
                .droppedSaves(status.getDroppedSaves())
                .activityLoggerAvailable(status.isActivityLoggerAvailable())
                .build();
    }

    private RecommendationResponse toResponse(Recommendation recommendation) {
        return RecommendationResponse.builder()
                .unitId(recommendation.getUnitId())
                .action(recommendation.getAction().getLabel())
                .adjustment(recommendation.getAdjustment())
                .currentTemperature(recommendation.getCurrentTemperature())
                .recommendedTemperature(recommendation.getRecommendedTemperature())
                .confidence(recommendation.getConfidence())
                .energySavings(recommendation.getEnergySavings())
                .context(recommendation.getContext() != null ? recommendation.getContext().toString() : null)
                .explorationReason(recommendation.getExplorationReason().name())
                .fallback(recommendation.isFallback())
                .timestamp(recommendation.getTimestamp())
                .build();
    }

    private UnitStatisticsResponse toResponse(UnitStatistics stats) {
        return UnitStatisticsResponse.builder()
                .unitId(stats.getUnitId())
                .totalRecommendations(stats.getTotalRecommendations())
                .successfulRecommendations(stats.getSuccessfulRecommendations())
                .successRate(stats.getSuccessRate())
                .personalizedBias(stats.getPersonalizedBias())
                .exploredContexts(stats.getExploredContexts())
                .currentEpsilon(stats.getCurrentEpsilon())
                .lastUpdate(stats.getLastUpdate())
                .monitoringActive(stats.isMonitoringActive())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
