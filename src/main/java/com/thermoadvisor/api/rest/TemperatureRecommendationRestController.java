package com.thermoadvisor.api.rest;

import com.thermoadvisor.domain.model.api.dto.EventResponse;
import com.thermoadvisor.domain.model.api.dto.RecommendationAppliedRequest;
import com.thermoadvisor.domain.model.api.dto.RecommendationRequest;
import com.thermoadvisor.domain.model.api.dto.RecommendationResponse;
import com.thermoadvisor.domain.model.api.dto.StatisticsResponse;
import com.thermoadvisor.domain.model.api.dto.SystemStatusResponse;
import com.thermoadvisor.domain.model.api.dto.TemperatureChangedRequest;
import com.thermoadvisor.domain.model.api.dto.UnitSelectedRequest;
import com.thermoadvisor.domain.model.api.dto.UnitStatisticsResponse;
import com.thermoadvisor.domain.service.TemperatureRecommendationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller que expone la API pública del motor de recomendaciones.
 *
 * Endpoints principales:
 * - POST /api/recommendations - Pide una recomendación para una unidad
 * - POST /api/events/recommendation-applied - El usuario aplicó la recomendación
 * - POST /api/events/temperature-changed - Cambio manual de temperatura
 * - POST /api/events/unit-selected - Selección de unidad (informativo)
 * - GET /api/statistics, /api/statistics/{unitId} - Estadísticas de aprendizaje
 * - DELETE /api/learning, /api/learning/{unitId} - Reinicio del aprendizaje
 * - GET /api/system/status - Estado general del sistema
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class TemperatureRecommendationRestController {

    private static final Logger logger = LoggerFactory.getLogger(TemperatureRecommendationRestController.class);

    private final TemperatureRecommendationService recommendationService;

    public TemperatureRecommendationRestController(TemperatureRecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    /**
     * POST /api/recommendations
     *
     * Body:
     * {
     *   "unit_id": "ac-living",
     *   "outdoor_temperature": 30.0,
     *   "current_target": 24.0,
     *   "efficiency": { "efficiency_score": 80, "level": "good", "power_consumption_watts": 1200 }
     * }
     */
    @PostMapping("/recommendations")
    public ResponseEntity<RecommendationResponse> getRecommendation(@RequestBody RecommendationRequest request) {
        try {
            return ResponseEntity.ok(recommendationService.getRecommendation(request));
        } catch (IllegalArgumentException e) {
            logger.warn("Pedido de recomendación inválido: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (Exception e) {
            logger.error("Error al generar la recomendación: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    @PostMapping("/events/recommendation-applied")
    public ResponseEntity<EventResponse> recommendationApplied(@RequestBody RecommendationAppliedRequest request) {
        try {
            return ResponseEntity.ok(recommendationService.onRecommendationApplied(request));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @PostMapping("/events/temperature-changed")
    public ResponseEntity<EventResponse> temperatureChanged(@RequestBody TemperatureChangedRequest request) {
        try {
            return ResponseEntity.ok(recommendationService.onTemperatureChanged(request));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @PostMapping("/events/unit-selected")
    public ResponseEntity<EventResponse> unitSelected(@RequestBody UnitSelectedRequest request) {
        try {
            return ResponseEntity.ok(recommendationService.onUnitSelected(request));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @GetMapping("/statistics")
    public ResponseEntity<StatisticsResponse> getStatistics() {
        return ResponseEntity.ok(recommendationService.getStatistics());
    }

    /**
     * GET /api/statistics/{unitId}
     *
     * 404 si la unidad no tiene aprendizaje registrado.
     */
    @GetMapping("/statistics/{unitId}")
    public ResponseEntity<UnitStatisticsResponse> getUnitStatistics(@PathVariable String unitId) {
        return recommendationService.getUnitStatistics(unitId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/learning")
    public ResponseEntity<EventResponse> resetAllLearning() {
        return ResponseEntity.ok(recommendationService.resetAllLearningData());
    }

    @DeleteMapping("/learning/{unitId}")
    public ResponseEntity<EventResponse> resetUnitLearning(@PathVariable String unitId) {
        return ResponseEntity.ok(recommendationService.resetLearningData(unitId));
    }

    @GetMapping("/system/status")
    public ResponseEntity<SystemStatusResponse> getSystemStatus() {
        return ResponseEntity.ok(recommendationService.getSystemStatus());
    }

    /**
     * Health check endpoint.
     *
     * GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("UP", "Temperature Recommendation Engine is running"));
    }

    private static class HealthResponse {
        private final String status;
        private final String message;

        HealthResponse(String status, String message) {
            this.status = status;
            this.message = message;
        }

        public String getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }
    }
}
