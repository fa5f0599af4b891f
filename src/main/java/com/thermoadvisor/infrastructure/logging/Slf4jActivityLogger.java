package com.thermoadvisor.infrastructure.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thermoadvisor.domain.model.activity.ActivityLogger;
import com.thermoadvisor.domain.model.activity.ManualAdjustmentRecord;
import com.thermoadvisor.domain.model.activity.RecommendationApplicationRecord;
import com.thermoadvisor.domain.model.activity.SuccessfulRecommendationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Escribe los registros de actividad como una línea JSON en el logger "ACTIVITY".
 * El destino final (archivo, consola) se decide en la configuración de logback.
 */
public class Slf4jActivityLogger implements ActivityLogger {

    private static final Logger logger = LoggerFactory.getLogger(Slf4jActivityLogger.class);
    private static final Logger activity = LoggerFactory.getLogger("ACTIVITY");

    private final ObjectMapper objectMapper;

    public Slf4jActivityLogger() {
        this(new ObjectMapper());
    }

    public Slf4jActivityLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void logRecommendationApplication(RecommendationApplicationRecord record) {
        write(record);
    }

    @Override
    public void logManualAdjustment(ManualAdjustmentRecord record) {
        write(record);
    }

    @Override
    public void logSuccessfulRecommendation(SuccessfulRecommendationRecord record) {
        write(record);
    }

    private void write(Object record) {
        try {
            activity.info(objectMapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            logger.warn("No se pudo serializar el registro de actividad {}: {}", record.getClass().getSimpleName(), e.getMessage());
        }
    }
}
