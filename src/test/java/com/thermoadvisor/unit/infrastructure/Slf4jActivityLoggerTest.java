package com.thermoadvisor.unit.infrastructure;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thermoadvisor.domain.model.activity.ManualAdjustmentRecord;
import com.thermoadvisor.domain.model.activity.SuccessfulRecommendationRecord;
import com.thermoadvisor.infrastructure.logging.Slf4jActivityLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Slf4jActivityLogger - Tests Unitarios")
class Slf4jActivityLoggerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private Logger activityLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        activityLogger = (Logger) LoggerFactory.getLogger("ACTIVITY");
        appender = new ListAppender<>();
        appender.start();
        activityLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        activityLogger.detachAppender(appender);
    }

    @Test
    @DisplayName("Cada registro se escribe como una línea JSON con su tipo")
    void shouldWriteRecordsAsJson() throws Exception {
        Slf4jActivityLogger logger = new Slf4jActivityLogger();

        logger.logManualAdjustment(ManualAdjustmentRecord.builder()
                .unitId("ac-living")
                .recommendedTemp(25)
                .adjustedTemp(23)
                .previousTemp(25)
                .adjustmentTimeMs(600_000)
                .changedBy("user")
                .adjustmentDirection(ManualAdjustmentRecord.directionOf(25, 23))
                .context("hot/warm_indoor/large")
                .timestamp(1_720_000_000_000L)
                .build());
        logger.logSuccessfulRecommendation(SuccessfulRecommendationRecord.builder()
                .unitId("ac-living")
                .recommendedTemp(25)
                .adjustment(1)
                .sustainedDurationMs(3_600_000)
                .build());

        assertThat(appender.list).hasSize(2);
        JsonNode manual = objectMapper.readTree(appender.list.get(0).getFormattedMessage());
        assertThat(manual.get("type").asText()).isEqualTo("manual_adjustment");
        assertThat(manual.get("unit_id").asText()).isEqualTo("ac-living");
        assertThat(manual.get("adjustment_direction").asText()).isEqualTo("decrease");
        assertThat(manual.get("adjustment_time_ms").asLong()).isEqualTo(600_000);

        JsonNode success = objectMapper.readTree(appender.list.get(1).getFormattedMessage());
        assertThat(success.get("type").asText()).isEqualTo("successful_recommendation");
        assertThat(success.get("sustained_duration_ms").asLong()).isEqualTo(3_600_000);
    }
}
