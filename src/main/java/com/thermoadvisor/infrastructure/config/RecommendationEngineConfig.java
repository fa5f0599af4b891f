package com.thermoadvisor.infrastructure.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thermoadvisor.domain.model.RoomCategoryProvider;
import com.thermoadvisor.domain.model.activity.ActivityLogger;
import com.thermoadvisor.domain.model.engine.TemperatureRecommendationEngine;
import com.thermoadvisor.domain.model.learning.ContextDiscretizer;
import com.thermoadvisor.domain.model.learning.ExplorationRate;
import com.thermoadvisor.domain.model.learning.LearningStateStore;
import com.thermoadvisor.domain.model.learning.PolicyEngine;
import com.thermoadvisor.domain.model.monitoring.CountdownTimer;
import com.thermoadvisor.domain.model.persistence.PersistenceGateway;
import com.thermoadvisor.domain.model.persistence.SnapshotRepository;
import com.thermoadvisor.infrastructure.logging.Slf4jActivityLogger;
import com.thermoadvisor.infrastructure.persistence.JsonFileSnapshotRepository;
import com.thermoadvisor.infrastructure.persistence.RetryingPersistenceGateway;
import com.thermoadvisor.infrastructure.scheduler.ScheduledCountdownTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Configuración que carga el JSON de configuración del sitio y crea
 * los beans del motor de recomendaciones.
 */
@Configuration
public class RecommendationEngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationEngineConfig.class);

    @Value("${recommendation.config-file:classpath:site-config.json}")
    private String configLocation;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResourceLoader resourceLoader;

    public RecommendationEngineConfig(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * Carga la configuración del sitio (unidades y tamaño de cada habitación).
     * Cada unidad puede traer "roomSize" (small/medium/large/xlarge) o "roomArea" en m².
     */
    @Bean
    public SiteConfiguration siteConfiguration() throws IOException {
        Resource resource = resolveConfigResource();

        try (InputStream inputStream = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(inputStream);

            String siteName = root.has("site") ? root.get("site").asText() : "default";

            List<UnitConfig> units = new ArrayList<>();
            JsonNode unitsNode = root.get("units");
            if (unitsNode != null && unitsNode.isArray()) {
                for (JsonNode unitNode : unitsNode) {
                    // id: usar "name" si "id" no está presente
                    String id = unitNode.has("id")
                            ? unitNode.get("id").asText()
                            : unitNode.get("name").asText();
                    String name = unitNode.has("name") ? unitNode.get("name").asText() : id;

                    String roomSize;
                    if (unitNode.has("roomSize")) {
                        roomSize = unitNode.get("roomSize").asText().trim().toLowerCase(Locale.ROOT);
                    } else if (unitNode.has("roomArea")) {
                        roomSize = roomSizeForArea(unitNode.get("roomArea").asDouble());
                    } else {
                        roomSize = RoomCategoryProvider.DEFAULT_CATEGORY;
                    }

                    units.add(new UnitConfig(id, name, roomSize));
                }
            }

            logger.info("Configuración del sitio '{}' cargada con {} unidades", siteName, units.size());
            return new SiteConfiguration(siteName, units);
        }
    }

    /**
     * Categoría de habitación según el área en m².
     */
    static String roomSizeForArea(double area) {
        if (area <= 20) return "small";
        if (area <= 35) return "medium";
        if (area <= 50) return "large";
        return "xlarge";
    }

    private Resource resolveConfigResource() throws IOException {
        Resource resource = resourceLoader.getResource(configLocation);
        if (resource.exists()) {
            return resource;
        }

        // Si no tiene prefijo, interpretarlo como ruta absoluta o relativa en el filesystem
        if (!configLocation.startsWith("classpath:") && !configLocation.startsWith("file:")) {
            Path path = Path.of(configLocation).toAbsolutePath();
            if (Files.exists(path)) {
                return resourceLoader.getResource("file:" + path);
            }
        }

        logger.warn("No se encontró el archivo de configuración en '{}'. Usando fallback del classpath.", configLocation);
        Resource fallback = resourceLoader.getResource("classpath:site-config.json");
        if (!fallback.exists()) {
            throw new IOException("No se encontró la configuración del sitio ni en " + configLocation + " ni en classpath:site-config.json");
        }
        return fallback;
    }

    @Bean
    public RoomCategoryProvider roomCategoryProvider(SiteConfiguration siteConfiguration) {
        return new SiteConfigurationRoomCategoryProvider(siteConfiguration);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ContextDiscretizer contextDiscretizer() {
        return new ContextDiscretizer();
    }

    @Bean
    public LearningStateStore learningStateStore(
            @Value("${recommendation.learning.learning-rate:0.1}") double learningRate,
            Clock clock) {
        return new LearningStateStore(learningRate, clock);
    }

    @Bean
    public ExplorationRate explorationRate(
            @Value("${recommendation.learning.initial-epsilon:0.1}") double initialEpsilon,
            @Value("${recommendation.learning.epsilon-decay:0.995}") double epsilonDecay,
            @Value("${recommendation.learning.min-epsilon:0.01}") double minEpsilon) {
        return new ExplorationRate(initialEpsilon, epsilonDecay, minEpsilon);
    }

    @Bean
    public PolicyEngine policyEngine(ContextDiscretizer discretizer, LearningStateStore store,
                                     ExplorationRate explorationRate, RoomCategoryProvider roomCategoryProvider,
                                     Clock clock) {
        return new PolicyEngine(discretizer, store, explorationRate, roomCategoryProvider, new SecureRandom(), clock);
    }

    @Bean
    public CountdownTimer countdownTimer() {
        return new ScheduledCountdownTimer();
    }

    @Bean
    public SnapshotRepository snapshotRepository(
            @Value("${recommendation.persistence.file:data/learning-state.json}") String file) {
        return new JsonFileSnapshotRepository(Path.of(file));
    }

    // close() se infiere al cerrar el contexto
    @Bean
    public PersistenceGateway persistenceGateway(
            SnapshotRepository snapshotRepository,
            @Value("${recommendation.persistence.max-retries:3}") int maxRetries,
            @Value("${recommendation.persistence.initial-backoff-ms:1000}") long initialBackoffMs,
            @Value("${recommendation.persistence.max-backoff-ms:30000}") long maxBackoffMs) {
        return new RetryingPersistenceGateway(snapshotRepository, maxRetries,
                Duration.ofMillis(initialBackoffMs), Duration.ofMillis(maxBackoffMs));
    }

    @Bean
    public ActivityLogger activityLogger() {
        return new Slf4jActivityLogger();
    }

    @Bean
    public TemperatureRecommendationEngine temperatureRecommendationEngine(
            LearningStateStore store,
            ExplorationRate explorationRate,
            PolicyEngine policyEngine,
            CountdownTimer countdownTimer,
            PersistenceGateway persistenceGateway,
            ActivityLogger activityLogger,
            Clock clock,
            @Value("${recommendation.monitoring.window-minutes:60}") long windowMinutes) {
        return new TemperatureRecommendationEngine(store, explorationRate, policyEngine, countdownTimer,
                Duration.ofMinutes(windowMinutes), persistenceGateway, activityLogger, clock);
    }

    // Clases internas para configuración
    public static class SiteConfiguration {
        private final String siteName;
        private final List<UnitConfig> units;

        public SiteConfiguration(String siteName, List<UnitConfig> units) {
            this.siteName = siteName;
            this.units = units;
        }

        public String getSiteName() {
            return siteName;
        }

        public List<UnitConfig> getUnits() {
            return units;
        }
    }

    public static class UnitConfig {
        private final String id;
        private final String name;
        private final String roomSize;

        public UnitConfig(String id, String name, String roomSize) {
            this.id = id;
            this.name = name;
            this.roomSize = roomSize;
        }

        public String getId() { return id; }
        public String getName() { return name; }
        public String getRoomSize() { return roomSize; }
    }
}
