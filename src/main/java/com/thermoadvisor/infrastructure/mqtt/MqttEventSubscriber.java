package com.thermoadvisor.infrastructure.mqtt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thermoadvisor.domain.model.api.dto.RecommendationAppliedRequest;
import com.thermoadvisor.domain.model.api.dto.TemperatureChangedRequest;
import com.thermoadvisor.domain.model.api.dto.UnitSelectedRequest;
import com.thermoadvisor.domain.service.TemperatureRecommendationService;
import org.eclipse.paho.client.mqttv3.*;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cliente MQTT que se suscribe al tópico de eventos de la aplicación y los
 * despacha al TemperatureRecommendationService.
 *
 * El payload es JSON con un campo "type":
 * - recommendation-applied: unit_id, recommended_temperature, applied_by
 * - temperature-manually-changed: unit_id, new_temperature, previous_temperature, changed_by
 * - entity-selected / ac-selected: unit_id
 */
public class MqttEventSubscriber implements MqttCallback {

    private static final Logger logger = LoggerFactory.getLogger(MqttEventSubscriber.class);

    private final TemperatureRecommendationService recommendationService;
    private final String eventsTopic;
    private final String brokerUrl;
    private final String clientId;
    private final boolean autoReconnect;
    private MqttClient mqttClient;
    private MqttConnectOptions connectOptions;
    private final Object clientLock = new Object();
    private final AtomicBoolean reconnecting = new AtomicBoolean(false);
    private final ObjectMapper objectMapper = new ObjectMapper();

    public MqttEventSubscriber(
            TemperatureRecommendationService recommendationService,
            String eventsTopic,
            String brokerUrl,
            String clientId,
            boolean autoReconnect) {
        this.recommendationService = recommendationService;
        this.eventsTopic = eventsTopic;
        this.brokerUrl = brokerUrl;
        this.clientId = clientId;
        this.autoReconnect = autoReconnect;
    }

    @PostConstruct
    public void init() {
        try {
            connectOptions = buildConnectOptions();
            connectClient(true);
            logger.info("Cliente MQTT conectado al broker: {}", brokerUrl);
        } catch (MqttException e) {
            // La aplicación sigue funcionando por REST sin MQTT
            logger.warn("No se pudo conectar con el broker MQTT: {}", e.getMessage());
            if (autoReconnect) {
                scheduleReconnect();
            }
        }
    }

    @PreDestroy
    public void destroy() {
        synchronized (clientLock) {
            reconnecting.set(false);
            if (mqttClient != null && mqttClient.isConnected()) {
                try {
                    mqttClient.disconnect();
                    mqttClient.close();
                    logger.info("Cliente MQTT desconectado");
                } catch (MqttException e) {
                    logger.error("Error al desconectar cliente MQTT: {}", e.getMessage(), e);
                }
            }
        }
    }

    private MqttConnectOptions buildConnectOptions() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setAutomaticReconnect(false);
        options.setCleanSession(true);
        options.setConnectionTimeout(30);
        options.setKeepAliveInterval(60);
        return options;
    }

    private void connectClient(boolean forceNewClient) throws MqttException {
        synchronized (clientLock) {
            if (forceNewClient || mqttClient == null) {
                if (mqttClient != null) {
                    try {
                        mqttClient.close();
                    } catch (MqttException e) {
                        logger.debug("Error al cerrar el cliente MQTT previo: {}", e.getMessage());
                    }
                }
                String uniqueClientId = clientId + "-" + System.currentTimeMillis();
                mqttClient = new MqttClient(brokerUrl, uniqueClientId, new MemoryPersistence());
                mqttClient.setCallback(this);
            }

            if (connectOptions == null) {
                connectOptions = buildConnectOptions();
            }

            if (!mqttClient.isConnected()) {
                mqttClient.connect(connectOptions);
                mqttClient.subscribe(eventsTopic, 1); // QoS 1
                logger.info("Suscrito al tópico de eventos: {}", eventsTopic);
            }
        }
    }

    @Override
    public void connectionLost(Throwable cause) {
        logger.warn("Conexión MQTT perdida: {}", cause != null ? cause.getMessage() : "desconocido");

        if (autoReconnect) {
            logger.info("Intentando reconectar...");
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        if (!reconnecting.compareAndSet(false, true)) {
            return;
        }

        Thread reconnectionThread = new Thread(() -> {
            while (reconnecting.get()) {
                try {
                    connectClient(true);
                    logger.info("Reconexión MQTT exitosa al broker: {}", brokerUrl);
                    reconnecting.set(false);
                } catch (MqttException e) {
                    logger.warn("Reintento de conexión MQTT fallido: {}. Nuevo intento en 5s...", e.getMessage());
                    try {
                        Thread.sleep(5000);
                    } catch (InterruptedException interruptedException) {
                        Thread.currentThread().interrupt();
                        reconnecting.set(false);
                    }
                }
            }
        }, "mqtt-reconnector");

        reconnectionThread.setDaemon(true);
        reconnectionThread.start();
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        String payload = new String(message.getPayload(), StandardCharsets.UTF_8);
        logger.debug("Mensaje recibido del tópico: {} - {}", topic, payload);
        try {
            handleEvent(objectMapper.readTree(payload));
        } catch (Exception e) {
            // Un mensaje inválido no debe cortar la suscripción
            logger.error("Error al procesar mensaje MQTT del tópico {}: {}", topic, e.getMessage());
        }
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
        // No se usa en este caso ya que solo subscribimos, no publicamos
    }

    /**
     * Despacha un evento según su campo "type".
     *
     * @return false si el tipo no es reconocido
     */
    boolean handleEvent(JsonNode event) {
        String type = text(event, "type");
        if (type == null) {
            throw new IllegalArgumentException("El evento no tiene campo 'type'");
        }
        String unitId = text(event, "unit_id");
        if (unitId == null) {
            unitId = text(event, "entity_id");
        }

        switch (type) {
            case "recommendation-applied":
                recommendationService.onRecommendationApplied(RecommendationAppliedRequest.builder()
                        .unitId(unitId)
                        .recommendedTemperature(number(event, "recommended_temperature"))
                        .appliedBy(text(event, "applied_by"))
                        .build());
                return true;
            case "temperature-manually-changed":
                recommendationService.onTemperatureChanged(TemperatureChangedRequest.builder()
                        .unitId(unitId)
                        .newTemperature(number(event, "new_temperature"))
                        .previousTemperature(event.has("previous_temperature") ? number(event, "previous_temperature") : null)
                        .changedBy(text(event, "changed_by"))
                        .build());
                return true;
            case "entity-selected":
            case "ac-selected":
                recommendationService.onUnitSelected(UnitSelectedRequest.builder().unitId(unitId).build());
                return true;
            default:
                logger.warn("Tipo de evento MQTT desconocido: {}", type);
                return false;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new IllegalArgumentException("Campo numérico requerido: " + field);
        }
        return value.asDouble();
    }

    public boolean isConnected() {
        synchronized (clientLock) {
            return mqttClient != null && mqttClient.isConnected();
        }
    }
}
