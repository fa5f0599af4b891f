package com.thermoadvisor.infrastructure.config;

import com.thermoadvisor.domain.service.TemperatureRecommendationService;
import com.thermoadvisor.infrastructure.mqtt.MqttEventSubscriber;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuración para el cliente MQTT que recibe los eventos de la aplicación.
 * Se activa salvo que mqtt.enabled=false; los tests de la API REST lo desactivan por propiedad.
 */
@Configuration
public class MqttConfig {

    @Bean
    @ConditionalOnProperty(name = "mqtt.enabled", havingValue = "true", matchIfMissing = true)
    public MqttEventSubscriber mqttEventSubscriber(
            TemperatureRecommendationService recommendationService,
            @Value("${mqtt.broker:tcp://localhost:1883}") String brokerUrl,
            @Value("${mqtt.client-id:thermo-advisor}") String clientId,
            @Value("${mqtt.auto-reconnect:true}") boolean autoReconnect,
            @Value("${mqtt.events-topic:thermo/events/#}") String eventsTopic) {
        return new MqttEventSubscriber(recommendationService, eventsTopic, brokerUrl, clientId, autoReconnect);
    }
}
