package com.thermoadvisor.unit.infrastructure;

import com.thermoadvisor.domain.model.api.dto.RecommendationAppliedRequest;
import com.thermoadvisor.domain.model.api.dto.TemperatureChangedRequest;
import com.thermoadvisor.domain.model.api.dto.UnitSelectedRequest;
import com.thermoadvisor.domain.service.TemperatureRecommendationService;
import com.thermoadvisor.infrastructure.mqtt.MqttEventSubscriber;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Despacho de eventos MQTT sin broker: se invoca el callback directamente.
 */
@DisplayName("MqttEventSubscriber - Tests Unitarios")
class MqttEventSubscriberTest {

    private static final String TOPIC = "thermo/events/app";

    private TemperatureRecommendationService service;
    private MqttEventSubscriber subscriber;

    @BeforeEach
    void setUp() {
        service = mock(TemperatureRecommendationService.class);
        subscriber = new MqttEventSubscriber(service, "thermo/events/#", "tcp://localhost:1883", "test", false);
    }

    private static MqttMessage message(String json) {
        return new MqttMessage(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Debe despachar recommendation-applied al servicio")
    void shouldDispatchRecommendationApplied() {
        subscriber.messageArrived(TOPIC, message("""
                {"type": "recommendation-applied", "unit_id": "ac-living",
                 "recommended_temperature": 25.0, "applied_by": "app"}
                """));

        ArgumentCaptor<RecommendationAppliedRequest> request = ArgumentCaptor.forClass(RecommendationAppliedRequest.class);
        verify(service).onRecommendationApplied(request.capture());
        assertThat(request.getValue().getUnitId()).isEqualTo("ac-living");
        assertThat(request.getValue().getRecommendedTemperature()).isEqualTo(25.0);
        assertThat(request.getValue().getAppliedBy()).isEqualTo("app");
    }

    @Test
    @DisplayName("Debe despachar temperature-manually-changed con y sin temperatura previa")
    void shouldDispatchManualChange() {
        subscriber.messageArrived(TOPIC, message("""
                {"type": "temperature-manually-changed", "unit_id": "ac-living",
                 "new_temperature": 23, "previous_temperature": 25, "changed_by": "remote"}
                """));

        ArgumentCaptor<TemperatureChangedRequest> request = ArgumentCaptor.forClass(TemperatureChangedRequest.class);
        verify(service).onTemperatureChanged(request.capture());
        assertThat(request.getValue().getNewTemperature()).isEqualTo(23.0);
        assertThat(request.getValue().getPreviousTemperature()).isEqualTo(25.0);
        assertThat(request.getValue().getChangedBy()).isEqualTo("remote");
    }

    @Test
    @DisplayName("Debe aceptar entity_id como id de unidad en la selección")
    void shouldDispatchUnitSelected() {
        subscriber.messageArrived(TOPIC, message("{\"type\": \"ac-selected\", \"entity_id\": \"ac-oficina\"}"));

        ArgumentCaptor<UnitSelectedRequest> request = ArgumentCaptor.forClass(UnitSelectedRequest.class);
        verify(service).onUnitSelected(request.capture());
        assertThat(request.getValue().getUnitId()).isEqualTo("ac-oficina");
    }

    @Test
    @DisplayName("Mensajes inválidos o de tipo desconocido se descartan sin cortar la suscripción")
    void shouldIgnoreInvalidMessages() {
        subscriber.messageArrived(TOPIC, message("no es json"));
        subscriber.messageArrived(TOPIC, message("{\"unit_id\": \"ac-living\"}"));
        subscriber.messageArrived(TOPIC, message("{\"type\": \"power-reading\", \"unit_id\": \"ac-living\"}"));
        subscriber.messageArrived(TOPIC, message("{\"type\": \"temperature-manually-changed\", \"unit_id\": \"ac-living\"}"));

        verifyNoInteractions(service);
    }

    @Test
    @DisplayName("Sin broker disponible, init no debe lanzar excepción")
    void shouldStartWithoutBroker() {
        MqttEventSubscriber offline = new MqttEventSubscriber(service, "thermo/events/#", "tcp://localhost:1", "test", false);

        offline.init();

        assertThat(offline.isConnected()).isFalse();
        verify(service, never()).onUnitSelected(any());
        offline.destroy();
    }

    @Test
    @DisplayName("Como callback solo de suscripción, deliveryComplete no hace nada")
    void shouldIgnoreDeliveryComplete() {
        MqttCallback callback = subscriber;

        assertThatCode(() -> callback.deliveryComplete(null)).doesNotThrowAnyException();

        verifyNoInteractions(service);
    }
}
