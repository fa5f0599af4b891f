package com.thermoadvisor.domain.model.persistence;

/**
 * Puerta de acceso al almacenamiento durable del aprendizaje.
 *
 * {@link #load()} nunca falla: si no hay datos o el almacenamiento no responde
 * devuelve un snapshot vacío. {@link #save(LearningSnapshot)} es asíncrono y no
 * bloquea al llamador.
 */
public interface PersistenceGateway {

    LearningSnapshot load();

    void save(LearningSnapshot snapshot);

    // Cantidad de snapshots esperando escritura o reintento
    default int pendingSaves() {
        return 0;
    }

    // Snapshots descartados tras agotar los reintentos
    default long droppedSaves() {
        return 0;
    }
}
