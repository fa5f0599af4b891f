package com.thermoadvisor.domain.model.monitoring;

// Token de cancelación de una cuenta regresiva. cancel() es idempotente.
@FunctionalInterface
public interface Cancellable {
    void cancel();
}
