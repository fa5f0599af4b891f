package com.thermoadvisor.domain.model;

/**
 * Origen de una recomendación:
 * - EXPLORATION: acción aleatoria (probabilidad epsilon)
 * - EXPLOITATION: mejor acción conocida
 * - FALLBACK: recomendación determinística por error o datos inválidos
 */
public enum ExplorationReason {
    EXPLORATION,
    EXPLOITATION,
    FALLBACK
}
