package fr.lapetina.inference.router.domain.model;

/**
 * Health status of a worker as seen by the gateway.
 *
 * UP: Worker answers its health probe and requests
 * DEGRADED: Worker answers but recent calls failed
 * DOWN: Worker is unreachable or its circuit is open
 */
public enum NodeHealth {
    UP,
    DEGRADED,
    DOWN
}
