package org.airspace.dss.domain.model;

/**
 * Lifecycle states of an Operational Intent.
 * Transition rules are enforced by the API layer, not by the store.
 */
public enum OperationalIntentState {
    ACCEPTED,
    ACTIVATED,
    NONCONFORMING,
    CONTINGENT,
    ENDED
}
