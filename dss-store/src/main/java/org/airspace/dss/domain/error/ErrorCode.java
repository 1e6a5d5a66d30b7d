package org.airspace.dss.domain.error;

/**
 * Store error taxonomy. Callers branch on the code, not on message text.
 */
public enum ErrorCode {
    INVALID_INPUT,
    NOT_FOUND,
    VERSION_CONFLICT,
    CONSISTENCY_FAULT,
    BACKING_STORE_FAULT,
    CANCELLED
}
