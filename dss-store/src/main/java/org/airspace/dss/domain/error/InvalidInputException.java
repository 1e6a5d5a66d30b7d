package org.airspace.dss.domain.error;

import org.airspace.dss.domain.model.EntityKind;

/**
 * Malformed or missing required input (footprint, filter, entity fields). Raised before any mutation.
 */
public class InvalidInputException extends StoreException {

    public InvalidInputException(EntityKind kind, String message) {
        super(ErrorCode.INVALID_INPUT, kind, message);
    }

    public InvalidInputException(EntityKind kind, String message, Throwable cause) {
        super(ErrorCode.INVALID_INPUT, kind, message, cause);
    }
}
