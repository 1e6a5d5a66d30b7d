package org.airspace.dss.domain.error;

import org.airspace.dss.domain.model.EntityKind;

/**
 * Read, update or delete targeting an id that does not exist.
 */
public class NotFoundException extends StoreException {

    public NotFoundException(EntityKind kind, String message) {
        super(ErrorCode.NOT_FOUND, kind, message);
    }

    public NotFoundException(EntityKind kind, String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, kind, message, cause);
    }
}
