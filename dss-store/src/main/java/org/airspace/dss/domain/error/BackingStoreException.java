package org.airspace.dss.domain.error;

import org.airspace.dss.domain.model.EntityKind;

/**
 * Connectivity, transaction or timeout failure of the underlying database.
 */
public class BackingStoreException extends StoreException {

    public BackingStoreException(EntityKind kind, String message) {
        super(ErrorCode.BACKING_STORE_FAULT, kind, message);
    }

    public BackingStoreException(EntityKind kind, String message, Throwable cause) {
        super(ErrorCode.BACKING_STORE_FAULT, kind, message, cause);
    }
}
