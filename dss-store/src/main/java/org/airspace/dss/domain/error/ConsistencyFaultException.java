package org.airspace.dss.domain.error;

import org.airspace.dss.domain.model.EntityKind;

/**
 * An internal invariant does not hold (empty committed cell set, a single-row fetch returning several rows). Indicates a bootstrap defect or corrupted data.
 */
public class ConsistencyFaultException extends StoreException {

    public ConsistencyFaultException(EntityKind kind, String message) {
        super(ErrorCode.CONSISTENCY_FAULT, kind, message);
    }

    public ConsistencyFaultException(EntityKind kind, String message, Throwable cause) {
        super(ErrorCode.CONSISTENCY_FAULT, kind, message, cause);
    }
}
