package org.airspace.dss.domain.error;

import org.airspace.dss.domain.model.EntityKind;
import org.airspace.dss.domain.model.Ovn;

import java.util.UUID;

/**
 * The caller's version token does not match the stored row.
 * The caller is expected to re-read and retry with fresh state.
 */
public class VersionConflictException extends StoreException {

    private final UUID entityId;
    private final Ovn presented;

    public VersionConflictException(EntityKind kind, UUID entityId, Ovn presented, String message) {
        super(ErrorCode.VERSION_CONFLICT, kind, message);
        this.entityId = entityId;
        this.presented = presented;
    }

    public VersionConflictException(EntityKind kind, UUID entityId, Ovn presented, String message, Throwable cause) {
        super(ErrorCode.VERSION_CONFLICT, kind, message, cause);
        this.entityId = entityId;
        this.presented = presented;
    }

    public UUID getEntityId() {
        return entityId;
    }

    /**
     * @return the token the caller presented, or null for a concurrent create
     */
    public Ovn getPresented() {
        return presented;
    }
}
