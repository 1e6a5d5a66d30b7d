package org.airspace.dss.domain.error;

import org.airspace.dss.domain.model.EntityKind;

/**
 * Base of every error raised by the store.
 *
 * The message carries the entity kind and the key or query shape involved.
 * The store never retries on the caller's behalf.
 */
public class StoreException extends RuntimeException {

    private final ErrorCode code;
    private final EntityKind kind;

    public StoreException(ErrorCode code, EntityKind kind, String message) {
        super(format(code, kind, message));
        this.code = code;
        this.kind = kind;
    }

    public StoreException(ErrorCode code, EntityKind kind, String message, Throwable cause) {
        super(format(code, kind, message), cause);
        this.code = code;
        this.kind = kind;
    }

    private static String format(ErrorCode code, EntityKind kind, String message) {
        if (kind == null) {
            return String.format("[%s] %s", code, message);
        }
        return String.format("[%s:%s] %s", code, kind.displayName(), message);
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * @return entity kind involved, or null when the error is not tied to one kind
     */
    public EntityKind getKind() {
        return kind;
    }
}
