package org.airspace.dss.domain.error;

/**
 * The caller's cancellation signal fired before the operation committed.
 * Nothing the operation wrote is visible.
 */
public class OperationCancelledException extends StoreException {

    public OperationCancelledException(String message) {
        super(ErrorCode.CANCELLED, null, message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(ErrorCode.CANCELLED, null, message, cause);
    }
}
