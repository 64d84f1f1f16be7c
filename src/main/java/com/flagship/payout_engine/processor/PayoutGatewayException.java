package com.flagship.payout_engine.processor;

/**
 * Failure talking to the payout processor.
 *
 * TRANSIENT covers I/O errors, timeouts, 5xx, 429 and an open circuit:
 * the request may be repeated with the same reference id. PERMANENT is an
 * explicit rejection of the request and must not be retried.
 */
public class PayoutGatewayException extends RuntimeException {

    public enum Kind {
        TRANSIENT,
        PERMANENT
    }

    private final Kind kind;
    private final Integer httpStatus;
    private final boolean timeout;

    private PayoutGatewayException(Kind kind, String message, Integer httpStatus, boolean timeout, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
        this.timeout = timeout;
    }

    public static PayoutGatewayException transientFailure(String message, Integer httpStatus, Throwable cause) {
        return new PayoutGatewayException(Kind.TRANSIENT, message, httpStatus, false, cause);
    }

    public static PayoutGatewayException timeout(String message, Throwable cause) {
        return new PayoutGatewayException(Kind.TRANSIENT, message, null, true, cause);
    }

    public static PayoutGatewayException permanent(String message, Integer httpStatus, Throwable cause) {
        return new PayoutGatewayException(Kind.PERMANENT, message, httpStatus, false, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    public boolean isTimeout() {
        return timeout;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
