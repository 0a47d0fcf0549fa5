package com.biprov.platform;

/**
 * Transport-level failure of a {@link BiPlatformClient} call: timeout, connection error or a
 * non-success HTTP status.
 *
 * Carries the name of the failed operation and, when the platform answered, its HTTP status.
 * Clients never retry; classification into the provisioning error taxonomy happens in the
 * reconciler.
 */
public class PlatformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final Integer httpStatus;

    public PlatformException(String operation, String message) {
        this(operation, message, null, null);
    }

    public PlatformException(String operation, String message, Throwable cause) {
        this(operation, message, null, cause);
    }

    public PlatformException(String operation, String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.httpStatus = httpStatus;
    }

    public String getOperation() {
        return operation;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    public boolean isClientError() {
        return httpStatus != null && httpStatus >= 400 && httpStatus < 500;
    }

    public boolean isServerError() {
        return httpStatus != null && httpStatus >= 500;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (httpStatus != null) {
            sb.append(" [HTTP ").append(httpStatus).append("]");
        }
        return sb.toString();
    }
}
