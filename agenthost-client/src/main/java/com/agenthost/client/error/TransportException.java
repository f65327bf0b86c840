package com.agenthost.client.error;

/**
 * A transport could not be opened or a message could not be delivered.
 */
public class TransportException extends AgentHostException {

    private final int httpStatus;

    public TransportException(String message) {
        this(message, 0, null);
    }

    public TransportException(String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    /**
     * HTTP status of the failed request, 0 when the failure happened below HTTP.
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
