package com.agenthost.protocol.payload;

/**
 * A frame decoded as JSON but its payload does not fit the expected shape.
 */
public class PayloadException extends RuntimeException {

    private final String eventName;

    public PayloadException(String eventName, String message, Throwable cause) {
        super(eventName + ": " + message, cause);
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
