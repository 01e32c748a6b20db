package com.forgeloop.core.events;

/**
 * A webhook request that was rejected or never reached its destination.
 * Always handled inside {@link EventBus}.
 */
public class WebhookDeliveryException extends RuntimeException {

    private final int statusCode;

    public WebhookDeliveryException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public WebhookDeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the response, or -1 when no response arrived. */
    public int getStatusCode() {
        return statusCode;
    }
}
