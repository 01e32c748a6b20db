package com.forgeloop.core.events;

import java.net.URI;
import java.util.Map;

/**
 * Sends one webhook request.
 */
public interface WebhookTransport {

    /**
     * POSTs the body to the destination.
     *
     * @throws WebhookDeliveryException on a non-2xx response or a transport error
     */
    void post(URI destination, Map<String, String> headers, byte[] body);
}
