package com.forgeloop.core.events;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link WebhookTransport} over the JDK {@link HttpClient}.
 */
public class HttpWebhookTransport implements WebhookTransport {

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpWebhookTransport(Duration connectTimeout, Duration requestTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void post(URI destination, Map<String, String> headers, byte[] body) {
        var builder = HttpRequest.newBuilder(destination)
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        headers.forEach(builder::header);

        HttpResponse<Void> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            throw new WebhookDeliveryException("POST " + destination + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WebhookDeliveryException("POST " + destination + " interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new WebhookDeliveryException("POST " + destination + " returned HTTP " + status, status);
        }
    }
}
