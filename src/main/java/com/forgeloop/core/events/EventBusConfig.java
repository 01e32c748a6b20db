package com.forgeloop.core.events;

import com.forgeloop.core.config.ForgeloopProperties;
import com.forgeloop.core.metrics.ForgeloopMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Builds the single {@link EventBus} every component shares. Spring closes it on shutdown,
 * which drains the queue before the delivery pool stops.
 */
@Configuration
public class EventBusConfig {

    @Bean
    public WebhookTransport webhookTransport(ForgeloopProperties properties) {
        var webhooks = properties.getWebhooks();
        return new HttpWebhookTransport(
                Duration.ofSeconds(webhooks.getConnectTimeoutSeconds()),
                Duration.ofSeconds(webhooks.getRequestTimeoutSeconds()));
    }

    @Bean(destroyMethod = "close")
    public EventBus eventBus(WebhookTransport webhookTransport, ForgeloopMetrics metrics,
                             ForgeloopProperties properties) {
        var webhooks = properties.getWebhooks();
        return new EventBus(webhookTransport, EventBus.defaultObjectMapper(), metrics,
                webhooks.getSource(), webhooks.getHistorySize(), webhooks.getMaxConcurrentDeliveries());
    }
}
