package com.forgeloop.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/webhooks.
 *
 * @param url     destination URL (http or https)
 * @param events  event type wire names, e.g. "build.failed"
 * @param secret  shared signing secret; nullable
 * @param headers static headers sent with every delivery; nullable
 */
public record WebhookRequest(
    String url,
    @JsonProperty("events") List<String> events,
    String secret,
    Map<String, String> headers
) {}
