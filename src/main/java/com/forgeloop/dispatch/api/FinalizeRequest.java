package com.forgeloop.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body for POST /api/v1/project/finalize.
 */
public record FinalizeRequest(
    @JsonProperty("selected_features") List<String> selectedFeatures
) {}
