package com.forgeloop.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/project/idea.
 *
 * @param prompt the raw app idea
 */
public record IdeaRequest(String prompt) {}
