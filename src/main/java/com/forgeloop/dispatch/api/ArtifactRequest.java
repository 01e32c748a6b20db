package com.forgeloop.dispatch.api;

/**
 * Request body naming one artifact, used by generate, test and selection endpoints.
 * A null path means the selected artifact where the endpoint allows it.
 *
 * @param path   artifact path
 * @param code   new code, for PUT /artifacts/code only
 * @param reason why the file is needed, for POST /artifacts only
 */
public record ArtifactRequest(
    String path,
    String code,
    String reason
) {}
