package com.forgeloop.core.collaborator;

import java.io.Serializable;

/**
 * Request, attached to a generation result, to add previously unplanned work.
 *
 * @param action only {@value #CREATE_FILE} is understood
 * @param path   path of the file to add
 * @param reason why the generator needs it
 */
public record PlanModificationRequest(
    String action,
    String path,
    String reason
) implements Serializable {

    public static final String CREATE_FILE = "createFile";

    public static PlanModificationRequest createFile(String path, String reason) {
        return new PlanModificationRequest(CREATE_FILE, path, reason);
    }

    public boolean isCreateFile() {
        return CREATE_FILE.equals(action) && path != null && !path.isBlank();
    }
}
