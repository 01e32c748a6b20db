package com.forgeloop.core.collaborator;

import java.util.List;

/**
 * Prior knowledge gathered from files that passed their tests.
 */
public interface KnowledgeCollaborator extends CapabilityAware {

    List<String> getRelevantKnowledge(String path);

    /** Called only once a file's tests pass. */
    void learnFromSuccess(String path, String code);
}
