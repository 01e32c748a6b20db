package com.forgeloop.core.project;

import com.forgeloop.core.model.AppPlan;
import com.forgeloop.core.model.ArtifactNode;
import com.forgeloop.core.model.ChatMessage;
import com.forgeloop.core.model.IdeationResult;
import com.forgeloop.core.model.ProjectPhase;
import com.forgeloop.core.model.TerminalEntry;

import java.util.List;

/**
 * Read-only copy of the project state at one point in time.
 *
 * @param artifacts top-level artifact nodes, each carrying its subtree
 */
public record ProjectSnapshot(
    ProjectPhase phase,
    String originalPrompt,
    IdeationResult ideation,
    AppPlan plan,
    List<ChatMessage> chat,
    List<ArtifactNode> artifacts,
    String selectedPath,
    boolean building,
    String error,
    List<TerminalEntry> terminal
) {

    public ProjectSnapshot {
        chat = List.copyOf(chat);
        artifacts = List.copyOf(artifacts);
        terminal = List.copyOf(terminal);
    }
}
