package com.forgeloop.core.project;

import com.forgeloop.core.model.AgentRole;
import com.forgeloop.core.model.AppPlan;
import com.forgeloop.core.model.ArtifactNode;
import com.forgeloop.core.model.ChatMessage;
import com.forgeloop.core.model.IdeationResult;
import com.forgeloop.core.model.ProjectPhase;
import com.forgeloop.core.model.TerminalEntry;
import com.forgeloop.core.tree.ArtifactTree;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Aggregate project state. Mutators are package-private: only {@link ProjectPhaseController}
 * changes it. Every method holds the state's monitor.
 */
public class ProjectState {

    static final int MAX_TERMINAL_ENTRIES = 1000;

    private ProjectPhase phase = ProjectPhase.IDEA_INPUT;
    private String originalPrompt;
    private IdeationResult ideation;
    private AppPlan plan;
    private final List<ChatMessage> chat = new ArrayList<>();
    private ArtifactTree tree = new ArtifactTree();
    private String selectedPath;
    private boolean building;
    private String error;
    private final Deque<TerminalEntry> terminal = new ArrayDeque<>();

    synchronized void reset() {
        phase = ProjectPhase.IDEA_INPUT;
        originalPrompt = null;
        ideation = null;
        plan = null;
        chat.clear();
        tree = new ArtifactTree();
        selectedPath = null;
        error = null;
        terminal.clear();
    }

    synchronized void startIdeation(String prompt) {
        phase = ProjectPhase.IDEATION;
        originalPrompt = prompt;
    }

    synchronized void setIdeation(IdeationResult ideation) {
        this.ideation = ideation;
    }

    synchronized void startPlanning(String refinedPrompt) {
        phase = ProjectPhase.PLANNING;
        originalPrompt = refinedPrompt;
    }

    /** Installs a plan and a fresh tree built from it. */
    synchronized void setPlan(AppPlan plan, ArtifactTree tree) {
        this.plan = plan;
        this.tree = tree;
        this.phase = ProjectPhase.CODING;
        this.selectedPath = null;
    }

    synchronized void addChat(ChatMessage message) {
        chat.add(message);
    }

    synchronized void addTerminal(AgentRole agent, String message, TerminalEntry.Level level) {
        terminal.addLast(new TerminalEntry(agent, message, level, Instant.now()));
        while (terminal.size() > MAX_TERMINAL_ENTRIES) {
            terminal.removeFirst();
        }
    }

    synchronized void clearTerminal() {
        terminal.clear();
    }

    synchronized void setSelectedPath(String selectedPath) {
        this.selectedPath = selectedPath;
    }

    synchronized void setBuilding(boolean building) {
        this.building = building;
    }

    synchronized void setError(String error) {
        this.error = error;
    }

    public synchronized ProjectPhase phase() {
        return phase;
    }

    public synchronized String originalPrompt() {
        return originalPrompt;
    }

    public synchronized IdeationResult ideation() {
        return ideation;
    }

    public synchronized AppPlan plan() {
        return plan;
    }

    public synchronized ArtifactTree tree() {
        return tree;
    }

    public synchronized String selectedPath() {
        return selectedPath;
    }

    public synchronized boolean building() {
        return building;
    }

    public synchronized String error() {
        return error;
    }

    public synchronized ProjectSnapshot snapshot() {
        List<ArtifactNode> roots = tree.flatten().stream()
                .filter(node -> ArtifactTree.parentOf(node.path()) == null)
                .toList();
        return new ProjectSnapshot(phase, originalPrompt, ideation, plan, chat, roots,
                selectedPath, building, error, new ArrayList<>(terminal));
    }
}
