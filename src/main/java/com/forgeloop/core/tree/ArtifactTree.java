package com.forgeloop.core.tree;

import com.forgeloop.core.model.ArtifactKind;
import com.forgeloop.core.model.ArtifactNode;
import com.forgeloop.core.model.ArtifactStatus;
import com.forgeloop.core.model.PlannedFile;
import com.forgeloop.core.model.TestStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Hierarchical, path-addressed store of planned and generated artifacts.
 * <p>
 * Nodes live behind the tree's monitor; callers only ever see immutable
 * {@link ArtifactNode} snapshots. Every public mutation is atomic, so an interactive
 * edit interleaved with a running build cannot break path uniqueness or the
 * parent-before-child rule.
 * <p>
 * {@link #flatten()} is recomputed on each call. The build pipeline relies on that to
 * pick up nodes inserted while it is running.
 */
public class ArtifactTree {

    private final List<Node> roots = new ArrayList<>();
    private final Map<String, Node> index = new HashMap<>();

    /**
     * Builds a fresh tree from a plan's file structure.
     * Relative child paths are resolved against their parent directory.
     */
    public static ArtifactTree fromPlan(List<PlannedFile> structure) {
        var tree = new ArtifactTree();
        if (structure != null) {
            for (PlannedFile entry : structure) {
                tree.insertPlanned(entry, null);
            }
        }
        return tree;
    }

    private void insertPlanned(PlannedFile entry, String parentPath) {
        String path = normalize(entry.path());
        if (parentPath != null && !path.startsWith(parentPath + "/")) {
            path = parentPath + "/" + path;
        }
        insert(path, entry.type());
        for (PlannedFile child : entry.children()) {
            insertPlanned(child, path);
        }
    }

    /**
     * Inserts a new node with status {@link ArtifactStatus#PLANNED}.
     *
     * @throws DuplicatePathException if the path is already taken
     * @throws InvalidParentException if the parent path is not an existing directory
     */
    public synchronized ArtifactNode insert(String path, ArtifactKind kind) {
        String normalized = normalize(path);
        if (index.containsKey(normalized)) {
            throw new DuplicatePathException(normalized);
        }
        String parentPath = parentOf(normalized);
        var node = new Node(normalized, kind != null ? kind : ArtifactKind.FILE);
        if (parentPath == null) {
            roots.add(node);
        } else {
            Node parent = index.get(parentPath);
            if (parent == null || parent.kind != ArtifactKind.DIRECTORY) {
                throw new InvalidParentException(normalized, parentPath);
            }
            parent.children.add(node);
        }
        index.put(normalized, node);
        return node.snapshot();
    }

    public synchronized Optional<ArtifactNode> findByPath(String path) {
        Node node = index.get(normalize(path));
        return node == null ? Optional.empty() : Optional.of(node.snapshot());
    }

    public synchronized boolean contains(String path) {
        return index.containsKey(normalize(path));
    }

    /**
     * Stores code on a file and advances its status: a first generation moves it to
     * {@link ArtifactStatus#GENERATED}, any later code moves it to {@link ArtifactStatus#MODIFIED}.
     * New code invalidates the previous test verdict.
     *
     * @throws ArtifactNotFoundException if no node exists at the path
     * @throws IllegalArgumentException  if the node is a directory
     */
    public synchronized ArtifactNode setCode(String path, String code) {
        Node node = require(path);
        if (node.kind == ArtifactKind.DIRECTORY) {
            throw new IllegalArgumentException("Directories cannot hold code: " + node.path);
        }
        node.code = code;
        node.status = node.status.hasCode() ? ArtifactStatus.MODIFIED : ArtifactStatus.GENERATED;
        node.testStatus = TestStatus.UNTESTED;
        node.testError = null;
        return node.snapshot();
    }

    public synchronized ArtifactNode setStatus(String path, ArtifactStatus status) {
        Node node = require(path);
        node.status = status;
        return node.snapshot();
    }

    /**
     * Records a test verdict. The error is kept only for {@link TestStatus#FAILING}.
     */
    public synchronized ArtifactNode setTestStatus(String path, TestStatus testStatus, String testError) {
        Node node = require(path);
        node.testStatus = testStatus;
        node.testError = testStatus == TestStatus.FAILING ? testError : null;
        return node.snapshot();
    }

    /**
     * Every node in pre-order: directories before their children, siblings in insertion order.
     */
    public synchronized List<ArtifactNode> flatten() {
        var out = new ArrayList<ArtifactNode>(index.size());
        for (Node root : roots) {
            collect(root, out);
        }
        return List.copyOf(out);
    }

    /** File nodes of {@link #flatten()}, same order. */
    public List<ArtifactNode> files() {
        return flatten().stream().filter(ArtifactNode::isFile).toList();
    }

    public synchronized int size() {
        return index.size();
    }

    private void collect(Node node, List<ArtifactNode> out) {
        out.add(node.snapshot());
        for (Node child : node.children) {
            collect(child, out);
        }
    }

    private Node require(String path) {
        String normalized = normalize(path);
        Node node = index.get(normalized);
        if (node == null) {
            throw new ArtifactNotFoundException(normalized);
        }
        return node;
    }

    /**
     * Canonical form of a path: forward slashes, no leading "./" or "/", no trailing or doubled slashes.
     */
    public static String normalize(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Artifact path must not be blank");
        }
        String p = path.trim().replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        p = p.replaceAll("/{2,}", "/");
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        while (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        if (p.isEmpty()) {
            throw new IllegalArgumentException("Artifact path must not be blank: '" + path + "'");
        }
        return p;
    }

    /** Parent path, or null for a top-level path. */
    public static String parentOf(String normalizedPath) {
        int slash = normalizedPath.lastIndexOf('/');
        return slash > 0 ? normalizedPath.substring(0, slash) : null;
    }

    private static final class Node {
        private final String path;
        private final ArtifactKind kind;
        private final List<Node> children = new ArrayList<>();
        private String code;
        private ArtifactStatus status = ArtifactStatus.PLANNED;
        private TestStatus testStatus = TestStatus.UNTESTED;
        private String testError;

        private Node(String path, ArtifactKind kind) {
            this.path = path;
            this.kind = kind;
        }

        private ArtifactNode snapshot() {
            var childSnapshots = new ArrayList<ArtifactNode>(children.size());
            for (Node child : children) {
                childSnapshots.add(child.snapshot());
            }
            return new ArtifactNode(path, kind, code, status, testStatus, testError, childSnapshots);
        }
    }
}
