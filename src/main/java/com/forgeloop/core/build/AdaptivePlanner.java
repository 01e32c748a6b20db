package com.forgeloop.core.build;

import com.forgeloop.core.events.EventBus;
import com.forgeloop.core.events.LifecycleEventType;
import com.forgeloop.core.metrics.ForgeloopMetrics;
import com.forgeloop.core.model.ArtifactKind;
import com.forgeloop.core.model.ArtifactNode;
import com.forgeloop.core.tree.ArtifactTree;
import com.forgeloop.core.tree.DuplicatePathException;
import com.forgeloop.core.tree.InvalidParentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Adds work discovered during generation to the live artifact tree.
 * <p>
 * Inserted files start out PLANNED. The pipeline re-derives its work list after every step,
 * so they get built in the same run even when they sort before the file being generated.
 */
@Component
public class AdaptivePlanner {

    private static final Logger log = LoggerFactory.getLogger(AdaptivePlanner.class);

    private final EventBus eventBus;
    private final ForgeloopMetrics metrics;

    public AdaptivePlanner(EventBus eventBus, ForgeloopMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Inserts a file, creating missing ancestor directories first.
     * Duplicates and unusable paths are reported, never thrown.
     */
    public InsertionResult insertRequestedFile(ArtifactTree tree, String path, String reason) {
        InsertionResult result = doInsert(tree, path, reason);
        metrics.recordAdaptiveInsertion(result.metricTag());
        return result;
    }

    private InsertionResult doInsert(ArtifactTree tree, String rawPath, String reason) {
        String path;
        try {
            path = ArtifactTree.normalize(rawPath);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring plan modification with unusable path '{}': {}", rawPath, e.getMessage());
            return InsertionResult.REJECTED;
        }

        if (tree.contains(path)) {
            log.warn("Plan modification asked for existing path {}, ignoring", path);
            return InsertionResult.DUPLICATE;
        }

        List<String> ancestors = ancestorsOf(path);
        for (String ancestor : ancestors) {
            Optional<ArtifactNode> existing = tree.findByPath(ancestor);
            if (existing.isPresent() && existing.get().isFile()) {
                log.warn("Cannot add {}: ancestor {} is a file", path, ancestor);
                return InsertionResult.REJECTED;
            }
        }

        try {
            for (String ancestor : ancestors) {
                if (!tree.contains(ancestor)) {
                    tree.insert(ancestor, ArtifactKind.DIRECTORY);
                    log.debug("Created directory {} for {}", ancestor, path);
                }
            }
            tree.insert(path, ArtifactKind.FILE);
        } catch (DuplicatePathException e) {
            // Lost a race with a concurrent insert of the same path.
            log.warn("Plan modification raced with another insert of {}, ignoring", e.getPath());
            return InsertionResult.DUPLICATE;
        } catch (InvalidParentException e) {
            log.warn("Cannot add {}: {}", path, e.getMessage());
            return InsertionResult.REJECTED;
        }

        log.info("Adaptive planning added {} ({})", path, reason);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("action", "fileAdded");
        payload.put("path", path);
        payload.put("reason", reason);
        eventBus.emit(LifecycleEventType.PROJECT_UPDATED, payload);
        return InsertionResult.INSERTED;
    }

    /** Ancestor paths of a normalized path, outermost first. */
    static List<String> ancestorsOf(String path) {
        var out = new ArrayList<String>();
        int slash = path.indexOf('/');
        while (slash > 0) {
            out.add(path.substring(0, slash));
            slash = path.indexOf('/', slash + 1);
        }
        return out;
    }
}
