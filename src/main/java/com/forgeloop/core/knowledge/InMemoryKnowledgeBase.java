package com.forgeloop.core.knowledge;

import com.forgeloop.core.collaborator.Capability;
import com.forgeloop.core.collaborator.KnowledgeCollaborator;
import com.forgeloop.core.config.ForgeloopProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bounded in-memory store of files whose tests passed.
 * <p>
 * Recall ranks stored files by closeness to the requested path: same extension first, then
 * the number of shared leading directories, then recency. The oldest entry is evicted once
 * the store is full; relearning a path replaces its entry.
 */
@Component
public class InMemoryKnowledgeBase implements KnowledgeCollaborator {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKnowledgeBase.class);

    static final int MAX_SNIPPET_CHARS = 2000;

    private final int maxSnippets;
    private final int maxEntries;
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();
    private long sequence;

    @Autowired
    public InMemoryKnowledgeBase(ForgeloopProperties properties) {
        this(properties.getKnowledge().getMaxSnippets(), properties.getKnowledge().getMaxEntries());
    }

    public InMemoryKnowledgeBase(int maxSnippets, int maxEntries) {
        this.maxSnippets = maxSnippets;
        this.maxEntries = Math.max(1, maxEntries);
    }

    @Override
    public Set<Capability> capabilities() {
        return EnumSet.of(Capability.KNOWLEDGE_RECALL, Capability.KNOWLEDGE_LEARN);
    }

    @Override
    public synchronized List<String> getRelevantKnowledge(String path) {
        if (path == null || entries.isEmpty() || maxSnippets <= 0) {
            return List.of();
        }
        String extension = extensionOf(path);
        List<String> directories = directoriesOf(path);
        return entries.values().stream()
                .filter(entry -> !entry.path.equals(path))
                .filter(entry -> entry.extension.equals(extension) || sharedPrefix(entry.directories, directories) > 0)
                .sorted(Comparator
                        .comparing((Entry entry) -> entry.extension.equals(extension)).reversed()
                        .thenComparing(Comparator.comparingInt(
                                (Entry entry) -> sharedPrefix(entry.directories, directories)).reversed())
                        .thenComparing(Comparator.comparingLong((Entry entry) -> entry.sequence).reversed()))
                .limit(maxSnippets)
                .map(Entry::snippet)
                .toList();
    }

    @Override
    public synchronized void learnFromSuccess(String path, String code) {
        if (path == null || code == null || code.isBlank()) {
            return;
        }
        entries.remove(path);
        entries.put(path, new Entry(path, code, ++sequence));
        Iterator<Map.Entry<String, Entry>> oldest = entries.entrySet().iterator();
        while (entries.size() > maxEntries && oldest.hasNext()) {
            String evicted = oldest.next().getKey();
            oldest.remove();
            log.debug("Knowledge base full, evicted {}", evicted);
        }
        log.debug("Learned from {} ({} entries)", path, entries.size());
    }

    public synchronized int size() {
        return entries.size();
    }

    static String extensionOf(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        return dot > slash ? path.substring(dot) : "";
    }

    static List<String> directoriesOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash > 0 ? List.of(path.substring(0, slash).split("/")) : List.of();
    }

    private static int sharedPrefix(List<String> a, List<String> b) {
        int n = 0;
        while (n < a.size() && n < b.size() && a.get(n).equals(b.get(n))) {
            n++;
        }
        return n;
    }

    private static final class Entry {
        private final String path;
        private final String code;
        private final long sequence;
        private final String extension;
        private final List<String> directories;

        private Entry(String path, String code, long sequence) {
            this.path = path;
            this.code = code;
            this.sequence = sequence;
            this.extension = extensionOf(path);
            this.directories = directoriesOf(path);
        }

        private String snippet() {
            String body = code.length() > MAX_SNIPPET_CHARS ? code.substring(0, MAX_SNIPPET_CHARS) + "\n..." : code;
            return "// " + path + "\n" + body;
        }
    }
}
