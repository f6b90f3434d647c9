package com.example.archiveindexer.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Non-owning path to mentions multimap. Nodes never point back into it; the resolver
 * copies each path's sorted chain onto the node once all sections are read.
 */
public final class MentionIndex {
    private final Map<String, List<Mention>> byPath = new LinkedHashMap<>();

    public void add(Mention mention) {
        byPath.computeIfAbsent(ArchivePaths.key(mention.targetPath()), ignored -> new ArrayList<>()).add(mention);
    }

    public List<Mention> mentionsOf(String path) {
        List<Mention> found = byPath.get(ArchivePaths.key(path));
        if (found == null) {
            return List.of();
        }
        List<Mention> sorted = new ArrayList<>(found);
        sorted.sort(Mention.INHERITANCE_ORDER);
        return List.copyOf(sorted);
    }

    public Collection<List<Mention>> all() {
        return byPath.values();
    }

    public int size() {
        return byPath.values().stream().mapToInt(List::size).sum();
    }
}
