/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.cache;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Parent to children tree of every dotted category path seen since the last reset.
 *
 * <p>Recording {@code a.b.c} ensures the edges {@code root→a}, {@code a→a.b} and
 * {@code a.b→a.b.c}. Each distinct path is expanded once. Nothing is ever removed
 * except by {@link #clear()}, so the tree outlives the records that produced it.</p>
 *
 * <p>Not thread-safe; {@link EntryCache} guards it with its own lock.</p>
 */
public class ModuleHierarchy {

    public static final String ROOT = "root";

    private final Map<String, Set<String>> children = new LinkedHashMap<>();
    private final Set<String> seen = new HashSet<>();

    /**
     * @return {@code true} if the path was new and the tree changed
     */
    public boolean record(String path) {
        if (path == null || path.isBlank() || !seen.add(path)) {
            return false;
        }
        String[] parts = path.split("\\.");
        StringBuilder prefix = new StringBuilder();
        String parent = ROOT;
        for (String part : parts) {
            if (prefix.length() > 0) prefix.append('.');
            prefix.append(part);
            String child = prefix.toString();
            children.computeIfAbsent(parent, k -> new LinkedHashSet<>()).add(child);
            parent = child;
        }
        return true;
    }

    public Set<String> childrenOf(String path) {
        Set<String> kids = children.get(path);
        return kids == null ? Set.of() : Collections.unmodifiableSet(kids);
    }

    /** Deep copy; later mutations are not visible through it. */
    public Map<String, Set<String>> snapshot() {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        children.forEach((parent, kids) ->
                copy.put(parent, Collections.unmodifiableSet(new LinkedHashSet<>(kids))));
        return Collections.unmodifiableMap(copy);
    }

    /** Number of distinct paths recorded. */
    public int pathCount() {
        return seen.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public void clear() {
        children.clear();
        seen.clear();
    }
}
