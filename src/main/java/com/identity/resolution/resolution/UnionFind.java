package com.identity.resolution.resolution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Disjoint-set forest over mention ids with path compression.
 *
 * <p>The root of every component is its lexicographically smallest mention id, so the
 * result of a sequence of unions does not depend on tie-breaking inside the structure.
 * Single-writer: not thread-safe.</p>
 */
public class UnionFind {

    private final List<String> ids;
    private final Map<String, Integer> indexOf;
    private final int[] parent;

    public UnionFind(Collection<String> mentionIds) {
        SortedSet<String> sorted = new TreeSet<>(mentionIds);
        this.ids = new ArrayList<>(sorted);
        this.indexOf = new HashMap<>(ids.size() * 2);
        this.parent = new int[ids.size()];
        for (int i = 0; i < ids.size(); i++) {
            indexOf.put(ids.get(i), i);
            parent[i] = i;
        }
    }

    public boolean contains(String mentionId) {
        return indexOf.containsKey(mentionId);
    }

    public String find(String mentionId) {
        return ids.get(findIndex(index(mentionId)));
    }

    public boolean connected(String a, String b) {
        return findIndex(index(a)) == findIndex(index(b));
    }

    /**
     * Joins the components of {@code a} and {@code b}.
     *
     * @return true if two distinct components were joined
     */
    public boolean union(String a, String b) {
        int rootA = findIndex(index(a));
        int rootB = findIndex(index(b));
        if (rootA == rootB) {
            return false;
        }
        // Indices follow id order, so the smaller index is the smaller id.
        if (rootA < rootB) {
            parent[rootB] = rootA;
        } else {
            parent[rootA] = rootB;
        }
        return true;
    }

    /**
     * Components keyed by root id, each with its members in id order.
     */
    public SortedMap<String, SortedSet<String>> components() {
        SortedMap<String, SortedSet<String>> result = new TreeMap<>();
        for (int i = 0; i < ids.size(); i++) {
            String root = ids.get(findIndex(i));
            result.computeIfAbsent(root, k -> new TreeSet<>()).add(ids.get(i));
        }
        return result;
    }

    public int size() {
        return ids.size();
    }

    private int index(String mentionId) {
        Integer idx = indexOf.get(mentionId);
        if (idx == null) {
            throw new IllegalArgumentException("Unknown mention id: " + mentionId);
        }
        return idx;
    }

    private int findIndex(int i) {
        int root = i;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[i] != root) {
            int next = parent[i];
            parent[i] = root;
            i = next;
        }
        return root;
    }
}
