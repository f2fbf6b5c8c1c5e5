package com.product.resolution.cluster;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Disjoint-set forest over record ids with path compression and union by rank.
 * Not thread-safe; built and read by one thread after scoring has completed.
 */
class UnionFind {

    private final List<String> ids;
    private final Map<String, Integer> index = new HashMap<>();
    private final int[] parent;
    private final int[] rank;

    UnionFind(List<String> ids) {
        this.ids = List.copyOf(ids);
        this.parent = new int[ids.size()];
        this.rank = new int[ids.size()];
        for (int i = 0; i < ids.size(); i++) {
            parent[i] = i;
            index.put(ids.get(i), i);
        }
    }

    boolean contains(String id) {
        return index.containsKey(id);
    }

    /**
     * Merges the sets of two ids. Returns false when they were already connected.
     */
    boolean union(String a, String b) {
        int rootA = find(index.get(a));
        int rootB = find(index.get(b));
        if (rootA == rootB) {
            return false;
        }
        if (rank[rootA] < rank[rootB]) {
            parent[rootA] = rootB;
        } else if (rank[rootA] > rank[rootB]) {
            parent[rootB] = rootA;
        } else {
            parent[rootB] = rootA;
            rank[rootA]++;
        }
        return true;
    }

    /**
     * Returns the connected components, each listing its ids in input order.
     */
    List<List<String>> components() {
        Map<Integer, List<String>> byRoot = new TreeMap<>();
        for (int i = 0; i < ids.size(); i++) {
            byRoot.computeIfAbsent(find(i), r -> new ArrayList<>()).add(ids.get(i));
        }
        return new ArrayList<>(byRoot.values());
    }

    private int find(int i) {
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
