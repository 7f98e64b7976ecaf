package com.dcruver.marginnote.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Disjoint sets over string keys. Keys get arena indices in first-seen order,
 * with path compression and union by rank.
 */
public class UnionFind {

    private final Map<String, Integer> indexOf = new LinkedHashMap<>();
    private final List<String> keys = new ArrayList<>();
    private int[] parent = new int[16];
    private int[] rank = new int[16];

    /**
     * Register a key, returning its index
     */
    public int add(String key) {
        Integer existing = indexOf.get(key);
        if (existing != null) {
            return existing;
        }
        int index = keys.size();
        if (index == parent.length) {
            parent = Arrays.copyOf(parent, index * 2);
            rank = Arrays.copyOf(rank, index * 2);
        }
        parent[index] = index;
        rank[index] = 0;
        keys.add(key);
        indexOf.put(key, index);
        return index;
    }

    public boolean contains(String key) {
        return indexOf.containsKey(key);
    }

    public int size() {
        return keys.size();
    }

    public String find(String key) {
        return keys.get(findIndex(add(key)));
    }

    public void union(String a, String b) {
        int rootA = findIndex(add(a));
        int rootB = findIndex(add(b));
        if (rootA == rootB) {
            return;
        }
        if (rank[rootA] < rank[rootB]) {
            parent[rootA] = rootB;
        } else if (rank[rootA] > rank[rootB]) {
            parent[rootB] = rootA;
        } else {
            parent[rootB] = rootA;
            rank[rootA]++;
        }
    }

    public boolean connected(String a, String b) {
        return contains(a) && contains(b) && findIndex(indexOf.get(a)) == findIndex(indexOf.get(b));
    }

    /**
     * Partitions keyed by root index, both in first-seen order of their keys
     */
    public List<List<String>> partitions() {
        Map<Integer, List<String>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            byRoot.computeIfAbsent(findIndex(i), r -> new ArrayList<>()).add(keys.get(i));
        }
        return new ArrayList<>(byRoot.values());
    }

    private int findIndex(int index) {
        int root = index;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[index] != root) {
            int next = parent[index];
            parent[index] = root;
            index = next;
        }
        return root;
    }
}
