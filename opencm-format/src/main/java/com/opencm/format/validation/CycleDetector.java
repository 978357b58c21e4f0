package com.opencm.format.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph over variable names with bounded cycle enumeration.
 * <p>
 * {@link #findCycles(int)} runs an iterative three-colour depth-first search (unvisited, on the
 * current path, finished) from every unvisited node in insertion order. An arc into a node on the
 * current path closes a cycle, rebuilt from the path suffix starting at that node. Search stops once
 * {@code limit} distinct cycles are recorded.
 */
public final class CycleDetector {

    private enum Mark { ON_PATH, DONE }

    private final Map<String, List<String>> successors = new LinkedHashMap<>();

    /** Adds the arc {@code source -> target}, registering both nodes. */
    public CycleDetector arc(String source, String target) {
        successors.computeIfAbsent(source, k -> new ArrayList<>()).add(target);
        successors.computeIfAbsent(target, k -> new ArrayList<>());
        return this;
    }

    public int nodeCount() {
        return successors.size();
    }

    public boolean hasCycle() {
        return !findCycles(1).isEmpty();
    }

    /**
     * Returns up to {@code limit} distinct cycles. Each cycle lists its nodes in arc order and
     * repeats the first node at the end, e.g. {@code [a, b, a]}.
     */
    public List<List<String>> findCycles(int limit) {
        List<List<String>> cycles = new ArrayList<>();
        if (limit <= 0) return cycles;
        Set<List<String>> seen = new HashSet<>();
        Map<String, Mark> marks = new HashMap<>();
        List<String> path = new ArrayList<>();
        Map<String, Integer> pathIndex = new HashMap<>();
        Deque<int[]> cursors = new ArrayDeque<>();

        for (String start : successors.keySet()) {
            if (marks.containsKey(start)) continue;
            enter(start, marks, path, pathIndex, cursors);
            while (!cursors.isEmpty()) {
                String node = path.get(path.size() - 1);
                int[] cursor = cursors.peek();
                List<String> next = successors.get(node);
                if (cursor[0] < next.size()) {
                    String succ = next.get(cursor[0]++);
                    Mark mark = marks.get(succ);
                    if (mark == null) {
                        enter(succ, marks, path, pathIndex, cursors);
                    } else if (mark == Mark.ON_PATH) {
                        List<String> cycle = new ArrayList<>(path.subList(pathIndex.get(succ), path.size()));
                        if (seen.add(canonical(cycle))) {
                            cycle.add(succ);
                            cycles.add(List.copyOf(cycle));
                            if (cycles.size() >= limit) return cycles;
                        }
                    }
                } else {
                    marks.put(node, Mark.DONE);
                    pathIndex.remove(node);
                    path.remove(path.size() - 1);
                    cursors.pop();
                }
            }
        }
        return cycles;
    }

    private static void enter(String node, Map<String, Mark> marks, List<String> path,
                              Map<String, Integer> pathIndex, Deque<int[]> cursors) {
        marks.put(node, Mark.ON_PATH);
        pathIndex.put(node, path.size());
        path.add(node);
        cursors.push(new int[]{0});
    }

    /** Rotation of the cycle that starts at its smallest node, so the same cycle found twice compares equal. */
    private static List<String> canonical(List<String> cycle) {
        int min = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(min)) < 0) min = i;
        }
        List<String> rotated = new ArrayList<>(cycle.size());
        rotated.addAll(cycle.subList(min, cycle.size()));
        rotated.addAll(cycle.subList(0, min));
        return rotated;
    }
}
