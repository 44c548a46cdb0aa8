package com.renflow.renflow_backend.graph;

import com.renflow.renflow_backend.model.domain.Block;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency derived from one scene's ports and connections. Read-only once built;
 * lives for the duration of a single scene rendering.
 */
public class ConnectionIndex {

    /** Top-to-bottom, then left-to-right: the order used wherever the graph itself gives none. */
    public static final Comparator<Block> CANVAS_ORDER =
            Comparator.comparingDouble(Block::getY).thenComparingDouble(Block::getX);

    private final Map<String, Block> blocks;
    private final Map<String, List<Successor>> forward;
    private final Map<String, Set<String>> reverse;

    @Getter
    private final List<Block> startBlocks;

    ConnectionIndex(Map<String, Block> blocks,
                    Map<String, List<Successor>> forward,
                    Map<String, Set<String>> reverse,
                    List<Block> startBlocks) {
        this.blocks = blocks;
        this.forward = forward;
        this.reverse = reverse;
        this.startBlocks = startBlocks;
    }

    public Block block(String blockId) {
        return blocks.get(blockId);
    }

    /** Successors ordered by ascending distance. */
    public List<Successor> successors(String blockId) {
        return forward.getOrDefault(blockId, List.of());
    }

    public Set<String> predecessors(String blockId) {
        return reverse.getOrDefault(blockId, Set.of());
    }

    /**
     * Distinct successor ids in body order for a branching block. Edges leaving ports named
     * "true" and "false" are ordered by that name; all other edges keep the distance order.
     */
    public List<String> branchTargets(String blockId) {
        List<Successor> ordered = new ArrayList<>(successors(blockId));
        ordered.sort(Comparator.comparingInt(s -> branchRank(s.portName())));
        Set<String> targets = new LinkedHashSet<>();
        ordered.forEach(s -> targets.add(s.blockId()));
        return new ArrayList<>(targets);
    }

    private static int branchRank(String portName) {
        if ("true".equalsIgnoreCase(portName)) return 0;
        if ("false".equalsIgnoreCase(portName)) return 2;
        return 1;
    }

    public boolean isReachable(String fromId, String toId) {
        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(fromId);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            for (Successor next : successors(current)) {
                if (next.blockId().equals(toId)) return true;
                if (seen.add(next.blockId())) stack.push(next.blockId());
            }
        }
        return false;
    }

    /** Ids of the start blocks and of every block a start block leads to. */
    public Set<String> reachableFromStart() {
        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        startBlocks.forEach(b -> {
            if (seen.add(b.getId())) stack.push(b.getId());
        });
        while (!stack.isEmpty()) {
            for (Successor next : successors(stack.pop())) {
                if (seen.add(next.blockId())) stack.push(next.blockId());
            }
        }
        return seen;
    }

    /**
     * Kahn's ordering over all blocks of the scene. Among blocks that are ready at the same time
     * the canvas order decides; blocks caught in cycles follow in canvas order.
     */
    public List<Block> topologicalOrder() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        blocks.keySet().forEach(id -> inDegree.put(id, 0));
        forward.values().forEach(edges -> edges.forEach(s -> inDegree.merge(s.blockId(), 1, Integer::sum)));

        List<Block> ordered = new ArrayList<>();
        List<Block> ready = new ArrayList<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.add(blocks.get(id));
        });

        while (!ready.isEmpty()) {
            ready.sort(CANVAS_ORDER);
            Block next = ready.remove(0);
            ordered.add(next);
            for (Successor s : successors(next.getId())) {
                int remaining = inDegree.merge(s.blockId(), -1, Integer::sum);
                if (remaining == 0) ready.add(blocks.get(s.blockId()));
            }
        }

        if (ordered.size() < blocks.size()) {
            Set<String> placed = new HashSet<>();
            ordered.forEach(b -> placed.add(b.getId()));
            blocks.values().stream()
                    .filter(b -> !placed.contains(b.getId()))
                    .sorted(CANVAS_ORDER)
                    .forEach(ordered::add);
        }
        return ordered;
    }
}
