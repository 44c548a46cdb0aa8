package com.renflow.renflow_backend.graph;

import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import com.renflow.renflow_backend.model.domain.Connection;
import com.renflow.renflow_backend.model.domain.Port;
import com.renflow.renflow_backend.model.domain.Scene;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
public class ConnectionIndexBuilder {

    public ConnectionIndex build(Scene scene) {
        Map<String, Block> blocks = new LinkedHashMap<>();
        for (Block block : scene.getBlocks()) {
            if (block.getId() != null && block.getType() != null) {
                blocks.putIfAbsent(block.getId(), block);
            }
        }

        // port id -> owning port, only for ports whose block is alive
        Map<String, Port> ports = new HashMap<>();
        for (Port port : scene.getPorts()) {
            if (port.getId() != null && blocks.containsKey(port.getBlockId())) {
                ports.put(port.getId(), port);
            }
        }

        Map<String, List<Successor>> forward = new LinkedHashMap<>();
        for (Connection connection : scene.getConnections()) {
            Port from = ports.get(connection.getFromPortId());
            Port to = ports.get(connection.getToPortId());
            if (from == null || to == null) {
                log.debug("Skipping connection {} in scene {}: port {} or {} does not resolve",
                        connection.getId(), scene.getId(), connection.getFromPortId(), connection.getToPortId());
                continue;
            }
            Block source = blocks.get(from.getBlockId());
            Block target = blocks.get(to.getBlockId());
            forward.computeIfAbsent(source.getId(), id -> new ArrayList<>())
                    .add(new Successor(target.getId(), source.distanceTo(target), from.getName()));
        }
        // List.sort is stable: equal distances keep connection order
        forward.values().forEach(edges -> edges.sort(Comparator.comparingDouble(Successor::distance)));

        Map<String, Set<String>> reverse = new HashMap<>();
        forward.forEach((sourceId, edges) -> edges.forEach(s ->
                reverse.computeIfAbsent(s.blockId(), id -> new LinkedHashSet<>()).add(sourceId)));

        List<Block> startBlocks = findStartBlocks(blocks, forward, reverse);
        return new ConnectionIndex(blocks, forward, reverse, startBlocks);
    }

    /*
     * 1. An entry-marker block, if present, is the only start block.
     * 2. Without any connection, every flow block starts its own chain, in canvas order.
     * 3. Otherwise: flow blocks nothing connects into, in canvas order.
     * Definition-only blocks never start a chain.
     */
    private List<Block> findStartBlocks(Map<String, Block> blocks,
                                        Map<String, List<Successor>> forward,
                                        Map<String, Set<String>> reverse) {
        for (Block block : blocks.values()) {
            if (block.getType() == BlockType.START) {
                return List.of(block);
            }
        }
        return blocks.values().stream()
                .filter(b -> !b.getType().isDefinitionOnly())
                .filter(b -> forward.isEmpty() || !reverse.containsKey(b.getId()))
                .sorted(ConnectionIndex.CANVAS_ORDER)
                .toList();
    }
}
