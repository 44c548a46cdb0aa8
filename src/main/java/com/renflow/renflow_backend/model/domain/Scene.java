package com.renflow.renflow_backend.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One label's worth of graph. Ports and connections reference blocks and ports by id;
 * references that do not resolve are skipped by readers rather than rejected here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Scene {

    private String id;

    private String name;

    private String label;

    private List<Block> blocks = new ArrayList<>();

    private List<Port> ports = new ArrayList<>();

    private List<Connection> connections = new ArrayList<>();

    public Scene(String id, String name, String label) {
        this.id = id;
        this.name = name;
        this.label = label;
    }

    public Optional<Block> findBlock(String blockId) {
        return blocks.stream().filter(b -> Objects.equals(b.getId(), blockId)).findFirst();
    }

    public Optional<Port> findPort(String portId) {
        return ports.stream().filter(p -> Objects.equals(p.getId(), portId)).findFirst();
    }

    public void addBlock(Block block) {
        blocks.add(block);
    }

    public void addPort(Port port) {
        ports.add(port);
    }

    public void addConnection(Connection connection) {
        connections.add(connection);
    }

    // Removing a block drops its ports and every connection touching them
    public void removeBlock(String blockId) {
        blocks.removeIf(b -> Objects.equals(b.getId(), blockId));
        Set<String> removedPorts = ports.stream()
                .filter(p -> Objects.equals(blockId, p.getBlockId()))
                .map(Port::getId)
                .collect(Collectors.toSet());
        ports.removeIf(p -> removedPorts.contains(p.getId()));
        connections.removeIf(c -> removedPorts.contains(c.getFromPortId()) || removedPorts.contains(c.getToPortId()));
    }
}
