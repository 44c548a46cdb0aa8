package com.renflow.renflow_backend.model.dto;

import java.util.Collections;
import java.util.List;

public record SceneDto(
    String id,
    String name,
    String label,
    List<BlockDto> blocks,
    List<PortDto> ports,
    List<ConnectionDto> connections
) {
    public List<BlockDto> blocks() {
        return blocks != null ? blocks : Collections.emptyList();
    }

    public List<PortDto> ports() {
        return ports != null ? ports : Collections.emptyList();
    }

    public List<ConnectionDto> connections() {
        return connections != null ? connections : Collections.emptyList();
    }
}
