package com.renflow.renflow_backend.service;

import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.CharacterProfile;
import com.renflow.renflow_backend.model.domain.Connection;
import com.renflow.renflow_backend.model.domain.Port;
import com.renflow.renflow_backend.model.domain.Project;
import com.renflow.renflow_backend.model.domain.Scene;
import com.renflow.renflow_backend.model.dto.BlockDto;
import com.renflow.renflow_backend.model.dto.ConnectionDto;
import com.renflow.renflow_backend.model.dto.PortDto;
import com.renflow.renflow_backend.model.dto.ProjectDto;
import com.renflow.renflow_backend.model.dto.SceneDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request payload -> domain snapshot. Blocks without an id or a type are dropped here,
 * so the generator only ever sees well-formed blocks.
 */
@Slf4j
@Component
public class ProjectMapper {

    public Project toDomain(ProjectDto dto) {
        Project project = new Project(dto.name());
        project.getImages().putAll(dto.images());
        dto.characters().forEach((name, value) -> project.getCharacters().put(name, toProfile(value)));
        for (SceneDto scene : dto.scenes()) {
            if (scene == null) {
                log.warn("Dropping empty scene entry in project '{}'", dto.name());
                continue;
            }
            project.addScene(toDomain(scene));
        }
        return project;
    }

    private Scene toDomain(SceneDto dto) {
        Scene scene = new Scene(dto.id(), dto.name(), dto.label());
        for (BlockDto block : dto.blocks()) {
            if (block == null || block.id() == null || block.type() == null) {
                log.warn("Dropping block without id or type in scene {}", dto.id());
                continue;
            }
            scene.addBlock(toDomain(block));
        }
        for (PortDto port : dto.ports()) {
            if (port != null) scene.addPort(new Port(port.id(), port.nodeId(), port.name(), port.direction()));
        }
        for (ConnectionDto connection : dto.connections()) {
            if (connection != null) {
                scene.addConnection(new Connection(connection.id(), connection.fromPortId(), connection.toPortId()));
            }
        }
        return scene;
    }

    private Block toDomain(BlockDto dto) {
        return Block.builder()
                .id(dto.id())
                .type(dto.type())
                .params(dto.params() != null ? new LinkedHashMap<>(dto.params()) : new LinkedHashMap<>())
                .x(dto.x() != null ? dto.x() : 0)
                .y(dto.y() != null ? dto.y() : 0)
                .build();
    }

    // Either the display name itself or { "display_name": "..." }
    private static CharacterProfile toProfile(Object value) {
        if (value instanceof Map<?, ?> map) {
            Object displayName = map.get("display_name");
            if (displayName == null) displayName = map.get("displayName");
            return new CharacterProfile(displayName != null ? String.valueOf(displayName) : null);
        }
        return new CharacterProfile(value != null ? String.valueOf(value) : null);
    }
}
