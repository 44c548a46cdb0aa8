package com.renflow.renflow_backend.engine;

import com.renflow.renflow_backend.emitter.BlockParams;
import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import com.renflow.renflow_backend.model.domain.CharacterProfile;
import com.renflow.renflow_backend.model.domain.Project;
import com.renflow.renflow_backend.model.domain.Scene;
import com.renflow.renflow_backend.naming.NameRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds the definitions preamble from the project dictionaries and the definition-only blocks,
 * then adds a definition for every character that dialogue or show/hide blocks reference without
 * one being declared.
 *
 * When two raw names normalize to the same identifier the first definition wins: project
 * dictionary before inline blocks, inline blocks in scene and block order.
 */
@Slf4j
@Component
public class DefinitionCollector {

    public Definitions collect(Project project) {
        NameRegistry imageNames = new NameRegistry();
        NameRegistry characterNames = new NameRegistry();
        SortedMap<String, String> images = new TreeMap<>();
        SortedMap<String, String> characters = new TreeMap<>();

        collectImages(project, imageNames, images);

        // Display names declared by inline CHARACTER blocks, keyed by raw name
        Map<String, String> inlineDisplayNames = new HashMap<>();

        project.getCharacters().forEach((raw, profile) ->
                define(characterNames, characters, raw, displayNameOf(profile)));

        for (Scene scene : project.getScenes()) {
            for (Block block : scene.getBlocks()) {
                if (block.getType() != BlockType.CHARACTER) continue;
                BlockParams params = BlockParams.of(block);
                String raw = params.text("name");
                if (raw.isEmpty()) continue;
                String displayName = params.text("display_name");
                inlineDisplayNames.putIfAbsent(raw, displayName);
                define(characterNames, characters, raw, displayName);
            }
        }

        for (Scene scene : project.getScenes()) {
            for (Block block : scene.getBlocks()) {
                String raw = referencedCharacter(block);
                if (raw.isEmpty()) continue;
                String id = characterNames.register(raw);
                if (!characters.containsKey(id)) {
                    String displayName = inlineDisplayNames.getOrDefault(raw, raw);
                    characters.put(id, displayName.isEmpty() ? raw : displayName);
                    log.debug("Character '{}' is referenced but never defined, defining it as {}", raw, id);
                }
            }
        }

        return new Definitions(images, characters, imageNames, characterNames);
    }

    private void collectImages(Project project, NameRegistry imageNames, SortedMap<String, String> images) {
        project.getImages().forEach((raw, path) -> {
            if (raw != null && !raw.isBlank() && path != null && !path.isBlank()) {
                images.putIfAbsent(imageNames.register(raw), path.trim());
            }
        });
        for (Scene scene : project.getScenes()) {
            for (Block block : scene.getBlocks()) {
                if (block.getType() != BlockType.IMAGE) continue;
                BlockParams params = BlockParams.of(block);
                String raw = params.text("name");
                String path = params.text("path");
                if (!raw.isEmpty() && !path.isEmpty()) {
                    images.putIfAbsent(imageNames.register(raw), path);
                }
            }
        }
        // Backgrounds are plain image tags unless they name one of the definitions above
        for (Scene scene : project.getScenes()) {
            for (Block block : scene.getBlocks()) {
                if (block.getType() != BlockType.SCENE) continue;
                String background = BlockParams.of(block).text("background");
                if (!background.isEmpty() && !imageNames.contains(background)) {
                    log.debug("Scene background '{}' in scene {} has no image definition", background, scene.getId());
                }
            }
        }
    }

    private void define(NameRegistry names, SortedMap<String, String> characters, String raw, String displayName) {
        if (raw == null || raw.isBlank()) return;
        String id = names.register(raw);
        String existing = characters.get(id);
        if (existing == null) {
            characters.put(id, displayName);
        } else if (!Objects.equals(existing, displayName)) {
            log.warn("Character '{}' normalizes to '{}' which is already defined; keeping the first definition", raw, id);
        }
    }

    private static String displayNameOf(CharacterProfile profile) {
        return profile != null && profile.getDisplayName() != null ? profile.getDisplayName().trim() : "";
    }

    private static String referencedCharacter(Block block) {
        if (block.getType() == BlockType.SAY) {
            return BlockParams.of(block).text("who", "character");
        }
        if (block.getType() == BlockType.SHOW || block.getType() == BlockType.HIDE) {
            return BlockParams.of(block).text("character");
        }
        return "";
    }
}
