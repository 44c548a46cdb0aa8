package com.renflow.renflow_backend.engine;

import com.renflow.renflow_backend.emitter.ScriptText;
import com.renflow.renflow_backend.naming.NameRegistry;

import java.util.Map;
import java.util.SortedMap;

/**
 * Project-wide image and character definitions, keyed by generated identifier and sorted by it.
 * The registries map every raw name seen while collecting to its identifier.
 */
public record Definitions(
        SortedMap<String, String> images,
        SortedMap<String, String> characters,
        NameRegistry imageNames,
        NameRegistry characterNames
) {

    /** The definitions preamble; a section without entries is left out entirely. */
    public String render() {
        StringBuilder out = new StringBuilder();
        if (!images.isEmpty()) {
            out.append("# Image Definitions\n");
            for (Map.Entry<String, String> image : images.entrySet()) {
                out.append(ScriptText.imageDefinition("", image.getKey(), image.getValue()));
            }
            out.append("\n");
        }
        if (!characters.isEmpty()) {
            out.append("# Character Definitions\n");
            for (Map.Entry<String, String> character : characters.entrySet()) {
                out.append(ScriptText.characterDefinition("", character.getKey(), character.getValue()));
            }
            out.append("\n");
        }
        return out.toString();
    }
}
