package com.renflow.renflow_backend.model.dto;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Request body for the script endpoints: the project as the editor persists it.
 * Null-safe: null collections are treated as empty.
 * A character value is either the display name itself or an object with "display_name".
 */
public record ProjectDto(
    String name,
    Map<String, String> images,
    Map<String, Object> characters,
    List<SceneDto> scenes
) {
    public Map<String, String> images() {
        return images != null ? images : Collections.emptyMap();
    }

    public Map<String, Object> characters() {
        return characters != null ? characters : Collections.emptyMap();
    }

    public List<SceneDto> scenes() {
        return scenes != null ? scenes : Collections.emptyList();
    }
}
