package com.renflow.renflow_backend.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Project {

    private String name;

    // Order is significant: scenes are emitted in this order
    private List<Scene> scenes = new ArrayList<>();

    // Image name -> file path
    private Map<String, String> images = new LinkedHashMap<>();

    // Character name as typed by the author -> profile
    private Map<String, CharacterProfile> characters = new LinkedHashMap<>();

    public Project(String name) {
        this.name = name;
    }

    public void addScene(Scene scene) {
        scenes.add(scene);
    }
}
