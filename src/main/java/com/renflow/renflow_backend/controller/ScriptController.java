package com.renflow.renflow_backend.controller;

import com.renflow.renflow_backend.model.domain.BlockType;
import com.renflow.renflow_backend.model.dto.BlockTypeDto;
import com.renflow.renflow_backend.model.dto.ProjectDto;
import com.renflow.renflow_backend.service.ProjectMapper;
import com.renflow.renflow_backend.service.ScriptGenerationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/scripts")
@RequiredArgsConstructor
public class ScriptController {

    private final ScriptGenerationService generationService;
    private final ProjectMapper projectMapper;

    /** Full .rpy script for the posted project. */
    @PostMapping("/generate")
    public ResponseEntity<String> generate(@RequestBody ProjectDto project) {
        return generationService.generate(projectMapper.toDomain(project))
                .map(ScriptController::plainText)
                .orElse(ResponseEntity.badRequest().build());
    }

    /** Image and character definitions only, for the editor's preview pane. */
    @PostMapping("/definitions")
    public ResponseEntity<String> definitions(@RequestBody ProjectDto project) {
        return generationService.generateDefinitions(projectMapper.toDomain(project))
                .map(ScriptController::plainText)
                .orElse(ResponseEntity.badRequest().build());
    }

    @GetMapping("/block-types")
    public List<BlockTypeDto> blockTypes() {
        return Arrays.stream(BlockType.values()).map(BlockTypeDto::of).toList();
    }

    private static ResponseEntity<String> plainText(String body) {
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(body);
    }
}
