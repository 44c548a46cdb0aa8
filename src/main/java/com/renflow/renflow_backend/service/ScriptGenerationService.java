package com.renflow.renflow_backend.service;

import com.renflow.renflow_backend.engine.ScriptAssembler;
import com.renflow.renflow_backend.model.domain.Project;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for callers holding a project snapshot. Generation never mutates the project;
 * the caller must not edit it while a call is in flight.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScriptGenerationService {

    private final ScriptAssembler assembler;

    /**
     * Full script for the project. Empty when there is no project to generate from;
     * a project without scenes yields an empty string.
     */
    public Optional<String> generate(Project project) {
        if (project == null) {
            log.warn("Script generation requested without a project");
            return Optional.empty();
        }
        long started = System.nanoTime();
        String script = assembler.generate(project);
        log.info("Generated script for project '{}': {} scenes, {} blocks, {} chars in {} ms",
                project.getName(), project.getScenes().size(), countBlocks(project), script.length(),
                (System.nanoTime() - started) / 1_000_000);
        return Optional.of(script);
    }

    public Optional<String> generateDefinitions(Project project) {
        if (project == null) {
            log.warn("Definitions requested without a project");
            return Optional.empty();
        }
        return Optional.of(assembler.generateDefinitions(project));
    }

    private static int countBlocks(Project project) {
        return project.getScenes().stream().mapToInt(s -> s.getBlocks().size()).sum();
    }
}
