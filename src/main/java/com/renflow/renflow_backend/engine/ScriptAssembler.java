package com.renflow.renflow_backend.engine;

import com.renflow.renflow_backend.emitter.RenderContext;
import com.renflow.renflow_backend.emitter.ScriptText;
import com.renflow.renflow_backend.model.domain.Project;
import com.renflow.renflow_backend.model.domain.Scene;
import com.renflow.renflow_backend.naming.LabelNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Renders a whole project:
 *
 *   header
 *   # Image Definitions / # Character Definitions
 *   canonical entry label, jumping to the first entry marker (or returning)
 *   one body per scene, in project order
 *
 * Stateless; every intermediate structure belongs to the call.
 */
@Component
@RequiredArgsConstructor
public class ScriptAssembler {

    private final ScriptFormat format;
    private final DefinitionCollector definitionCollector;
    private final LabelCollector labelCollector;
    private final SceneRenderer sceneRenderer;

    public String generate(Project project) {
        if (project.getScenes().isEmpty()) {
            return "";
        }

        StringBuilder out = new StringBuilder();
        out.append(format.headerTitle()).append("\n");
        out.append(format.headerNotice()).append("\n\n");

        Definitions definitions = definitionCollector.collect(project);
        out.append(definitions.render());

        // Every label must be known before the first jump is checked against them
        LabelNames labelNames = new LabelNames(format.entryLabel());
        LabelCollector.Labels labels = labelCollector.collect(project, labelNames);
        out.append(entrySection(labels));

        RenderContext context = new RenderContext(
                definitions.characterNames(),
                definitions.imageNames(),
                labels.declared(),
                labelNames,
                null);
        for (Scene scene : project.getScenes()) {
            out.append(sceneRenderer.render(scene, context));
        }
        return out.toString();
    }

    /** The definitions preamble alone, without header, entry label or scene bodies. */
    public String generateDefinitions(Project project) {
        return definitionCollector.collect(project).render();
    }

    private String entrySection(LabelCollector.Labels labels) {
        String statement = labels.hasEntryMarker() ? "jump " + labels.firstEntryMarker() : "return";
        return "# Entry point\n"
                + "label " + format.entryLabel() + ":\n"
                + ScriptText.line(ScriptText.INDENT, statement)
                + "\n";
    }
}
