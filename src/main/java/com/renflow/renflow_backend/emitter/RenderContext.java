package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.Scene;
import com.renflow.renflow_backend.naming.LabelNames;
import com.renflow.renflow_backend.naming.NameRegistry;

import java.util.Set;

/**
 * Project-wide facts every emitter may consult while one script is generated.
 * Built once per generation call by the assembler; {@link #forScene} narrows it to the scene being rendered.
 */
public record RenderContext(
        NameRegistry characters,
        NameRegistry images,
        Set<String> knownLabels,
        LabelNames labels,
        Scene scene
) {

    public RenderContext forScene(Scene current) {
        return new RenderContext(characters, images, knownLabels, labels, current);
    }

    public boolean isKnownLabel(String label) {
        return label != null && knownLabels.contains(label);
    }
}
