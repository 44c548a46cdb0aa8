package com.renflow.renflow_backend.engine;

import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import com.renflow.renflow_backend.model.domain.Project;
import com.renflow.renflow_backend.model.domain.Scene;
import com.renflow.renflow_backend.naming.LabelNames;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Gathers every label the finished script will declare before any scene is rendered,
 * so jump/call targets are checked against the whole project.
 */
@Component
public class LabelCollector {

    public record Labels(Set<String> declared, String firstEntryMarker) {

        public boolean hasEntryMarker() {
            return firstEntryMarker != null;
        }
    }

    public Labels collect(Project project, LabelNames labelNames) {
        Set<String> declared = new LinkedHashSet<>();
        String firstEntryMarker = null;

        for (Scene scene : project.getScenes()) {
            for (Block block : scene.getBlocks()) {
                if (block.getType() == BlockType.START) {
                    String label = labelNames.ofEntryMarker(block, scene);
                    if (label.isEmpty()) continue;
                    declared.add(label);
                    if (firstEntryMarker == null) firstEntryMarker = label;
                } else if (block.getType() == BlockType.LABEL) {
                    String label = labelNames.ofLabelBlock(block);
                    if (!label.isEmpty()) declared.add(label);
                }
            }
        }
        return new Labels(declared, firstEntryMarker);
    }
}
