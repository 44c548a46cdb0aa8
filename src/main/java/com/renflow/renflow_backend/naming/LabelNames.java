package com.renflow.renflow_backend.naming;

import com.renflow.renflow_backend.emitter.BlockParams;
import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.Scene;

/**
 * Label naming rules shared by label declarations and by the jump/call targets that point at them.
 * The canonical entry label is reserved: a user label with the same name is renamed with {@code _entry}.
 */
public class LabelNames {

    static final String RESERVED_SUFFIX = "_entry";

    private final String entryLabel;

    public LabelNames(String entryLabel) {
        this.entryLabel = entryLabel;
    }

    public String resolve(String raw) {
        String label = raw == null ? "" : raw.trim();
        return label.equals(entryLabel) ? label + RESERVED_SUFFIX : label;
    }

    /** Label declared by an entry-marker block; blank falls back to the scene label. */
    public String ofEntryMarker(Block block, Scene scene) {
        String label = BlockParams.of(block).text("label");
        if (label.isEmpty() && scene != null && scene.getLabel() != null) {
            label = scene.getLabel().trim();
        }
        return resolve(label);
    }

    public String ofLabelBlock(Block block) {
        return resolve(BlockParams.of(block).text("label", "label_name"));
    }
}
