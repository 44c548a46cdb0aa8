package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.Block;

/**
 * Emitter for blocks that own nested bodies (if/while/for). Bodies arrive pre-rendered one
 * indent level deeper than the block itself and are inserted verbatim.
 */
public interface BranchEmitter extends BlockEmitter {

    /** False when required parameters are missing; the block then contributes nothing. */
    boolean isComplete(Block block);

    String emit(Block block, String indent, RenderContext context, String primaryBody, String alternateBody);

    /** Used when the block is reached outside a traversal: every body becomes a placeholder. */
    @Override
    default String emit(Block block, String indent, RenderContext context) {
        return emit(block, indent, context, null, null);
    }
}
