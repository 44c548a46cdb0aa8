package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;

public interface BlockEmitter {

    BlockType supportedType();

    // Newline-terminated script lines for the block, or "" when its parameters are incomplete
    String emit(Block block, String indent, RenderContext context);
}
