package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

// Labels are always declared at column 0, whatever the indent of the surrounding flow
@Component
class StartEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.START; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        String label = context.labels().ofEntryMarker(block, context.scene());
        return label.isEmpty() ? "" : "label " + label + ":\n";
    }
}

@Component
class LabelEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.LABEL; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        String label = context.labels().ofLabelBlock(block);
        return label.isEmpty() ? "" : "label " + label + ":\n";
    }
}

/**
 * Shared by jump and call: the target must be a label some scene declares, otherwise the
 * statement is dropped instead of pointing at a label that will not exist.
 */
@Slf4j
abstract class TransferEmitter implements BlockEmitter {

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        String target = target(BlockParams.of(block));
        if (target.isEmpty()) return "";

        String label = context.labels().resolve(target);
        if (!context.isKnownLabel(label)) {
            log.debug("Dropping {} in block {}: label '{}' is not declared by any scene", keyword(), block.getId(), label);
            return "";
        }
        return ScriptText.line(indent, keyword() + " " + label);
    }

    protected abstract String keyword();

    protected abstract String target(BlockParams params);
}

@Component
class JumpEmitter extends TransferEmitter {

    @Override public BlockType supportedType() { return BlockType.JUMP; }
    @Override protected String keyword() { return "jump"; }
    @Override protected String target(BlockParams params) { return params.text("target", "label"); }
}

@Component
class CallEmitter extends TransferEmitter {

    @Override public BlockType supportedType() { return BlockType.CALL; }
    @Override protected String keyword() { return "call"; }
    @Override protected String target(BlockParams params) { return params.text("label", "target"); }
}

@Component
class ReturnEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.RETURN; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        return ScriptText.line(indent, "return");
    }
}
