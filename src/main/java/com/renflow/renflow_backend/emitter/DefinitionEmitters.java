package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

// Definition-only blocks: the assembler hoists them into the preamble, so they are not reached from a flow

@Component
class ImageEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.IMAGE; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        String name = params.text("name");
        String path = params.text("path");
        if (name.isEmpty() || path.isEmpty()) return "";
        return ScriptText.imageDefinition(indent, context.images().resolve(name), path);
    }
}

@Component
class CharacterEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.CHARACTER; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        String name = params.text("name");
        if (name.isEmpty()) return "";
        return ScriptText.characterDefinition(indent, context.characters().resolve(name), params.text("display_name"));
    }
}

@Slf4j
@Component
class StyleEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.STYLE; }

    // Styles are authored in the project's gui files, not in the flow
    @Override
    public String emit(Block block, String indent, RenderContext context) {
        log.debug("Style block {} has no script form, nothing emitted", block.getId());
        return "";
    }
}
