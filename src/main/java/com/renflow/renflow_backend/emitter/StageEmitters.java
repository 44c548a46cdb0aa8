package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import org.springframework.stereotype.Component;

/*
 * Params: { "background": "bg room", "layer": "master", "transition": "fade" }
 * A background naming a defined image is replaced by that image's identifier.
 */
@Component
class SceneEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.SCENE; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        String background = params.textOrDefault("background", "black");
        if (context.images().contains(background)) {
            background = context.images().resolve(background);
        }

        StringBuilder line = new StringBuilder("scene ").append(background);
        String layer = params.text("layer");
        if (!layer.isEmpty()) line.append(" onlayer ").append(layer);
        String transition = params.text("transition");
        if (!transition.isEmpty()) line.append(" with ").append(transition);
        return ScriptText.line(indent, line.toString());
    }
}

/*
 * Params: { "character": "Jane Doe", "expression": "happy", "at": "left", "behind": "bob",
 *           "zorder": "2", "layer": "master", "transition": "dissolve" }
 * Clauses are written in that order, each only when set.
 */
@Component
class ShowEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.SHOW; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        String character = params.text("character");
        if (character.isEmpty()) return "";

        StringBuilder line = new StringBuilder("show ").append(context.characters().resolve(character));
        appendClause(line, "", params.text("expression"));
        appendClause(line, "at ", params.text("at"));
        appendClause(line, "behind ", params.text("behind"));
        appendClause(line, "zorder ", params.text("zorder"));
        appendClause(line, "onlayer ", params.text("layer"));
        appendClause(line, "with ", params.text("transition"));
        return ScriptText.line(indent, line.toString());
    }

    static void appendClause(StringBuilder line, String keyword, String value) {
        if (!value.isEmpty()) {
            line.append(' ').append(keyword).append(value);
        }
    }
}

@Component
class HideEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.HIDE; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        String character = params.text("character");
        if (character.isEmpty()) return "";

        StringBuilder line = new StringBuilder("hide ").append(context.characters().resolve(character));
        ShowEmitter.appendClause(line, "onlayer ", params.text("layer"));
        ShowEmitter.appendClause(line, "with ", params.text("transition"));
        return ScriptText.line(indent, line.toString());
    }
}

@Component
class PauseEmitter implements BlockEmitter {

    private static final String DEFAULT_DURATION = "1.0";

    @Override public BlockType supportedType() { return BlockType.PAUSE; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        String duration = BlockParams.of(block).textOrDefault("duration", DEFAULT_DURATION);
        if (!ScriptText.isNumber(duration)) {
            duration = DEFAULT_DURATION;
        }
        return ScriptText.line(indent, "$ renpy.pause(" + duration + ")");
    }
}

/**
 * TRANSITION and WITH both render a bare with-statement; they are separate palette entries only.
 */
abstract class WithStatementEmitter implements BlockEmitter {

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        String transition = BlockParams.of(block).textOrDefault("transition", "dissolve");
        return ScriptText.line(indent, "with " + transition);
    }
}

@Component
class TransitionEmitter extends WithStatementEmitter {
    @Override public BlockType supportedType() { return BlockType.TRANSITION; }
}

@Component
class WithEmitter extends WithStatementEmitter {
    @Override public BlockType supportedType() { return BlockType.WITH; }
}
