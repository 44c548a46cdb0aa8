package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/*
 * Params:
 * {
 *   "who": "Jane Doe",            // optional, resolved through the character map
 *   "text": "Hello \"there\"",
 *   "expression": "happy",        // optional, only with a speaker
 *   "at": "left",                 // optional, only with a speaker
 *   "with_transition": "dissolve" // optional, only with a speaker
 * }
 */
@Component
class SayEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.SAY; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        String text = params.text("text");
        if (text.isEmpty()) return "";

        String who = params.text("who", "character");
        if (who.isEmpty()) {
            return ScriptText.line(indent, ScriptText.quoted(text));
        }

        StringBuilder line = new StringBuilder(context.characters().resolve(who));
        String expression = params.text("expression");
        if (!expression.isEmpty()) line.append(' ').append(expression);
        line.append(' ').append(ScriptText.quoted(text));

        List<String> clauses = new ArrayList<>();
        String at = params.text("at");
        if (!at.isEmpty()) clauses.add("at " + at);
        String transition = params.text("with_transition");
        if (!transition.isEmpty()) clauses.add("with " + transition);
        if (!clauses.isEmpty()) line.append(' ').append(String.join(" ", clauses));

        return ScriptText.line(indent, line.toString());
    }
}

@Component
class NarrationEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.NARRATION; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        String text = params.text("text");
        if (text.isEmpty()) return "";

        String transition = params.text("with_transition");
        String statement = ScriptText.quoted(text);
        return ScriptText.line(indent, transition.isEmpty() ? statement : statement + " with " + transition);
    }
}

@Component
class VoiceEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.VOICE; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        String file = BlockParams.of(block).text("voice_file");
        return file.isEmpty() ? "" : ScriptText.line(indent, "voice " + ScriptText.quoted(file));
    }
}

@Component
class CenterEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.CENTER; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        String text = BlockParams.of(block).text("text");
        return text.isEmpty() ? "" : ScriptText.line(indent, "centered " + ScriptText.quoted(text));
    }
}

@Component
class TextEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.TEXT; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        String text = params.text("text");
        if (text.isEmpty()) return "";

        StringBuilder line = new StringBuilder("text ").append(ScriptText.quoted(text));
        String xpos = params.text("xpos");
        if (!xpos.isEmpty()) line.append(" xpos ").append(xpos);
        String ypos = params.text("ypos");
        if (!ypos.isEmpty()) line.append(" ypos ").append(ypos);
        return ScriptText.line(indent, line.toString());
    }
}
