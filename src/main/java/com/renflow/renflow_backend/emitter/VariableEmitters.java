package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import com.renflow.renflow_backend.naming.NameNormalizer;
import org.springframework.stereotype.Component;

/*
 * Params: { "variable": "affection", "value": "10" }
 * Value formatting follows ScriptText.literal: 10 -> 10, hello -> "hello", [1, 2] -> [1, 2]
 */
@Component
class SetVarEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.SET_VAR; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        String variable = params.text("variable");
        if (variable.isEmpty()) return "";
        return ScriptText.line(indent, "$ " + variable + " = " + ScriptText.literal(params.text("value")));
    }
}

@Component
class DefaultEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.DEFAULT; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        String variable = params.text("variable");
        if (variable.isEmpty()) return "";
        return ScriptText.line(indent, "default " + variable + " = " + ScriptText.literal(params.text("value")));
    }
}

// Constants are identifiers the author names freely, so they go through name normalization
@Component
class DefineEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.DEFINE; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        String name = params.text("name");
        if (name.isEmpty()) return "";
        String constant = NameNormalizer.normalize(name);
        return ScriptText.line(indent, "define " + constant + " = " + ScriptText.literal(params.text("value")));
    }
}

@Component
class PythonEmitter implements BlockEmitter {

    @Override public BlockType supportedType() { return BlockType.PYTHON; }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        String code = BlockParams.of(block).text("code");
        if (code.isEmpty()) return "";

        StringBuilder out = new StringBuilder(ScriptText.line(indent, "python:"));
        String bodyIndent = indent + ScriptText.INDENT;
        for (String line : code.split("\\R", -1)) {
            out.append(line.isBlank() ? "\n" : ScriptText.line(bodyIndent, line.stripTrailing()));
        }
        return out.toString();
    }
}
