package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Header line plus one nested body; an empty body becomes a placeholder so the construct stays valid.
 */
abstract class NestedBodyEmitter implements BranchEmitter {

    @Override
    public boolean isComplete(Block block) {
        return !header(BlockParams.of(block)).isEmpty();
    }

    @Override
    public String emit(Block block, String indent, RenderContext context, String primaryBody, String alternateBody) {
        String header = header(BlockParams.of(block));
        if (header.isEmpty()) return "";

        StringBuilder out = new StringBuilder(ScriptText.line(indent, header + ":"));
        appendBody(out, indent, primaryBody);
        return out.toString();
    }

    // "" when required params are missing
    protected abstract String header(BlockParams params);

    protected static void appendBody(StringBuilder out, String indent, String body) {
        if (body == null || body.isBlank()) {
            out.append(ScriptText.line(indent + ScriptText.INDENT, ScriptText.PASS));
        } else {
            out.append(body);
        }
    }
}

/*
 * Params: { "condition": "has_key and not door_open" }
 * Outputs: true -> primary body, false -> alternate body (else clause only when non-empty)
 */
@Component
class IfEmitter extends NestedBodyEmitter {

    @Override public BlockType supportedType() { return BlockType.IF; }

    @Override
    protected String header(BlockParams params) {
        String condition = params.text("condition");
        return condition.isEmpty() ? "" : "if " + condition;
    }

    @Override
    public String emit(Block block, String indent, RenderContext context, String primaryBody, String alternateBody) {
        String out = super.emit(block, indent, context, primaryBody, alternateBody);
        if (out.isEmpty() || alternateBody == null || alternateBody.isBlank()) return out;
        return out + ScriptText.line(indent, "else:") + alternateBody;
    }
}

@Component
class WhileEmitter extends NestedBodyEmitter {

    @Override public BlockType supportedType() { return BlockType.WHILE; }

    @Override
    protected String header(BlockParams params) {
        String condition = params.text("condition");
        return condition.isEmpty() ? "" : "while " + condition;
    }
}

@Component
class ForEmitter extends NestedBodyEmitter {

    @Override public BlockType supportedType() { return BlockType.FOR; }

    @Override
    protected String header(BlockParams params) {
        String variable = params.text("variable");
        String iterable = params.text("iterable");
        return variable.isEmpty() || iterable.isEmpty() ? "" : "for " + variable + " in " + iterable;
    }
}

/**
 * ELIF/ELSE only make sense as clauses of an IF rendering; placed on their own they emit nothing.
 */
@Slf4j
abstract class ClauseEmitter implements BlockEmitter {

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        log.debug("{} block {} is not attached to an if, nothing emitted", supportedType(), block.getId());
        return "";
    }
}

@Component
class ElifEmitter extends ClauseEmitter {
    @Override public BlockType supportedType() { return BlockType.ELIF; }
}

@Component
class ElseEmitter extends ClauseEmitter {
    @Override public BlockType supportedType() { return BlockType.ELSE; }
}
