package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import org.springframework.stereotype.Component;

/**
 * play/queue statements: {@code <verb> <channel> "<file>" [fadein x] [fadeout y] [loop|noloop]}.
 * Which optional clauses a statement supports, and how an unset loop flag reads, differs per block type.
 */
abstract class AudioFileEmitter implements BlockEmitter {

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        String file = params.text(fileKey());
        if (file.isEmpty()) return "";

        StringBuilder line = new StringBuilder(statement()).append(' ').append(ScriptText.quoted(file));
        String fadein = params.text("fadein");
        if (!fadein.isEmpty()) line.append(" fadein ").append(fadein);
        if (supportsFadeout()) {
            String fadeout = params.text("fadeout");
            if (!fadeout.isEmpty()) line.append(" fadeout ").append(fadeout);
        }
        appendLoop(line, params);
        return ScriptText.line(indent, line.toString());
    }

    protected abstract String statement();

    protected abstract String fileKey();

    protected boolean supportsFadeout() {
        return true;
    }

    // Default: "loop" only when explicitly requested
    protected void appendLoop(StringBuilder line, BlockParams params) {
        if (params.flag("loop", false)) line.append(" loop");
    }
}

@Component
class SoundEmitter extends AudioFileEmitter {

    @Override public BlockType supportedType() { return BlockType.SOUND; }
    @Override protected String statement() { return "play sound"; }
    @Override protected String fileKey() { return "sound_file"; }
}

// Music loops unless told otherwise, and says so explicitly either way
@Component
class MusicEmitter extends AudioFileEmitter {

    @Override public BlockType supportedType() { return BlockType.MUSIC; }
    @Override protected String statement() { return "play music"; }
    @Override protected String fileKey() { return "music_file"; }

    @Override
    protected void appendLoop(StringBuilder line, BlockParams params) {
        line.append(params.flag("loop", true) ? " loop" : " noloop");
    }
}

@Component
class QueueMusicEmitter extends AudioFileEmitter {

    @Override public BlockType supportedType() { return BlockType.QUEUE_MUSIC; }
    @Override protected String statement() { return "queue music"; }
    @Override protected String fileKey() { return "music_file"; }
    @Override protected boolean supportsFadeout() { return false; }
}

@Component
class QueueSoundEmitter extends AudioFileEmitter {

    @Override public BlockType supportedType() { return BlockType.QUEUE_SOUND; }
    @Override protected String statement() { return "queue sound"; }
    @Override protected String fileKey() { return "sound_file"; }
    @Override protected boolean supportsFadeout() { return false; }
    @Override protected void appendLoop(StringBuilder line, BlockParams params) { }
}

abstract class StopChannelEmitter implements BlockEmitter {

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        String fadeout = BlockParams.of(block).text("fadeout");
        String statement = "stop " + channel();
        return ScriptText.line(indent, fadeout.isEmpty() ? statement : statement + " fadeout " + fadeout);
    }

    protected abstract String channel();
}

@Component
class StopMusicEmitter extends StopChannelEmitter {
    @Override public BlockType supportedType() { return BlockType.STOP_MUSIC; }
    @Override protected String channel() { return "music"; }
}

@Component
class StopSoundEmitter extends StopChannelEmitter {
    @Override public BlockType supportedType() { return BlockType.STOP_SOUND; }
    @Override protected String channel() { return "sound"; }
}
