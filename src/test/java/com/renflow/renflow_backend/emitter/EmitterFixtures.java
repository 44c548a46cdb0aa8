package com.renflow.renflow_backend.emitter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import com.renflow.renflow_backend.naming.LabelNames;
import com.renflow.renflow_backend.naming.NameRegistry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The emitter set as the application context wires it, without starting one.
 */
public final class EmitterFixtures {

    private EmitterFixtures() {
    }

    public static List<BlockEmitter> allEmitters() {
        return List.of(
                new StartEmitter(), new LabelEmitter(), new JumpEmitter(), new CallEmitter(), new ReturnEmitter(),
                new SayEmitter(), new NarrationEmitter(), new MenuEmitter(new ObjectMapper()), new VoiceEmitter(),
                new CenterEmitter(), new TextEmitter(),
                new IfEmitter(), new ElifEmitter(), new ElseEmitter(), new WhileEmitter(), new ForEmitter(),
                new SceneEmitter(), new ShowEmitter(), new HideEmitter(), new ImageEmitter(), new PauseEmitter(),
                new TransitionEmitter(), new WithEmitter(),
                new SoundEmitter(), new MusicEmitter(), new StopMusicEmitter(), new StopSoundEmitter(),
                new QueueMusicEmitter(), new QueueSoundEmitter(),
                new SetVarEmitter(), new DefaultEmitter(), new DefineEmitter(), new PythonEmitter(),
                new CharacterEmitter(), new StyleEmitter());
    }

    public static BlockEmitterRegistry registry() {
        BlockEmitterRegistry registry = new BlockEmitterRegistry(allEmitters());
        registry.init();
        return registry;
    }

    public static RenderContext context(String... knownLabels) {
        return new RenderContext(new NameRegistry(), new NameRegistry(), Set.of(knownLabels), new LabelNames("start"), null);
    }

    public static Block block(BlockType type, Map<String, ?> params) {
        return Block.builder().id(type.name().toLowerCase()).type(type).params(new LinkedHashMap<>(params)).build();
    }
}
