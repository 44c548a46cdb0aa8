package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.BlockType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.renflow.renflow_backend.emitter.EmitterFixtures.block;
import static com.renflow.renflow_backend.emitter.EmitterFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

class AudioEmittersTest {

    private final BlockEmitterRegistry registry = EmitterFixtures.registry();

    private String emit(BlockType type, Map<String, ?> params) {
        return registry.get(type).emit(block(type, params), "    ", context());
    }

    @Test
    void soundLoopsOnlyWhenAsked() {
        assertThat(emit(BlockType.SOUND, Map.of("sound_file", "door.ogg", "fadein", "0.5", "fadeout", 1, "loop", true)))
                .isEqualTo("    play sound \"door.ogg\" fadein 0.5 fadeout 1 loop\n");
        assertThat(emit(BlockType.SOUND, Map.of("sound_file", "door.ogg")))
                .isEqualTo("    play sound \"door.ogg\"\n");
    }

    @Test
    void musicStatesLoopEitherWay() {
        assertThat(emit(BlockType.MUSIC, Map.of("music_file", "theme.ogg")))
                .isEqualTo("    play music \"theme.ogg\" loop\n");
        assertThat(emit(BlockType.MUSIC, Map.of("music_file", "theme.ogg", "loop", false)))
                .isEqualTo("    play music \"theme.ogg\" noloop\n");
        assertThat(emit(BlockType.MUSIC, Map.of("music_file", "theme.ogg", "loop", "no")))
                .isEqualTo("    play music \"theme.ogg\" noloop\n");
    }

    @Test
    void queueStatementsIgnoreFadeout() {
        assertThat(emit(BlockType.QUEUE_MUSIC, Map.of("music_file", "next.ogg", "fadeout", "1", "loop", "yes")))
                .isEqualTo("    queue music \"next.ogg\" loop\n");
        assertThat(emit(BlockType.QUEUE_SOUND, Map.of("sound_file", "s.ogg", "fadeout", "1", "loop", true)))
                .isEqualTo("    queue sound \"s.ogg\"\n");
    }

    @Test
    void missingFileEmitsNothing() {
        assertThat(emit(BlockType.SOUND, Map.of())).isEmpty();
        assertThat(emit(BlockType.MUSIC, Map.of("loop", true))).isEmpty();
    }

    @Test
    void stopChannels() {
        assertThat(emit(BlockType.STOP_MUSIC, Map.of("fadeout", "2.0"))).isEqualTo("    stop music fadeout 2.0\n");
        assertThat(emit(BlockType.STOP_SOUND, Map.of())).isEqualTo("    stop sound\n");
    }
}
