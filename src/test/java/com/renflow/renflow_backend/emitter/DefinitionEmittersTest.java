package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.BlockType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.renflow.renflow_backend.emitter.EmitterFixtures.block;
import static com.renflow.renflow_backend.emitter.EmitterFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

class DefinitionEmittersTest {

    private final BlockEmitterRegistry registry = EmitterFixtures.registry();

    private String emit(BlockType type, Map<String, ?> params) {
        return registry.get(type).emit(block(type, params), "", context());
    }

    @Test
    void imageDefinition() {
        assertThat(emit(BlockType.IMAGE, Map.of("name", "bg room", "path", "images/room.png")))
                .isEqualTo("image bg_room = \"images/room.png\"\n");
        assertThat(emit(BlockType.IMAGE, Map.of("name", "bg room"))).isEmpty();
    }

    @Test
    void characterDefinition() {
        assertThat(emit(BlockType.CHARACTER, Map.of("name", "Jane Doe", "display_name", "Jane")))
                .isEqualTo("define Jane_Doe = Character('Jane')\n");
        assertThat(emit(BlockType.CHARACTER, Map.of("name", "narrator")))
                .isEqualTo("define narrator = Character(None)\n");
    }

    @Test
    void styleHasNoScriptForm() {
        assertThat(emit(BlockType.STYLE, Map.of("name", "say_window"))).isEmpty();
    }
}
