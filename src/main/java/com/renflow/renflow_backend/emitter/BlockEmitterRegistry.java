package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.BlockType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class BlockEmitterRegistry {

    private final List<BlockEmitter> emitters;
    private final Map<BlockType, BlockEmitter> registry = new EnumMap<>(BlockType.class);

    // Every block type must have exactly one emitter; a gap is a programming error caught at startup
    @PostConstruct
    public void init() {
        for (BlockEmitter emitter : emitters) {
            BlockEmitter previous = registry.put(emitter.supportedType(), emitter);
            if (previous != null) {
                throw new IllegalStateException("Two emitters registered for block type " + emitter.supportedType()
                        + ": " + previous.getClass().getSimpleName() + ", " + emitter.getClass().getSimpleName());
            }
        }
        Set<BlockType> missing = EnumSet.allOf(BlockType.class);
        missing.removeAll(registry.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No emitter registered for block types: " + missing);
        }
    }

    public BlockEmitter get(BlockType type) {
        BlockEmitter emitter = registry.get(type);
        if (emitter == null) {
            throw new UnsupportedOperationException("No emitter registered for block type: " + type);
        }
        return emitter;
    }
}
